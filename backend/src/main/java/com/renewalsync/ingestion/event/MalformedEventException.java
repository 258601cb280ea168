package com.renewalsync.ingestion.event;

/**
 * A known contract event kind whose payload lacks a required field or carries it in an unusable form.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }
}
