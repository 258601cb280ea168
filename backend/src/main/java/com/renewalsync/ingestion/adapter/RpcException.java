package com.renewalsync.ingestion.adapter;

/**
 * Thrown when a ledger RPC call fails (transport, HTTP status, JSON-RPC error or unparseable body).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
