package com.renewalsync.ingestion.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.renewalsync.ingestion.adapter.ContractEvent;

import java.util.Optional;

/**
 * Field access over a contract event's {@code value}. Integer fields are accepted as whole JSON numbers
 * (including {@code 2.0}) or as decimal strings (u64 values are often serialized as strings).
 */
final class EventPayload {

    private final ContractEvent event;
    private final JsonNode value;

    private EventPayload(ContractEvent event) {
        this.event = event;
        this.value = event.value();
    }

    static EventPayload of(ContractEvent event) {
        return new EventPayload(event);
    }

    long subId() {
        return requireLong("sub_id");
    }

    long requireLong(String field) {
        return optionalLong(field).orElseThrow(() -> new MalformedEventException(
                event.type() + " at ledger " + event.ledger() + " (tx " + event.txHash() + ") has no numeric " + field));
    }

    Optional<Long> optionalLong(String field) {
        JsonNode node = value == null ? null : value.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber() && node.canConvertToLong() && isWhole(node)) {
            return Optional.of(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Optional.of(Long.parseLong(node.asText().trim()));
            } catch (NumberFormatException e) {
                throw new MalformedEventException(
                        event.type() + " at ledger " + event.ledger() + ": " + field + " is not an integer: " + node.asText());
            }
        }
        throw new MalformedEventException(
                event.type() + " at ledger " + event.ledger() + ": " + field + " is not an integer: " + node);
    }

    private static boolean isWhole(JsonNode node) {
        return node.isIntegralNumber() || node.decimalValue().stripTrailingZeros().scale() <= 0;
    }

    int requireInt(String field) {
        return toInt(field, requireLong(field));
    }

    Optional<Integer> optionalInt(String field) {
        return optionalLong(field).map(v -> toInt(field, v));
    }

    private int toInt(String field, long v) {
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new MalformedEventException(
                    event.type() + " at ledger " + event.ledger() + ": " + field + " out of range: " + v);
        }
        return (int) v;
    }

    String requireText(String field) {
        JsonNode node = value == null ? null : value.get(field);
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new MalformedEventException(
                    event.type() + " at ledger " + event.ledger() + " (tx " + event.txHash() + ") has no " + field);
        }
        return node.asText();
    }

    /** Raw field for log output; "null" when absent. */
    String raw(String field) {
        JsonNode node = value == null ? null : value.get(field);
        return node == null ? "null" : node.asText(node.toString());
    }
}
