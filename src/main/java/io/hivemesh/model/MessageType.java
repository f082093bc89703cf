package io.hivemesh.model;

import java.util.Locale;

/**
 * Envelope kinds. Each kind carries its payload under its own JSON field.
 */
public enum MessageType {
    TASK("task", "task"),
    BRAINSTORM("brainstorm", "message"),
    RESULT("result", "result"),
    STATUS("status", "status");

    private final String wireName;
    private final String payloadField;

    MessageType(String wireName, String payloadField) {
        this.wireName = wireName;
        this.payloadField = payloadField;
    }

    public String wireName() {
        return wireName;
    }

    public String payloadField() {
        return payloadField;
    }

    public static MessageType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Message type is missing");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (MessageType value : values()) {
            if (value.wireName.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
