package io.hivemesh.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hivemesh.model.BrainstormPayload;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.MessageType;
import io.hivemesh.model.Payload;
import io.hivemesh.model.ResultPayload;
import io.hivemesh.model.StatusPayload;
import io.hivemesh.model.TaskPayload;
import io.hivemesh.util.Jsons;

import java.io.IOException;

/**
 * JSON wire format: {@code {id, type, from, timestamp, <payloadField>: {...}}}.
 */
public final class EnvelopeCodec {
    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(Jsons.compact());
    }

    EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(Envelope envelope) {
        ObjectNode root = mapper.createObjectNode();
        root.put("id", envelope.id());
        root.put("type", envelope.type().wireName());
        root.put("from", envelope.from());
        root.put("timestamp", envelope.timestamp());
        if (envelope.payload() != null) {
            root.set(envelope.type().payloadField(), mapper.valueToTree(envelope.payload()));
        }
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to encode envelope " + envelope.id(), e);
        }
    }

    public Envelope decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new EnvelopeParseException("Empty message body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new EnvelopeParseException("Message body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeParseException("Message body is not a JSON object");
        }
        MessageType type;
        try {
            type = MessageType.fromWire(root.path("type").asText(null));
        } catch (IllegalArgumentException e) {
            throw new EnvelopeParseException(e.getMessage(), e);
        }
        JsonNode payloadNode = root.get(type.payloadField());
        Payload payload = null;
        if (payloadNode != null && !payloadNode.isNull()) {
            try {
                payload = mapper.treeToValue(payloadNode, payloadClass(type));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new EnvelopeParseException("Malformed " + type.wireName() + " body", e);
            }
        }
        return new Envelope(
                textOrNull(root, "id"),
                type,
                textOrNull(root, "from"),
                root.path("timestamp").asLong(0L),
                payload
        );
    }

    private static Class<? extends Payload> payloadClass(MessageType type) {
        return switch (type) {
            case TASK -> TaskPayload.class;
            case BRAINSTORM -> BrainstormPayload.class;
            case RESULT -> ResultPayload.class;
            case STATUS -> StatusPayload.class;
        };
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
