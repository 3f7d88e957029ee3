package io.polylog.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Map;

/**
 * Canonical form of every stored value. {@code payloadType} names the wrapped payload and
 * is fixed when the envelope is built; readers never inspect the payload to route it.
 */
public record Envelope(String payloadType, JsonNode payload, String source) {

    /** Routing name for envelopes that do not say what they carry. */
    public static final String TYPE_NAME = "Envelope";

    public Envelope {
        if (payload == null) payload = NullNode.getInstance();
        if (payloadType != null && payloadType.isBlank()) payloadType = null;
    }

    public static Envelope of(String payloadType, JsonNode payload) {
        return new Envelope(payloadType, payload, null);
    }

    /**
     * Returns {@code value} itself when it already is an envelope, otherwise wraps it.
     * Untyped trees and maps get no payload type; other objects are named by
     * {@link TypedPayload#payloadType()} or their simple class name.
     */
    public static Envelope wrap(Object value, String source, ObjectMapper json) {
        if (value == null) throw new IllegalArgumentException("Can't wrap null");
        if (value instanceof Envelope e) return e;
        if (value instanceof JsonNode node) return new Envelope(null, node, source);
        if (value instanceof Map<?, ?> map) return new Envelope(null, json.valueToTree(map), source);

        String type = value instanceof TypedPayload t ? t.payloadType() : value.getClass().getSimpleName();
        return new Envelope(type, json.valueToTree(value), source);
    }

    /** Name entries of this envelope are routed under. */
    @JsonIgnore
    public String routingType() { return payloadType != null ? payloadType : TYPE_NAME; }
}
