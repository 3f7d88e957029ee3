package io.polylog.core;

/**
 * Implemented by payload classes that want to choose their own routing type instead of
 * their simple class name.
 */
public interface TypedPayload {
    String payloadType();
}
