package io.polylog.store;

import io.polylog.core.Envelope;
import io.polylog.core.OrderingKey;

import java.util.Objects;

public record StoredItem(OrderingKey key, Envelope value) {
    public StoredItem {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
    }
}
