package io.polylog.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Caller-owned batch of writes. Nothing reaches the store until {@link #flush()} (or
 * {@link #close()}), which applies everything staged so far in one call and empties the pool.
 * Not thread-safe.
 */
public final class MutationPool implements AutoCloseable {
    private final AttributeStore store;
    private final List<Mutation> pending = new ArrayList<>();

    public MutationPool(AttributeStore store) {
        this.store = Objects.requireNonNull(store);
    }

    public void set(String row, String attribute, JsonNode value, long timestamp) {
        pending.add(new Mutation.Set(row, attribute, value, timestamp));
    }

    public void deleteRow(String row) {
        pending.add(new Mutation.DeleteRow(row));
    }

    public int size() { return pending.size(); }

    public void flush() {
        if (pending.isEmpty()) return;
        var batch = List.copyOf(pending);
        store.apply(batch);
        pending.clear();
    }

    @Override
    public void close() { flush(); }
}
