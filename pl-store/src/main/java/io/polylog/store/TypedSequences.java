package io.polylog.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.polylog.core.CollectionPath;
import io.polylog.core.Envelope;
import io.polylog.core.OrderingKey;
import io.polylog.core.OrderingKeyGenerator;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Addresses the per-type sequences of a collection. The sequence for a type lives at
 * {@code <collection>/<typeName>} and is never recorded anywhere; it is recomputed on every call.
 */
public final class TypedSequences {
    private final AttributeStore store;
    private final ObjectMapper json;
    private final OrderingKeyGenerator keys;

    public TypedSequences(AttributeStore store, ObjectMapper json, OrderingKeyGenerator keys) {
        this.store = Objects.requireNonNull(store);
        this.json = Objects.requireNonNull(json);
        this.keys = Objects.requireNonNull(keys);
    }

    public TypedSequences(AttributeStore store, ObjectMapper json) {
        this(store, json, OrderingKeyGenerator.system());
    }

    /**
     * @throws IllegalArgumentException if {@code typeName} is not a single path component; path
     *                                  normalization would otherwise let two type names share
     *                                  a sequence, or nest one type's items inside another's
     */
    public CollectionPath sequencePath(CollectionPath collection, String typeName) {
        if (typeName == null || typeName.isBlank()
                || typeName.indexOf('/') >= 0 || !typeName.equals(typeName.strip())) {
            throw new IllegalArgumentException("Invalid type name: '" + typeName + "'");
        }
        return collection.add(typeName);
    }

    public SequentialCollection sequence(CollectionPath collection, String typeName) {
        return new SequentialCollection(store, json, sequencePath(collection, typeName));
    }

    /**
     * Appends to the type's sequence. Null {@code timestamp} means now, null {@code suffix} a
     * random one; a non-null {@code pool} stages the write instead of applying it.
     */
    public OrderingKey append(CollectionPath collection, String typeName, Envelope value,
                              Long timestamp, Integer suffix, MutationPool pool) {
        var key = keys.keyFor(timestamp, suffix);
        return SequentialCollection.staticAdd(store, json, sequencePath(collection, typeName), value, key, pool);
    }

    public Stream<StoredItem> scan(CollectionPath collection, String typeName, OrderingKey after, Integer limit) {
        return sequence(collection, typeName).scan(after, limit);
    }

    public long count(CollectionPath collection, String typeName) {
        return sequence(collection, typeName).length();
    }

    public AttributeStore store() { return store; }

    public ObjectMapper json() { return json; }
}
