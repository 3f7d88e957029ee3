package io.polylog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.polylog.core.CollectionPath;
import io.polylog.core.Envelope;
import io.polylog.core.OrderingKey;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Single-type ordered log. Every item is its own row below {@code <path>/Results/}, named by
 * the item's ordering key, holding the envelope under {@link #ATTRIBUTE}.
 */
public final class SequentialCollection {

    /** Attribute every item row carries; scanning for it finds all items below a path. */
    public static final String ATTRIBUTE = "polylog:sequential_value";

    private static final String RESULTS = "Results";

    private final AttributeStore store;
    private final ObjectMapper json;
    private final CollectionPath path;

    public SequentialCollection(AttributeStore store, ObjectMapper json, CollectionPath path) {
        this.store = Objects.requireNonNull(store);
        this.json = Objects.requireNonNull(json);
        this.path = Objects.requireNonNull(path);
    }

    public static String itemRow(CollectionPath path, OrderingKey key) {
        return path.add(RESULTS).add(key.toString()).value();
    }

    /** Sequence an item row belongs to, or null if {@code row} is not an item row. */
    public static CollectionPath sequenceOf(String row) {
        int i = row.lastIndexOf("/" + RESULTS + "/");
        return i <= 0 ? null : CollectionPath.of(row.substring(0, i));
    }

    /**
     * Stores {@code value} at {@code key}; an item already at that key is replaced.
     * Staged into {@code pool} instead when one is given.
     */
    public static OrderingKey staticAdd(AttributeStore store, ObjectMapper json, CollectionPath path,
                                        Envelope value, OrderingKey key, MutationPool pool) {
        Objects.requireNonNull(value);
        Objects.requireNonNull(key);
        var row = itemRow(path, key);
        JsonNode tree = json.valueToTree(value);
        if (pool != null) {
            pool.set(row, ATTRIBUTE, tree, key.timestamp());
        } else {
            store.set(row, ATTRIBUTE, tree, key.timestamp());
        }
        return key;
    }

    public OrderingKey add(Envelope value, OrderingKey key, MutationPool pool) {
        return staticAdd(store, json, path, value, key, pool);
    }

    /** Items in key order, strictly after {@code after} if given, at most {@code limit}. */
    public Stream<StoredItem> scan(OrderingKey after, Integer limit) {
        var afterRow = after == null ? null : itemRow(path, after);
        return store.scanAttribute(resultsPrefix(), ATTRIBUTE, afterRow, limit)
                .map(cell -> new StoredItem(keyOf(cell.row()), readEnvelope(cell)));
    }

    public long length() {
        return store.countAttribute(resultsPrefix(), ATTRIBUTE);
    }

    public CollectionPath path() { return path; }

    private String resultsPrefix() { return path.add(RESULTS).childPrefix(); }

    private static OrderingKey keyOf(String row) {
        return OrderingKey.parse(row.substring(row.lastIndexOf('/') + 1));
    }

    private Envelope readEnvelope(AttributeStore.RowCell cell) {
        try {
            return json.treeToValue(cell.value(), Envelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable item at " + cell.row(), e);
        }
    }
}
