package io.polylog.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import io.polylog.core.AccessToken;
import io.polylog.core.CollectionPath;
import io.polylog.core.Envelope;
import io.polylog.core.OrderingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A collection that stores values of many types, one ordered sequence per type.
 *
 * The per-type sequences are never created as objects; they are only written to. The types in
 * use are found through marker attributes ({@link #VALUE_TYPE_PREFIX} + type name) on the
 * collection's own row, so listing them costs one row read no matter how many entries exist.
 *
 * Without a {@link MutationPool}, an entry becomes visible before its type marker. A reader
 * may briefly see the entry through {@link #scanByType} while the type is missing from
 * {@link #listStoredTypes()}, and a failed marker write leaves that state in place until the
 * type is written again. Pass a pool to commit entry and marker together.
 */
public final class MultiTypeCollection implements Iterable<StoredItem> {
    private static final Logger log = LoggerFactory.getLogger(MultiTypeCollection.class);

    public static final String VALUE_TYPE_PREFIX = "polylog:value_type_";

    static final JsonNode MARKER_VALUE = IntNode.valueOf(1);
    static final long MARKER_TIMESTAMP = 0L;

    private final TypedSequences sequences;
    private final CollectionPath path;
    private final AccessToken token;

    public MultiTypeCollection(TypedSequences sequences, CollectionPath path, AccessToken token) {
        this.sequences = Objects.requireNonNull(sequences);
        this.path = Objects.requireNonNull(path);
        this.token = Objects.requireNonNull(token);
    }

    /**
     * Adds a value to the collection at {@code path} without opening it. The caller is
     * responsible for the collection existing.
     *
     * @param value     stored as is if it is an {@link Envelope}, wrapped into one otherwise; reads
     *                  return the envelope either way
     * @param timestamp microseconds since epoch, null for now
     * @param suffix    24-bit collision breaker, null for a random one
     * @param pool      stages both the entry and the type marker when non-null
     * @return the key identifying the value within its type's sequence
     * @throws IllegalArgumentException if {@code value} is null
     */
    public static OrderingKey staticAdd(TypedSequences sequences, CollectionPath path, AccessToken token,
                                        Object value, Long timestamp, Integer suffix, MutationPool pool) {
        if (value == null) throw new IllegalArgumentException("Can't add null to MultiTypeCollection");

        var envelope = Envelope.wrap(value, token.username(), sequences.json());
        var typeName = envelope.routingType();

        var key = sequences.append(path, typeName, envelope, timestamp, suffix, pool);

        // Fixed value and timestamp: rewriting a marker never changes it.
        var attribute = VALUE_TYPE_PREFIX + typeName;
        if (pool != null) {
            pool.set(path.value(), attribute, MARKER_VALUE, MARKER_TIMESTAMP);
        } else {
            sequences.store().set(path.value(), attribute, MARKER_VALUE, MARKER_TIMESTAMP);
        }
        log.debug("Added {} to {} at {} for {}", typeName, path, key, token.username());
        return key;
    }

    public OrderingKey add(Object value) {
        return add(value, null, null, null);
    }

    public OrderingKey add(Object value, MutationPool pool) {
        return add(value, null, null, pool);
    }

    public OrderingKey add(Object value, Long timestamp, Integer suffix) {
        return add(value, timestamp, suffix, null);
    }

    public OrderingKey add(Object value, Long timestamp, Integer suffix, MutationPool pool) {
        return staticAdd(sequences, path, token, value, timestamp, suffix, pool);
    }

    /** Type names with a marker on this collection, in no particular order. */
    public Set<String> listStoredTypes() {
        var types = new HashSet<String>();
        for (var cell : sequences.store().resolveRow(path.value())) {
            if (cell.attribute().startsWith(VALUE_TYPE_PREFIX)) {
                types.add(cell.attribute().substring(VALUE_TYPE_PREFIX.length()));
            }
        }
        return types;
    }

    /**
     * Values of one type, ordered by key.
     *
     * @param includeSuffix if false the returned keys carry the timestamp only (suffix 0); the
     *                      full key is only needed to resume a scan exactly
     */
    public Stream<StoredItem> scanByType(String typeName, OrderingKey after, boolean includeSuffix, Integer limit) {
        var items = sequences.scan(path, typeName, after, limit);
        return includeSuffix ? items : items.map(i -> new StoredItem(i.key().withoutSuffix(), i.value()));
    }

    public long lengthByType(String typeName) {
        return sequences.count(path, typeName);
    }

    /**
     * Every stored value, one type after another. Within a type values are in key order;
     * values of different types are not merged by time.
     */
    public Stream<StoredItem> stream() {
        return listStoredTypes().stream().flatMap(t -> scanByType(t, null, true, null));
    }

    @Override
    public Iterator<StoredItem> iterator() {
        return stream().iterator();
    }

    /** Total number of values. Recounts every type on each call. */
    public long size() {
        long n = 0;
        for (var type : listStoredTypes()) n += lengthByType(type);
        return n;
    }

    /**
     * Registers this collection and everything stored below it with {@code pool}. Sequences are
     * found by scanning for item rows rather than through the type markers, so sequences whose
     * marker was never written are removed too.
     */
    public void onDelete(DeletionPool pool) {
        pool.markForDeletion(path);

        var sequencePaths = new LinkedHashSet<CollectionPath>();
        try (var cells = sequences.store().scanAttribute(path.childPrefix(), SequentialCollection.ATTRIBUTE, null, null)) {
            cells.forEach(cell -> {
                pool.markForDeletion(cell.row());
                var seq = SequentialCollection.sequenceOf(cell.row());
                if (seq != null) sequencePaths.add(seq);
            });
        }
        sequencePaths.forEach(pool::markForDeletion);
        log.info("Marked {} with {} sequences for deletion", path, sequencePaths.size());
    }

    public CollectionPath path() { return path; }

    public AccessToken token() { return token; }
}
