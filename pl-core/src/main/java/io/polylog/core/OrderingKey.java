package io.polylog.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * Position of an entry inside one sequence: microseconds since epoch plus a 24-bit
 * suffix that keeps entries written in the same microsecond apart.
 *
 * The text form {@code %016x.%06x} sorts lexicographically in key order, which is
 * what lets row-ordered stores hand back sequences in timestamp order.
 */
public record OrderingKey(long timestamp, int suffix) implements Comparable<OrderingKey> {

    public static final int MAX_SUFFIX = 0xFFFFFF;

    private static final Comparator<OrderingKey> ORDER =
            Comparator.comparingLong(OrderingKey::timestamp).thenComparingInt(OrderingKey::suffix);

    public OrderingKey {
        if (timestamp < 0) throw new IllegalArgumentException("Negative timestamp: " + timestamp);
        if (suffix < 0 || suffix > MAX_SUFFIX) throw new IllegalArgumentException("Suffix out of range: " + suffix);
    }

    /** Key with only the timestamp component meaningful. */
    public static OrderingKey ofTimestamp(long timestamp) { return new OrderingKey(timestamp, 0); }

    /** Same position without the suffix. */
    public OrderingKey withoutSuffix() { return suffix == 0 ? this : ofTimestamp(timestamp); }

    @JsonCreator
    public static OrderingKey parse(String text) {
        if (text == null) throw new IllegalArgumentException("Null ordering key");
        int dot = text.indexOf('.');
        try {
            if (dot < 0) return ofTimestamp(Long.parseLong(text, 16));
            return new OrderingKey(Long.parseLong(text.substring(0, dot), 16),
                    Integer.parseInt(text.substring(dot + 1), 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed ordering key: " + text, e);
        }
    }

    @Override public int compareTo(OrderingKey o) { return ORDER.compare(this, o); }

    @JsonValue @Override public String toString() { return String.format("%016x.%06x", timestamp, suffix); }
}
