package io.polylog.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;
import java.util.stream.Stream;

public final class InMemoryAttributeStore implements AttributeStore {
    private final NavigableMap<String, Map<String, Cell>> rows = new TreeMap<>();

    @Override
    public synchronized void set(String row, String attribute, JsonNode value, long timestamp) {
        rows.computeIfAbsent(row, k -> new LinkedHashMap<>()).put(attribute, new Cell(attribute, value, timestamp));
    }

    @Override
    public synchronized List<Cell> resolveRow(String row) {
        return List.copyOf(rows.getOrDefault(row, Map.of()).values());
    }

    @Override
    public synchronized Stream<RowCell> scanAttribute(String rowPrefix, String attribute, String afterRow, Integer limit) {
        var tail = (afterRow != null && afterRow.compareTo(rowPrefix) >= 0)
                ? rows.tailMap(afterRow, false)
                : rows.tailMap(rowPrefix, true);

        // copied so callers can consume the stream outside the lock
        var out = new ArrayList<RowCell>();
        for (var e : tail.entrySet()) {
            if (!e.getKey().startsWith(rowPrefix)) break;
            var cell = e.getValue().get(attribute);
            if (cell == null) continue;
            out.add(new RowCell(e.getKey(), cell.value(), cell.timestamp()));
            if (limit != null && limit > 0 && out.size() >= limit) break;
        }
        return out.stream();
    }

    @Override
    public synchronized void deleteRow(String row) {
        rows.remove(row);
    }

    @Override
    public synchronized void apply(List<Mutation> mutations) {
        for (var m : mutations) {
            if (m instanceof Mutation.Set s) {
                set(s.row(), s.attribute(), s.value(), s.timestamp());
            } else if (m instanceof Mutation.DeleteRow d) {
                deleteRow(d.row());
            }
        }
    }

    /** Number of rows currently held, for tests and diagnostics. */
    public synchronized int rowCount() { return rows.size(); }
}
