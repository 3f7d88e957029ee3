package io.polylog.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.stream.Stream;

/**
 * Row/attribute store the collections are persisted in. A row holds at most one cell per
 * attribute; writing an attribute again replaces the cell.
 */
public interface AttributeStore {

    void set(String row, String attribute, JsonNode value, long timestamp);

    /** All cells of {@code row}, empty if the row does not exist. */
    List<Cell> resolveRow(String row);

    /**
     * Cells of {@code attribute} on every row starting with {@code rowPrefix}, in ascending row
     * order. Only rows strictly after {@code afterRow} are returned when it is given, at most
     * {@code limit} when that is given. The stream is lazy and can be consumed once.
     */
    Stream<RowCell> scanAttribute(String rowPrefix, String attribute, String afterRow, Integer limit);

    default long countAttribute(String rowPrefix, String attribute) {
        try (var cells = scanAttribute(rowPrefix, attribute, null, null)) {
            return cells.count();
        }
    }

    void deleteRow(String row);

    /** Applies the mutations together; stores that can, do so in one transaction. */
    void apply(List<Mutation> mutations);

    record Cell(String attribute, JsonNode value, long timestamp) {}

    record RowCell(String row, JsonNode value, long timestamp) {}
}
