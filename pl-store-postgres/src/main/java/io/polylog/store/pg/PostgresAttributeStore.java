package io.polylog.store.pg;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.polylog.store.AttributeStore;
import io.polylog.store.Mutation;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionOperations;

import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * {@link AttributeStore} on a single {@code pl_attribute} table. {@code row_id} is collated
 * "C" so ORDER BY and range comparisons follow byte order, which ordering keys rely on.
 * Scans page through the table with a row cursor instead of loading everything at once.
 * {@link #apply} runs in a single transaction.
 */
public final class PostgresAttributeStore implements AttributeStore {
    static final int DEFAULT_PAGE_SIZE = 500;

    private static final String UPSERT = """
      INSERT INTO pl_attribute (row_id, attribute, ts, value)
      VALUES (?, ?, ?, ?::jsonb)
      ON CONFLICT (row_id, attribute)
      DO UPDATE SET ts = EXCLUDED.ts, value = EXCLUDED.value
      """;
    static final String DELETE_ROW = "DELETE FROM pl_attribute WHERE row_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionOperations transactionTemplate;
    private final ObjectMapper json;
    private final int pageSize;

    public PostgresAttributeStore(JdbcTemplate jdbc, TransactionOperations transactionTemplate,
                                  ObjectMapper json, int pageSize) {
        this.jdbcTemplate = Objects.requireNonNull(jdbc);
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate);
        this.json = Objects.requireNonNull(json);
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        this.pageSize = pageSize;
    }

    public PostgresAttributeStore(JdbcTemplate jdbc, TransactionOperations transactionTemplate, ObjectMapper json) {
        this(jdbc, transactionTemplate, json, DEFAULT_PAGE_SIZE);
    }

    @Override
    public void set(String row, String attribute, JsonNode value, long timestamp) {
        jdbcTemplate.update(UPSERT, row, attribute, timestamp, toJson(value));
    }

    @Override
    public List<Cell> resolveRow(String row) {
        final String sql = """
      SELECT attribute, ts, value
      FROM pl_attribute
      WHERE row_id = ?
      """;
        RowMapper<Cell> mapper = (ResultSet rs, int rowNum) ->
                new Cell(rs.getString("attribute"), readJson(rs.getString("value")), rs.getLong("ts"));
        return jdbcTemplate.query(sql, mapper, row);
    }

    @Override
    public Stream<RowCell> scanAttribute(String rowPrefix, String attribute, String afterRow, Integer limit) {
        boolean bounded = limit != null && limit > 0;
        int firstPage = bounded ? Math.min(pageSize, limit) : pageSize;

        // first page is fetched when the stream is consumed, not here
        Supplier<List<RowCell>> first = () -> fetchPage(rowPrefix, attribute, afterRow, firstPage);
        Stream<List<RowCell>> pages = Stream.of(first).flatMap(f -> Stream.iterate(
                f.get(),
                page -> !page.isEmpty(),
                page -> page.size() < firstPage
                        ? List.of()
                        : fetchPage(rowPrefix, attribute, page.get(page.size() - 1).row(), pageSize)));

        var cells = pages.flatMap(List::stream);
        return bounded ? cells.limit(limit) : cells;
    }

    @Override
    public long countAttribute(String rowPrefix, String attribute) {
        final String sql = """
      SELECT count(*)
      FROM pl_attribute
      WHERE row_id LIKE ? AND attribute = ?
      """;
        Long n = jdbcTemplate.queryForObject(sql, Long.class, likePrefix(rowPrefix), attribute);
        return n == null ? 0 : n;
    }

    @Override
    public void deleteRow(String row) {
        jdbcTemplate.update(DELETE_ROW, row);
    }

    /**
     * Applies the mutations in order inside one transaction. Consecutive mutations of the same
     * kind go out as one JDBC batch.
     */
    @Override
    public void apply(List<Mutation> mutations) {
        if (mutations == null || mutations.isEmpty()) return;

        transactionTemplate.executeWithoutResult(status -> {
            String runSql = null;
            var run = new ArrayList<Object[]>();
            for (var m : mutations) {
                String sql;
                Object[] args;
                if (m instanceof Mutation.Set s) {
                    sql = UPSERT;
                    args = new Object[]{s.row(), s.attribute(), s.timestamp(), toJson(s.value())};
                } else if (m instanceof Mutation.DeleteRow d) {
                    sql = DELETE_ROW;
                    args = new Object[]{d.row()};
                } else {
                    throw new IllegalArgumentException("Unsupported mutation: " + m);
                }
                if (runSql != null && !runSql.equals(sql)) {
                    jdbcTemplate.batchUpdate(runSql, run);
                    run = new ArrayList<>();
                }
                runSql = sql;
                run.add(args);
            }
            jdbcTemplate.batchUpdate(runSql, run);
        });
    }

    List<RowCell> fetchPage(String rowPrefix, String attribute, String afterRow, int size) {
        var sql = new StringBuilder("""
        SELECT row_id, ts, value
        FROM pl_attribute
        WHERE row_id LIKE ? AND attribute = ?
    """);
        var params = new ArrayList<Object>(List.of(likePrefix(rowPrefix), attribute));
        if (afterRow != null) {
            sql.append(" AND row_id > ?");
            params.add(afterRow);
        }
        sql.append(" ORDER BY row_id ASC LIMIT ?");
        params.add(size);

        RowMapper<RowCell> mapper = (ResultSet rs, int rowNum) ->
                new RowCell(rs.getString("row_id"), readJson(rs.getString("value")), rs.getLong("ts"));
        return jdbcTemplate.query(sql.toString(), mapper, params.toArray());
    }

    static String likePrefix(String prefix) {
        return prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
    }

    String toJson(JsonNode node) {
        try { return json.writeValueAsString(node); }
        catch (Exception e) { throw new IllegalStateException(e); }
    }

    JsonNode readJson(String jsonStr) {
        try { return json.readTree(jsonStr); }
        catch (Exception e) { throw new IllegalStateException(e); }
    }
}
