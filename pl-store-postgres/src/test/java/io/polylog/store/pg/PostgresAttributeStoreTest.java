package io.polylog.store.pg;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import io.polylog.store.AttributeStore.RowCell;
import io.polylog.store.Mutation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PostgresAttributeStoreTest {

    private JdbcTemplate jdbc;
    private TransactionOperations tx;
    private ObjectMapper json;
    private PostgresAttributeStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        tx = mock(TransactionOperations.class);
        doAnswer(inv -> {
            inv.<Consumer<TransactionStatus>>getArgument(0).accept(mock(TransactionStatus.class));
            return null;
        }).when(tx).executeWithoutResult(any(Consumer.class));
        json = new ObjectMapper();
        store = new PostgresAttributeStore(jdbc, tx, json, 2);
    }

    @Test
    void set_upsertsJsonValue() {
        store.set("/c", "polylog:value_type_A", IntNode.valueOf(1), 0L);

        ArgumentCaptor<String> sqlCap = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> argsCap = ArgumentCaptor.forClass(Object[].class);
        verify(jdbc).update(sqlCap.capture(), argsCap.capture());

        assertThat(sqlCap.getValue()).contains("INSERT INTO pl_attribute").contains("ON CONFLICT (row_id, attribute)");
        Object[] args = argsCap.getValue();
        assertThat(args).containsExactly("/c", "polylog:value_type_A", 0L, "1");
    }

    @Test
    void resolveRow_queriesByRowId() {
        when(jdbc.query(anyString(), ArgumentMatchers.<RowMapper<Object>>any(), eq("/c")))
                .thenReturn(List.of());

        assertThat(store.resolveRow("/c")).isEmpty();

        ArgumentCaptor<String> sqlCap = ArgumentCaptor.forClass(String.class);
        verify(jdbc).query(sqlCap.capture(), ArgumentMatchers.<RowMapper<Object>>any(), eq("/c"));
        assertThat(sqlCap.getValue()).contains("WHERE row_id = ?");
    }

    @Test
    @SuppressWarnings("unchecked")
    void scanAttribute_pagesWithRowCursor() {
        JsonNode v = IntNode.valueOf(7);
        var page1 = List.of(new RowCell("/c/A/Results/1", v, 1), new RowCell("/c/A/Results/2", v, 2));
        var page2 = List.of(new RowCell("/c/A/Results/3", v, 3));
        when(jdbc.query(anyString(), any(RowMapper.class), any(Object[].class)))
                .thenReturn((List) page1, (List) page2);

        var stream = store.scanAttribute("/c/A/Results/", "polylog:sequential_value", null, null);
        verifyNoInteractions(jdbc);

        var rows = stream.map(RowCell::row).toList();

        assertThat(rows).containsExactly("/c/A/Results/1", "/c/A/Results/2", "/c/A/Results/3");

        ArgumentCaptor<String> sqlCap = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> argsCap = ArgumentCaptor.forClass(Object[].class);
        verify(jdbc, times(2)).query(sqlCap.capture(), any(RowMapper.class), argsCap.capture());

        assertThat(sqlCap.getAllValues().get(0)).doesNotContain("row_id > ?").contains("ORDER BY row_id ASC LIMIT ?");
        assertThat(sqlCap.getAllValues().get(1)).contains("row_id > ?");
        assertThat(argsCap.getAllValues().get(1)).containsExactly("/c/A/Results/%", "polylog:sequential_value", "/c/A/Results/2", 2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void scanAttribute_limitStopsAfterFirstPage() {
        JsonNode v = IntNode.valueOf(7);
        when(jdbc.query(anyString(), any(RowMapper.class), any(Object[].class)))
                .thenReturn((List) List.of(new RowCell("/c/A/Results/1", v, 1)));

        var rows = store.scanAttribute("/c/A/Results/", "polylog:sequential_value", "/c/A/Results/0", 1).toList();

        assertThat(rows).hasSize(1);
        verify(jdbc, times(1)).query(anyString(), any(RowMapper.class), any(Object[].class));
    }

    @Test
    void countAttribute_escapesLikeWildcards() {
        when(jdbc.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(4L);

        assertThat(store.countAttribute("/c_1/", "a")).isEqualTo(4L);

        ArgumentCaptor<Object[]> argsCap = ArgumentCaptor.forClass(Object[].class);
        verify(jdbc).queryForObject(anyString(), eq(Long.class), argsCap.capture());
        assertThat(argsCap.getValue()).containsExactly("/c\\_1/%", "a");
    }

    @Test
    @SuppressWarnings("unchecked")
    void apply_keepsOrderAndBatchesConsecutiveRunsInOneTransaction() {
        store.apply(List.of(
                new Mutation.Set("/c/A/Results/1", "polylog:sequential_value", IntNode.valueOf(1), 1L),
                new Mutation.Set("/c", "polylog:value_type_A", IntNode.valueOf(1), 0L),
                new Mutation.DeleteRow("/old"),
                new Mutation.Set("/old", "polylog:value_type_B", IntNode.valueOf(1), 0L)));

        verify(tx).executeWithoutResult(any(Consumer.class));

        ArgumentCaptor<String> sqlCap = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<List<Object[]>> argsCap = ArgumentCaptor.forClass(List.class);
        verify(jdbc, times(3)).batchUpdate(sqlCap.capture(), argsCap.capture());

        assertThat(sqlCap.getAllValues().get(0)).contains("INSERT INTO pl_attribute");
        assertThat(argsCap.getAllValues().get(0)).hasSize(2);
        assertThat(sqlCap.getAllValues().get(1)).contains("DELETE FROM pl_attribute");
        assertThat(argsCap.getAllValues().get(1)).hasSize(1);
        assertThat(sqlCap.getAllValues().get(2)).contains("INSERT INTO pl_attribute");
        assertThat(argsCap.getAllValues().get(2).get(0)).containsExactly("/old", "polylog:value_type_B", 0L, "1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void apply_failureInsideTheTransactionPropagates() {
        when(jdbc.batchUpdate(eq(PostgresAttributeStore.DELETE_ROW), anyList()))
                .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> store.apply(List.of(
                new Mutation.Set("/c", "polylog:value_type_A", IntNode.valueOf(1), 0L),
                new Mutation.DeleteRow("/c"))))
                .isInstanceOf(IllegalStateException.class);

        verify(tx).executeWithoutResult(any(Consumer.class));
    }

    @Test
    void apply_nullOrEmptyDoesNothing() {
        store.apply(null);
        store.apply(List.of());

        verifyNoInteractions(jdbc, tx);
    }

    @Test
    void rejectsNonPositivePageSize() {
        assertThatThrownBy(() -> new PostgresAttributeStore(jdbc, tx, json, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toJsonAndBackRoundTrip() {
        JsonNode node = json.createObjectNode().put("foo", "bar");
        assertThat(store.readJson(store.toJson(node))).isEqualTo(node);
    }
}
