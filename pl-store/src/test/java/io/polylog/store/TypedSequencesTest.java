package io.polylog.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.polylog.core.CollectionPath;
import io.polylog.core.Envelope;
import io.polylog.core.OrderingKey;
import io.polylog.core.OrderingKeyGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypedSequencesTest {

    private final ObjectMapper json = new ObjectMapper();
    private final InMemoryAttributeStore store = new InMemoryAttributeStore();
    private final TypedSequences sequences = new TypedSequences(store, json, OrderingKeyGenerator.deterministic(1));
    private final CollectionPath collection = CollectionPath.of("/c");

    private Envelope value(int n) {
        return Envelope.of("T", json.createObjectNode().put("n", n));
    }

    @Test
    void sequencePathIsDerivedFromCollectionAndType() {
        assertThat(sequences.sequencePath(collection, "Stat")).isEqualTo(CollectionPath.of("/c/Stat"));
        assertThat(sequences.sequence(collection, "Stat").path()).isEqualTo(CollectionPath.of("/c/Stat"));
    }

    @Test
    void typeNamesMustBeSinglePathComponents() {
        for (var name : new String[]{"X/Results", "A/", "/A", " A", "A ", " "}) {
            assertThatThrownBy(() -> sequences.sequencePath(collection, name))
                    .as(name)
                    .isInstanceOf(IllegalArgumentException.class);
        }
        assertThatThrownBy(() -> sequences.append(collection, "A/", value(1), 1L, 1, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.rowCount()).isZero();
    }

    @Test
    void appendStoresItemRowUnderSequence() {
        var key = sequences.append(collection, "T", value(1), 100L, 5, null);

        assertThat(key).isEqualTo(new OrderingKey(100, 5));
        var row = SequentialCollection.itemRow(CollectionPath.of("/c/T"), key);
        assertThat(row).isEqualTo("/c/T/Results/0000000000000064.000005");
        assertThat(store.resolveRow(row))
                .singleElement()
                .satisfies(cell -> {
                    assertThat(cell.attribute()).isEqualTo(SequentialCollection.ATTRIBUTE);
                    assertThat(cell.timestamp()).isEqualTo(100L);
                });
    }

    @Test
    void scanAndCountStayWithinOneType() {
        sequences.append(collection, "T", value(1), 1L, 0, null);
        sequences.append(collection, "T", value(2), 2L, 0, null);
        sequences.append(collection, "U", value(3), 3L, 0, null);
        // "/c/T2" shares a name prefix with "/c/T" but is a different sequence
        sequences.append(collection, "T2", value(4), 4L, 0, null);

        assertThat(sequences.count(collection, "T")).isEqualTo(2);
        assertThat(sequences.scan(collection, "T", null, null).map(i -> i.value().payload().get("n").asInt()))
                .containsExactly(1, 2);
    }

    @Test
    void appendIntoPoolIsDeferred() {
        var pool = new MutationPool(store);
        sequences.append(collection, "T", value(1), 1L, 1, pool);

        assertThat(sequences.count(collection, "T")).isZero();
        pool.flush();
        assertThat(sequences.count(collection, "T")).isEqualTo(1);
    }

    @Test
    void sequenceOfRecoversSequenceFromItemRow() {
        var row = SequentialCollection.itemRow(CollectionPath.of("/c/T"), new OrderingKey(9, 9));

        assertThat(SequentialCollection.sequenceOf(row)).isEqualTo(CollectionPath.of("/c/T"));
        assertThat(SequentialCollection.sequenceOf("/c/T")).isNull();
    }
}
