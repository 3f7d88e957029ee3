package io.polylog.store;

import com.fasterxml.jackson.databind.JsonNode;

/** A staged write, see {@link MutationPool}. */
public sealed interface Mutation permits Mutation.Set, Mutation.DeleteRow {

    String row();

    record Set(String row, String attribute, JsonNode value, long timestamp) implements Mutation {}

    record DeleteRow(String row) implements Mutation {}
}
