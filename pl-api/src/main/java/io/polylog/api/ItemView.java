package io.polylog.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.polylog.store.StoredItem;

public record ItemView(String key, String type, JsonNode payload, String source) {

    static ItemView of(StoredItem item) {
        var e = item.value();
        return new ItemView(item.key().toString(), e.routingType(), e.payload(), e.source());
    }
}
