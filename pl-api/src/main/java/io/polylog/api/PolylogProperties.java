package io.polylog.api;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** {@code polylog.*} settings. */
@ConfigurationProperties(prefix = "polylog")
public record PolylogProperties(Keys keys, Api api, Store store) {

    public PolylogProperties {
        if (keys == null) keys = new Keys(null);
        if (api == null) api = new Api(null);
        if (store == null) store = new Store(null);
    }

    /** A set seed makes key generation reproducible (fixed clock, seeded suffixes). */
    public record Keys(Long seed) {}

    public record Api(Integer maxLimit) {
        public Api {
            if (maxLimit == null || maxLimit <= 0) maxLimit = 1000;
        }
    }

    public record Store(Integer pageSize) {
        public Store {
            if (pageSize == null || pageSize <= 0) pageSize = 500;
        }
    }
}
