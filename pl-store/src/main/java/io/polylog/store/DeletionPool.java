package io.polylog.store;

import io.polylog.core.CollectionPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Collects rows to be removed and deletes them in one batch on {@link #flush()}. */
public final class DeletionPool {
    private static final Logger log = LoggerFactory.getLogger(DeletionPool.class);

    private final AttributeStore store;
    private final Set<String> marked = new LinkedHashSet<>();

    public DeletionPool(AttributeStore store) {
        this.store = Objects.requireNonNull(store);
    }

    public void markForDeletion(String row) { marked.add(Objects.requireNonNull(row)); }

    public void markForDeletion(CollectionPath path) { markForDeletion(path.value()); }

    public Set<String> markedForDeletion() { return Set.copyOf(marked); }

    public void flush() {
        if (marked.isEmpty()) return;
        var pool = new MutationPool(store);
        marked.forEach(pool::deleteRow);
        log.info("Deleting {} rows", marked.size());
        pool.flush();
        marked.clear();
    }
}
