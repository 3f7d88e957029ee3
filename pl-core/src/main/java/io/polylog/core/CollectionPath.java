package io.polylog.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hierarchical, slash-separated identity of a stored object ("/hunts/H1/results").
 * Always has a leading slash and never a trailing one; the root is "/".
 */
public record CollectionPath(String value) implements Comparable<CollectionPath> {

    public static final CollectionPath ROOT = new CollectionPath("/");

    public CollectionPath {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("Empty collection path");
        value = normalize(value);
    }

    @JsonCreator
    public static CollectionPath of(String value) { return new CollectionPath(value); }

    /** Child path; {@code child} may itself contain slashes. */
    public CollectionPath add(String child) {
        if (child == null || child.isBlank()) throw new IllegalArgumentException("Empty path component");
        var c = child.startsWith("/") ? child.substring(1) : child;
        return new CollectionPath(isRoot() ? "/" + c : value + "/" + c);
    }

    public boolean isRoot() { return "/".equals(value); }

    /** Prefix matching this path and everything below it, but not siblings sharing a name prefix. */
    public String childPrefix() { return isRoot() ? "/" : value + "/"; }

    @Override public int compareTo(CollectionPath o) { return value.compareTo(o.value); }

    @JsonValue @Override public String toString() { return value; }

    private static String normalize(String raw) {
        var sb = new StringBuilder();
        for (String part : raw.trim().split("/")) {
            if (part.isEmpty()) continue;
            sb.append('/').append(part);
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }
}
