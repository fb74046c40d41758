package io.pipingrelay.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Case-insensitive HTTP header collection.
 *
 * <p>
 * A core-owned port type with zero third-party dependencies, so the engine can
 * describe the headers it forwards to receivers without knowing the servlet
 * API. Lookups ignore case; iteration preserves insertion order and the name
 * casing of the first insertion (headers are written to the wire exactly as
 * added).
 *
 * <p>
 * The class is immutable. Use {@link #builder()} to assemble instances.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new LinkedHashMap<>());

    /** Lowercase name → entry holding the display name and its values. */
    private final Map<String, Entry> store;

    private record Entry(String name, List<String> values) {}

    private HttpHeaders(Map<String, Entry> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        Entry entry = store.get(key(name));
        return entry != null && !entry.values().isEmpty() ? entry.values().get(0) : null;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        Entry entry = store.get(key(name));
        return entry != null ? entry.values() : List.of();
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return store.containsKey(key(name));
    }

    /** Returns {@code true} if no headers are present. */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Number of distinct header names. */
    public int size() {
        return store.size();
    }

    /** Header names in insertion order, with their original casing. */
    public List<String> names() {
        List<String> names = new ArrayList<>(store.size());
        store.values().forEach(entry -> names.add(entry.name()));
        return Collections.unmodifiableList(names);
    }

    /**
     * Visits every (name, value) pair in insertion order. Multi-valued headers
     * produce one call per value.
     */
    public void forEach(BiConsumer<String, String> action) {
        store.values().forEach(entry -> entry.values().forEach(value -> action.accept(entry.name(), value)));
    }

    // ── Factory methods ──

    /**
     * Creates headers from a single-value map.
     *
     * @param singleValue header name → single value
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        singleValue.forEach(builder::set);
        return builder.build();
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    /** Creates a new mutable builder. */
    public static Builder builder() {
        return new Builder();
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + names();
    }

    /** Accumulates headers; {@link #build()} freezes them. */
    public static final class Builder {

        private final Map<String, Entry> store = new LinkedHashMap<>();

        Builder() {}

        /**
         * Sets a header, replacing any existing values for the same name. A
         * {@code null} value removes the header.
         */
        public Builder set(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("header name must not be blank");
            }
            if (value == null) {
                store.remove(key(name));
            } else {
                store.put(key(name), new Entry(name, List.of(value)));
            }
            return this;
        }

        /** Adds a value, keeping values already present for the same name. */
        public Builder add(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("header name must not be blank");
            }
            Entry existing = store.get(key(name));
            if (existing == null) {
                return set(name, value);
            }
            List<String> values = new ArrayList<>(existing.values());
            values.add(value);
            store.put(key(name), new Entry(existing.name(), List.copyOf(values)));
            return this;
        }

        public HttpHeaders build() {
            return store.isEmpty() ? EMPTY : new HttpHeaders(new LinkedHashMap<>(store));
        }
    }
}
