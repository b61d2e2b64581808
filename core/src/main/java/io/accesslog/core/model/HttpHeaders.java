package io.accesslog.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Case-insensitive, ordered HTTP header multimap.
 *
 * <p>
 * Header names are normalized to <strong>lowercase</strong> per RFC 9110
 * §5.1 and keep the order in which they were first seen. Each name maps to a
 * non-empty list of values in arrival order; names that differ only in case
 * are merged into one entry. The class is immutable.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(Map.of());

    /** Lowercase name → unmodifiable, non-empty value list. */
    private final Map<String, List<String>> store;

    private HttpHeaders(Map<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = store.get(normalize(name));
        return values != null ? values.get(0) : null;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = store.get(normalize(name));
        return values != null ? values : List.of();
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return store.containsKey(normalize(name));
    }

    /** Returns {@code true} if no headers are present. */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Lowercase header names in first-seen order. */
    public Set<String> names() {
        return store.keySet();
    }

    /** Visits each header name (lowercase) with all of its values, in order. */
    public void forEach(BiConsumer<String, List<String>> action) {
        store.forEach(action);
    }

    /**
     * All-values-per-name view with lowercase keys.
     *
     * @return an unmodifiable, ordered map
     */
    public Map<String, List<String>> toMultiValueMap() {
        return store;
    }

    // ── Factory methods ──

    /**
     * Creates headers from a single-value map. Keys are normalized to lowercase;
     * entries with a null name or value are dropped.
     *
     * @param singleValue header name → single value
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> map = new LinkedHashMap<>();
        singleValue.forEach((key, value) -> append(map, key, Collections.singletonList(value)));
        return freeze(map);
    }

    /**
     * Creates headers from a multi-value map. Keys are normalized to lowercase;
     * null values are skipped and entries left with no values are dropped.
     *
     * @param multiValue header name → list of values
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders ofMulti(Map<String, ? extends List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> map = new LinkedHashMap<>();
        multiValue.forEach((key, values) -> append(map, key, values));
        return freeze(map);
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    private static void append(Map<String, List<String>> map, String name, List<String> values) {
        if (name == null || values == null) {
            return;
        }
        List<String> present = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null) {
                present.add(value);
            }
        }
        if (!present.isEmpty()) {
            map.computeIfAbsent(normalize(name), k -> new ArrayList<>()).addAll(present);
        }
    }

    private static HttpHeaders freeze(Map<String, List<String>> map) {
        if (map.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        map.forEach((key, values) -> frozen.put(key, List.copyOf(values)));
        return new HttpHeaders(Collections.unmodifiableMap(frozen));
    }

    private static String normalize(String name) {
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
        return "HttpHeaders" + store.keySet();
    }
}
