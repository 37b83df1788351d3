package dev.everydaythings.textmetrics.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of style properties keyed by kebab-case name.
 *
 * <p>Empty values are treated as absent so that a blank computed style
 * never shadows a lower layer. Snapshots are built fresh for each
 * measurement call via {@link #layered()}.
 */
public final class StyleSnapshot {

    public static final StyleSnapshot EMPTY = new StyleSnapshot(Collections.emptyMap());

    /** Built-in defaults, the lowest layer of every merge. */
    public static final StyleSnapshot DEFAULTS = StyleSnapshot.of(Map.of(
            StyleKeys.FONT_SIZE, "16px",
            StyleKeys.FONT_WEIGHT, "400",
            StyleKeys.FONT_FAMILY, "Helvetica, Arial, sans-serif"));

    private final Map<String, String> properties;

    private StyleSnapshot(Map<String, String> properties) {
        this.properties = properties;
    }

    /**
     * Create a snapshot from arbitrary keys and values. Keys are normalized
     * to kebab-case, numbers are formatted without a trailing {@code .0},
     * null and empty values are dropped.
     */
    public static StyleSnapshot of(Map<String, ?> values) {
        Map<String, String> props = new LinkedHashMap<>();
        putAll(props, values);
        return props.isEmpty() ? EMPTY : new StyleSnapshot(Collections.unmodifiableMap(props));
    }

    /** Start a merge; each later layer takes precedence over earlier ones. */
    public static Builder layered() {
        return new Builder();
    }

    /** Value for {@code key} (either casing), or null if absent. */
    public String get(String key) {
        return properties.get(StyleKeys.toKebabCase(key));
    }

    public String get(String key, String fallback) {
        String value = get(key);
        return value != null ? value : fallback;
    }

    public boolean has(String key) {
        return get(key) != null;
    }

    /** Copy with one property replaced. */
    public StyleSnapshot with(String key, Object value) {
        return layered().layer(this).layer(Map.of(key, value)).build();
    }

    public Map<String, String> asMap() {
        return properties;
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StyleSnapshot && ((StyleSnapshot) o).properties.equals(properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(properties);
    }

    @Override
    public String toString() {
        return "StyleSnapshot" + properties;
    }

    static String stringify(Object value) {
        if (value == null) return null;
        if (value instanceof Double || value instanceof Float) {
            return Lengths.format(((Number) value).doubleValue());
        }
        String s = value.toString();
        return s.isEmpty() ? null : s;
    }

    private static void putAll(Map<String, String> target, Map<String, ?> values) {
        if (values == null) return;
        for (Map.Entry<String, ?> e : values.entrySet()) {
            String value = stringify(e.getValue());
            if (value != null) {
                target.put(StyleKeys.toKebabCase(e.getKey()), value);
            }
        }
    }

    /** Accumulates layers in increasing precedence. */
    public static final class Builder {

        private final Map<String, String> merged = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder layer(StyleSnapshot snapshot) {
            if (snapshot != null) {
                merged.putAll(snapshot.properties);
            }
            return this;
        }

        public Builder layer(Map<String, ?> values) {
            putAll(merged, values);
            return this;
        }

        public StyleSnapshot build() {
            return merged.isEmpty() ? EMPTY : new StyleSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(merged)));
        }
    }
}
