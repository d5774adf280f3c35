package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One raw audit record as collected from the source tenant.
 *
 * <p>
 * Records arrive as free-form JSON objects or CSV rows whose shape depends
 * on the upstream log (directory audit API, unified audit log export, ...).
 * This class stores them as a {@link Map} so the normalizer can query
 * arbitrary fields without a rigid schema.
 * </p>
 *
 * <h3>Field paths</h3>
 * <p>
 * Accessors accept dotted paths such as {@code initiatedBy.user.ipAddress};
 * each segment descends into a nested JSON object. A path that hits a
 * missing key or a non-object value resolves to empty.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe while being populated. Once handed to the analysis engine
 * a record is only read.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuditRecord {

    /** Every key-value pair of the original record, in source order. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public AuditRecord() {
    }

    /**
     * Create a record holding a copy of the given fields.
     *
     * @param fields source fields; must not be {@code null}
     * @throws NullPointerException if {@code fields} or any key is {@code null}
     */
    public AuditRecord(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "Fields must not be null");
        fields.forEach(this::setField);
    }

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the JSON key; must not be {@code null}
     * @param value the JSON value
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of all top-level fields
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * Resolve a (possibly dotted) field path.
     *
     * @param path field name or dotted path
     * @return optional containing the value, or empty if not present
     */
    public Optional<Object> getField(String path) {
        Objects.requireNonNull(path, "Field path must not be null");
        Object current = fields;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Resolve a field path to a non-blank string.
     *
     * <p>
     * Scalars are converted with {@link Object#toString()}; blank strings,
     * objects and arrays resolve to empty so that callers can fall through
     * to the next alternative.
     * </p>
     *
     * @param path field name or dotted path
     * @return optional containing the trimmed string value
     */
    public Optional<String> getStringField(String path) {
        return getField(path)
                .filter(v -> !(v instanceof Map) && !(v instanceof List))
                .map(v -> v.toString().trim())
                .filter(s -> !s.isEmpty());
    }

    /**
     * Resolve a field path to a list value.
     *
     * @param path field name or dotted path
     * @return optional containing an unmodifiable copy of the list
     */
    public Optional<List<Object>> getListField(String path) {
        Optional<Object> raw = getField(path);
        if (raw.isEmpty() || !(raw.get() instanceof List<?> list)) {
            return Optional.empty();
        }
        List<Object> copy = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                copy.add(item);
            }
        }
        return Optional.of(Collections.unmodifiableList(copy));
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AuditRecord that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "AuditRecord" + fields;
    }
}
