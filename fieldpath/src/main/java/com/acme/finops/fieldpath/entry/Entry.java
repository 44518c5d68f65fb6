package com.acme.finops.fieldpath.entry;

import com.acme.finops.fieldpath.field.Field;
import com.acme.finops.fieldpath.field.RootKind;
import com.acme.finops.fieldpath.tree.FieldLookup;
import com.acme.finops.fieldpath.tree.FieldWriteException;
import com.acme.finops.fieldpath.tree.Subtree;
import com.acme.finops.fieldpath.tree.Values;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One telemetry event moving through the pipeline.
 *
 * <p>Resource and attributes are never {@code null}: an empty map is their uninitialized form.
 * The body may hold any value, {@code null} included. Maps and lists handed to setters are deep
 * copied so the entry owns mutable containers all the way down.</p>
 *
 * <p>Not thread-safe. An entry is owned by one pipeline stage at a time.</p>
 */
public final class Entry {
    private Instant timestamp;
    private Object body;
    private Map<String, Object> resource = new LinkedHashMap<>();
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public Entry() {
        this(Instant.now());
    }

    public Entry(Instant timestamp) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public Instant timestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public Object body() {
        return body;
    }

    public void setBody(Object body) {
        this.body = Values.deepCopy(body);
    }

    /**
     * @return the live resource map
     */
    public Map<String, Object> resource() {
        return resource;
    }

    public void setResource(Map<String, ?> resource) {
        this.resource = resource == null ? new LinkedHashMap<>() : Values.copyOfMap(resource);
    }

    /**
     * @return the live attributes map
     */
    public Map<String, Object> attributes() {
        return attributes;
    }

    public void setAttributes(Map<String, ?> attributes) {
        this.attributes = attributes == null ? new LinkedHashMap<>() : Values.copyOfMap(attributes);
    }

    public void addAttribute(String key, Object value) {
        attributes.put(Objects.requireNonNull(key, "key"), Values.deepCopy(value));
    }

    public void addResourceKey(String key, Object value) {
        resource.put(Objects.requireNonNull(key, "key"), Values.deepCopy(value));
    }

    public FieldLookup get(Field field) {
        return field.get(this);
    }

    public void set(Field field, Object value) throws FieldWriteException {
        field.set(this, value);
    }

    public FieldLookup delete(Field field) {
        return field.delete(this);
    }

    public void merge(Field field, Map<String, ?> values) {
        field.merge(this, values);
    }

    /**
     * Reads a scalar as text: strings as is, numbers and booleans via {@link String#valueOf(Object)}.
     */
    public Optional<String> readString(Field field) {
        Object value = field.get(this).orElse(null);
        if (value instanceof String s) {
            return Optional.of(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return Optional.of(String.valueOf(value));
        }
        return Optional.empty();
    }

    /**
     * View of the sub-tree selected by {@code root}, used by field operations.
     */
    public Subtree subtree(RootKind root) {
        Objects.requireNonNull(root, "root");
        return new Subtree() {
            @Override
            public Object value() {
                return switch (root) {
                    case BODY -> body;
                    case ATTRIBUTES -> attributes;
                    case RESOURCE -> resource;
                };
            }

            @Override
            public void replace(Object value) {
                switch (root) {
                    case BODY -> body = value;
                    case ATTRIBUTES -> attributes = asRootMap(value);
                    case RESOURCE -> resource = asRootMap(value);
                }
            }

            @Override
            public boolean mapOnly() {
                return root.mapOnly();
            }
        };
    }

    public Entry copy() {
        Entry out = new Entry(timestamp);
        out.body = Values.deepCopy(body);
        out.resource = Values.copyOfMap(resource);
        out.attributes = Values.copyOfMap(attributes);
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asRootMap(Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("map root cannot hold " + value.getClass().getSimpleName());
        }
        return (Map<String, Object>) value;
    }

    @Override
    public String toString() {
        return "Entry{timestamp=" + timestamp
            + ", body=" + body
            + ", resource=" + resource
            + ", attributes=" + attributes + '}';
    }
}
