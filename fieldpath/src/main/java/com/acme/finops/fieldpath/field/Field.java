package com.acme.finops.fieldpath.field;

import com.acme.finops.fieldpath.entry.Entry;
import com.acme.finops.fieldpath.tree.FieldLookup;
import com.acme.finops.fieldpath.tree.FieldWriteException;
import com.acme.finops.fieldpath.tree.TreeMutator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable address of a value inside one of an entry's sub-trees.
 *
 * <p>A field is a root kind plus an ordered list of map keys; no keys addresses the whole sub-tree.
 * Fields are usually parsed once from pipeline configuration and then shared between threads, so
 * every operation leaves the field itself untouched and {@link #child(String)} / {@link #parent()}
 * return new instances.</p>
 *
 * <p>Serialized as its {@link #toExpression() expression}, deserialized with {@link FieldDeserializer}.</p>
 */
@JsonDeserialize(using = FieldDeserializer.class)
public record Field(RootKind root, List<String> keys) {

    public Field {
        Objects.requireNonNull(root, "root");
        keys = List.copyOf(keys == null ? List.of() : keys);
    }

    public static Field resource(String... keys) {
        return new Field(RootKind.RESOURCE, Arrays.asList(keys));
    }

    public static Field attributes(String... keys) {
        return new Field(RootKind.ATTRIBUTES, Arrays.asList(keys));
    }

    public static Field body(String... keys) {
        return new Field(RootKind.BODY, Arrays.asList(keys));
    }

    /**
     * Parses an expression with any root keyword.
     *
     * @throws FieldSyntaxException if the expression is malformed
     */
    public static Field parse(String expression) {
        return unwrap(FieldPathParser.parse(expression));
    }

    /**
     * Parses an expression that must use {@code requiredRoot}'s keyword.
     *
     * @throws FieldSyntaxException if the expression is malformed or has another root
     */
    public static Field parse(String expression, RootKind requiredRoot) {
        return unwrap(FieldPathParser.parse(expression, requiredRoot));
    }

    private static Field unwrap(ParseResult result) {
        if (result instanceof ParseResult.Success success) {
            return success.field();
        }
        throw new FieldSyntaxException((ParseResult.Failure) result);
    }

    public boolean isRoot() {
        return keys.isEmpty();
    }

    public String lastKey() {
        if (keys.isEmpty()) {
            throw new IllegalStateException("root field has no keys");
        }
        return keys.get(keys.size() - 1);
    }

    /**
     * @return this field without its last key; a root field is its own parent
     */
    public Field parent() {
        if (keys.isEmpty()) {
            return this;
        }
        return new Field(root, keys.subList(0, keys.size() - 1));
    }

    public Field child(String key) {
        Objects.requireNonNull(key, "key");
        List<String> next = new ArrayList<>(keys.size() + 1);
        next.addAll(keys);
        next.add(key);
        return new Field(root, next);
    }

    public FieldLookup get(Entry entry) {
        return TreeMutator.get(entry.subtree(root), keys);
    }

    public void set(Entry entry, Object value) throws FieldWriteException {
        TreeMutator.set(entry.subtree(root), keys, value);
    }

    public FieldLookup delete(Entry entry) {
        return TreeMutator.delete(entry.subtree(root), keys);
    }

    public void merge(Entry entry, Map<String, ?> values) {
        TreeMutator.merge(entry.subtree(root), keys, values);
    }

    /**
     * Canonical text form. Keys that are empty or contain {@code .}, {@code [} or {@code ]} are
     * bracketed; parsing the result yields an equal field unless a key contains both quote characters.
     */
    @JsonValue
    public String toExpression() {
        StringBuilder sb = new StringBuilder(root.keyword());
        for (String key : keys) {
            if (isPlainKey(key)) {
                sb.append('.').append(key);
            } else {
                char quote = key.indexOf('\'') >= 0 && key.indexOf('"') < 0 ? '"' : '\'';
                sb.append('[').append(quote).append(key).append(quote).append(']');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toExpression();
    }

    private static boolean isPlainKey(String key) {
        if (key.isEmpty()) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '.' || c == '[' || c == ']') {
                return false;
            }
        }
        return true;
    }
}
