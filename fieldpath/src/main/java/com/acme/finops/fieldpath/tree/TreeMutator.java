package com.acme.finops.fieldpath.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read, write, delete and merge at a key path inside a nested {@code Map<String, Object>} tree.
 *
 * <p>Write policy:
 * <ul>
 *   <li>missing intermediate keys are created as empty maps, an existing non-map intermediate blocks the write;</li>
 *   <li>a map written over a map is merged one level deep (incoming keys win, nested maps are replaced whole);</li>
 *   <li>anything else replaces the stored value;</li>
 *   <li>a map-only root never takes a non-map value.</li>
 * </ul>
 * Merge uses the same shallow merge but never fails: non-map locations on the way are replaced by maps.</p>
 *
 * <p>Stored maps and lists are deep mutable copies of the supplied values. No internal state; callers
 * confine a tree to one thread at a time.</p>
 */
public final class TreeMutator {

    private TreeMutator() {
    }

    public static FieldLookup get(Subtree subtree, List<String> keys) {
        Object current = subtree.value();
        if (keys.isEmpty()) {
            return current == null ? FieldLookup.absent() : FieldLookup.present(current);
        }
        for (String key : keys) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(key)) {
                return FieldLookup.absent();
            }
            current = map.get(key);
        }
        return FieldLookup.present(current);
    }

    /**
     * Removes the value at {@code keys}. An empty path clears the whole subtree and returns its
     * previous contents.
     */
    public static FieldLookup delete(Subtree subtree, List<String> keys) {
        Object root = subtree.value();
        if (keys.isEmpty()) {
            subtree.replace(subtree.mapOnly() ? new LinkedHashMap<String, Object>() : null);
            return root == null ? FieldLookup.absent() : FieldLookup.present(root);
        }

        Object current = root;
        int last = keys.size() - 1;
        for (int i = 0; i < last; i++) {
            if (!(current instanceof Map<?, ?> map)) {
                return FieldLookup.absent();
            }
            current = map.get(keys.get(i));
        }
        if (!(current instanceof Map<?, ?> parent) || !parent.containsKey(keys.get(last))) {
            return FieldLookup.absent();
        }
        return FieldLookup.present(parent.remove(keys.get(last)));
    }

    public static void set(Subtree subtree, List<String> keys, Object value) throws FieldWriteException {
        Object root = subtree.value();
        if (keys.isEmpty()) {
            setRoot(subtree, root, value);
            return;
        }

        Map<String, Object> current;
        if (root instanceof Map) {
            current = Values.asMap(root);
        } else if (root == null) {
            current = new LinkedHashMap<>();
            subtree.replace(current);
        } else {
            throw new FieldWriteException(WriteErrorCode.PATH_BLOCKED, -1,
                "root holds a " + typeName(root) + ", cannot set key '" + keys.get(0) + "' below it");
        }

        // Blocking can only happen on existing nodes, and nothing below a created node exists,
        // so a failed write never leaves partially created containers behind.
        int last = keys.size() - 1;
        for (int i = 0; i < last; i++) {
            String key = keys.get(i);
            Object next = current.get(key);
            if (next == null) {
                Map<String, Object> created = new LinkedHashMap<>();
                current.put(key, created);
                current = created;
            } else if (next instanceof Map) {
                current = Values.asMap(next);
            } else {
                throw new FieldWriteException(WriteErrorCode.PATH_BLOCKED, i,
                    "value at key '" + key + "' is a " + typeName(next) + ", not a map");
            }
        }
        assign(current, keys.get(last), value);
    }

    public static void merge(Subtree subtree, List<String> keys, Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Object root = subtree.value();
        Map<String, Object> current;
        if (root instanceof Map) {
            current = Values.asMap(root);
        } else {
            current = new LinkedHashMap<>();
            subtree.replace(current);
        }
        for (String key : keys) {
            Object next = current.get(key);
            if (next instanceof Map) {
                current = Values.asMap(next);
            } else {
                Map<String, Object> created = new LinkedHashMap<>();
                current.put(key, created);
                current = created;
            }
        }
        mergeInto(current, values);
    }

    private static void setRoot(Subtree subtree, Object root, Object value) throws FieldWriteException {
        if (root instanceof Map && value instanceof Map<?, ?> incoming) {
            mergeInto(Values.asMap(root), incoming);
            return;
        }
        if (subtree.mapOnly() && !(value instanceof Map)) {
            throw new FieldWriteException(WriteErrorCode.ROOT_NOT_MAP, -1,
                "cannot replace a map root with a " + typeName(value));
        }
        subtree.replace(Values.deepCopy(value));
    }

    private static void assign(Map<String, Object> parent, String key, Object value) {
        Object existing = parent.get(key);
        if (existing instanceof Map && value instanceof Map<?, ?> incoming) {
            mergeInto(Values.asMap(existing), incoming);
        } else {
            parent.put(key, Values.deepCopy(value));
        }
    }

    private static void mergeInto(Map<String, Object> target, Map<?, ?> incoming) {
        // copy first: incoming may be the target itself
        target.putAll(Values.copyOfMap(incoming));
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
