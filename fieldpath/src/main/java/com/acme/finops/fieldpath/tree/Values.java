package com.acme.finops.fieldpath.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the dynamic values stored in entry trees: {@code null}, booleans, numbers, strings,
 * {@code List<Object>} and {@code Map<String, Object>}.
 */
public final class Values {
    private Values() {
    }

    /**
     * Deep copy into mutable containers. Map keys are converted with {@link String#valueOf(Object)};
     * scalars are returned as is.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyOfMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(deepCopy(item));
            }
            return out;
        }
        return value;
    }

    public static Map<String, Object> copyOfMap(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>(Math.max(4, map.size() * 2));
        for (Map.Entry<?, ?> e : map.entrySet()) {
            out.put(String.valueOf(e.getKey()), deepCopy(e.getValue()));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
