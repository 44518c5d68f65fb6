package com.acme.finops.fieldpath.field;

/**
 * Selects which sub-tree of an entry a {@link Field} addresses.
 *
 * <p>Map-typed roots (resource, attributes) must always hold a map; the body may hold any value.</p>
 */
public enum RootKind {
    BODY("body", false),
    ATTRIBUTES("attributes", true),
    RESOURCE("resource", true);

    private final String keyword;
    private final boolean mapOnly;

    RootKind(String keyword, boolean mapOnly) {
        this.keyword = keyword;
        this.mapOnly = mapOnly;
    }

    public String keyword() {
        return keyword;
    }

    public boolean mapOnly() {
        return mapOnly;
    }

    /**
     * @return the root kind for an exact keyword match, or {@code null}
     */
    public static RootKind fromKeyword(String raw) {
        if (raw == null) {
            return null;
        }
        for (RootKind kind : values()) {
            if (kind.keyword.equals(raw)) {
                return kind;
            }
        }
        return null;
    }
}
