package com.acme.finops.fieldpath.tree;

/**
 * A replaceable root value that {@link TreeMutator} navigates from.
 */
public interface Subtree {

    Object value();

    void replace(Object value);

    /**
     * @return {@code true} if the root must always hold a map
     */
    boolean mapOnly();

    /**
     * Standalone holder, not backed by an entry.
     */
    static Subtree detached(Object initial, boolean mapOnly) {
        return new Subtree() {
            private Object value = initial;

            @Override
            public Object value() {
                return value;
            }

            @Override
            public void replace(Object replacement) {
                value = replacement;
            }

            @Override
            public boolean mapOnly() {
                return mapOnly;
            }
        };
    }
}
