package com.acme.finops.fieldpath.tree;

/**
 * Outcome of reading or removing a value at a path.
 *
 * <p>{@link Absent} carries no payload; a stored {@code null} is reported as {@code Present(null)}.</p>
 */
public sealed interface FieldLookup permits FieldLookup.Present, FieldLookup.Absent {

    static FieldLookup present(Object value) {
        return new Present(value);
    }

    static FieldLookup absent() {
        return Absent.INSTANCE;
    }

    boolean found();

    Object orElse(Object fallback);

    record Present(Object value) implements FieldLookup {
        @Override
        public boolean found() {
            return true;
        }

        @Override
        public Object orElse(Object fallback) {
            return value;
        }
    }

    record Absent() implements FieldLookup {
        static final Absent INSTANCE = new Absent();

        @Override
        public boolean found() {
            return false;
        }

        @Override
        public Object orElse(Object fallback) {
            return fallback;
        }
    }
}
