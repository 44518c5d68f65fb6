package com.acme.finops.fieldpath.transform;

import com.acme.finops.fieldpath.entry.Entry;
import com.acme.finops.fieldpath.field.Field;
import com.acme.finops.fieldpath.tree.FieldLookup;
import com.acme.finops.fieldpath.tree.FieldWriteException;
import com.acme.finops.fieldpath.tree.Values;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * A single field mutation as written in pipeline configuration, selected by its {@code type} property:
 * <pre>
 * - type: move
 *   from: attributes['http.url']
 *   to: body.request.url
 * </pre>
 * Operations are immutable and may be applied to many entries concurrently.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FieldOperation.Add.class, name = "add"),
    @JsonSubTypes.Type(value = FieldOperation.Remove.class, name = "remove"),
    @JsonSubTypes.Type(value = FieldOperation.Move.class, name = "move"),
    @JsonSubTypes.Type(value = FieldOperation.Copy.class, name = "copy"),
    @JsonSubTypes.Type(value = FieldOperation.Merge.class, name = "merge")
})
public sealed interface FieldOperation
    permits FieldOperation.Add, FieldOperation.Remove, FieldOperation.Move, FieldOperation.Copy, FieldOperation.Merge {

    void apply(Entry entry) throws TransformException;

    record Add(@JsonProperty("field") Field field, @JsonProperty("value") Object value) implements FieldOperation {
        public Add {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public void apply(Entry entry) throws TransformException {
            write(entry, field, value);
        }
    }

    record Remove(@JsonProperty("field") Field field) implements FieldOperation {
        public Remove {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public void apply(Entry entry) throws TransformException {
            if (!field.delete(entry).found()) {
                throw notFound(field);
            }
        }
    }

    record Move(@JsonProperty("from") Field from, @JsonProperty("to") Field to) implements FieldOperation {
        public Move {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }

        @Override
        public void apply(Entry entry) throws TransformException {
            FieldLookup removed = from.delete(entry);
            if (!(removed instanceof FieldLookup.Present present)) {
                throw notFound(from);
            }
            try {
                to.set(entry, present.value());
            } catch (FieldWriteException e) {
                TransformException failure = writeFailed(to, e);
                try {
                    from.set(entry, present.value());
                } catch (FieldWriteException restore) {
                    failure.addSuppressed(restore);
                }
                throw failure;
            }
        }
    }

    record Copy(@JsonProperty("from") Field from, @JsonProperty("to") Field to) implements FieldOperation {
        public Copy {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }

        @Override
        public void apply(Entry entry) throws TransformException {
            FieldLookup source = from.get(entry);
            if (!(source instanceof FieldLookup.Present present)) {
                throw notFound(from);
            }
            write(entry, to, present.value());
        }
    }

    record Merge(@JsonProperty("field") Field field,
                 @JsonProperty("values") Map<String, Object> values) implements FieldOperation {
        public Merge {
            Objects.requireNonNull(field, "field");
            values = values == null ? Map.of() : Collections.unmodifiableMap(Values.copyOfMap(values));
        }

        @Override
        public void apply(Entry entry) {
            field.merge(entry, values);
        }
    }

    private static void write(Entry entry, Field field, Object value) throws TransformException {
        try {
            field.set(entry, value);
        } catch (FieldWriteException e) {
            throw writeFailed(field, e);
        }
    }

    private static TransformException notFound(Field field) {
        return new TransformException(TransformErrorCode.FIELD_NOT_FOUND, field, "field " + field + " does not exist");
    }

    private static TransformException writeFailed(Field field, FieldWriteException cause) {
        return new TransformException(TransformErrorCode.WRITE_FAILED, field,
            "cannot set " + field + ": " + cause.getMessage(), cause);
    }
}
