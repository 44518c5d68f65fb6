package com.acme.finops.fieldpath.field;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Reads a {@link Field} from a JSON string or YAML scalar. Works with any Jackson format, so JSON and
 * YAML configuration share the parser and its error messages.
 *
 * <p>The default instance accepts every root keyword. Use the nested subclasses on configuration
 * properties that must address one sub-tree:</p>
 * <pre>{@code
 * @JsonDeserialize(using = FieldDeserializer.ResourceOnly.class)
 * Field target;
 * }</pre>
 */
public class FieldDeserializer extends StdDeserializer<Field> {
    private final Set<RootKind> allowedRoots;

    public FieldDeserializer() {
        this(EnumSet.allOf(RootKind.class));
    }

    protected FieldDeserializer(RootKind requiredRoot) {
        this(EnumSet.of(requiredRoot));
    }

    private FieldDeserializer(EnumSet<RootKind> allowedRoots) {
        super(Field.class);
        this.allowedRoots = Collections.unmodifiableSet(allowedRoots);
    }

    @Override
    public Field deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            throw MismatchedInputException.from(p, Field.class, FieldPathParser.NOT_A_STRING_MESSAGE);
        }
        String expression = p.getText();
        ParseResult result = FieldPathParser.parse(expression, allowedRoots);
        if (result instanceof ParseResult.Success success) {
            return success.field();
        }
        ParseResult.Failure failure = (ParseResult.Failure) result;
        throw InvalidFormatException.from(p, failure.message(), expression, Field.class);
    }

    public static final class ResourceOnly extends FieldDeserializer {
        public ResourceOnly() {
            super(RootKind.RESOURCE);
        }
    }

    public static final class AttributesOnly extends FieldDeserializer {
        public AttributesOnly() {
            super(RootKind.ATTRIBUTES);
        }
    }

    public static final class BodyOnly extends FieldDeserializer {
        public BodyOnly() {
            super(RootKind.BODY);
        }
    }
}
