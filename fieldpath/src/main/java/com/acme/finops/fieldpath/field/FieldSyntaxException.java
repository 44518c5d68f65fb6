package com.acme.finops.fieldpath.field;

/**
 * Thrown when a path expression cannot be turned into a {@link Field}.
 * A malformed expression is a configuration defect, so this is unchecked.
 */
public final class FieldSyntaxException extends IllegalArgumentException {
    private final ParseErrorCode code;
    private final int position;

    public FieldSyntaxException(ParseResult.Failure failure) {
        super(failure.message());
        this.code = failure.code();
        this.position = failure.position();
    }

    public ParseErrorCode code() {
        return code;
    }

    public int position() {
        return position;
    }
}
