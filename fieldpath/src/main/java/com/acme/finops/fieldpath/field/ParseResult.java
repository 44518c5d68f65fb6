package com.acme.finops.fieldpath.field;

import java.util.Objects;

public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {
    record Success(Field field) implements ParseResult {
        public Success {
            Objects.requireNonNull(field, "field");
        }
    }

    /**
     * @param position character offset in the source text where parsing stopped
     */
    record Failure(ParseErrorCode code, String message, int position) implements ParseResult {
        public Failure {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
        }
    }
}
