package com.acme.finops.fieldpath.transform;

import com.acme.finops.fieldpath.field.Field;

public class TransformException extends Exception {
    private final TransformErrorCode code;
    private final Field field;

    public TransformException(TransformErrorCode code, Field field, String message) {
        this(code, field, message, null);
    }

    public TransformException(TransformErrorCode code, Field field, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.field = field;
    }

    public TransformErrorCode code() { return code; }
    public Field field() { return field; }
}
