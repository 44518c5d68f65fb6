package com.acme.finops.fieldpath.transform;

public enum TransformErrorCode {
    FIELD_NOT_FOUND,
    WRITE_FAILED
}
