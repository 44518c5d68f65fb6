package com.acme.finops.fieldpath.field;

public enum ParseErrorCode {
    NOT_A_STRING,
    WRONG_ROOT,
    UNCLOSED_BRACKET,
    UNQUOTED_BRACKET_KEY,
    UNCLOSED_QUOTE,
    TEXT_AFTER_QUOTE,
    MISSING_SEPARATOR,
    UNEXPECTED_RIGHT_BRACKET
}
