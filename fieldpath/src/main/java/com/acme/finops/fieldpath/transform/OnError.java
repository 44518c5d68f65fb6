package com.acme.finops.fieldpath.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a transformer does with an entry once one of its operations fails.
 */
public enum OnError {
    /** Log and pass the entry on with the operations applied so far. */
    SEND,
    /** Log and drop the entry. */
    DROP;

    @JsonCreator
    public static OnError fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SEND;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "drop", "drop_on_error" -> DROP;
            default -> SEND;
        };
    }

    @JsonValue
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
