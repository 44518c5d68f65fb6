package com.acme.finops.fieldpath.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Operator configuration, e.g.
 * <pre>
 * on_error: drop
 * operations:
 *   - type: add
 *     field: resource['service.name']
 *     value: checkout
 *   - type: remove
 *     field: attributes.secret
 * </pre>
 */
public record TransformerConfig(
    @JsonProperty("on_error") OnError onError,
    @JsonProperty("operations") List<FieldOperation> operations
) {
    public TransformerConfig {
        onError = onError == null ? OnError.SEND : onError;
        operations = List.copyOf(operations == null ? List.of() : operations);
    }
}
