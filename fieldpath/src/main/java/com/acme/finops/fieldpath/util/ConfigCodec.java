package com.acme.finops.fieldpath.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Shared Jackson mappers for pipeline configuration in JSON or YAML.
 */
public final class ConfigCodec {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new YAMLMapper();

    private ConfigCodec() {
    }

    public static <T> T readJson(String raw, Class<T> type) throws JsonProcessingException {
        return JSON.readValue(raw, type);
    }

    public static <T> T readYaml(String raw, Class<T> type) throws JsonProcessingException {
        return YAML.readValue(raw, type);
    }

    public static String writeJson(Object value) throws JsonProcessingException {
        return JSON.writeValueAsString(value);
    }
}
