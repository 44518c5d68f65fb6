package com.acme.finops.fieldpath.transform;

import com.acme.finops.fieldpath.entry.Entry;
import com.acme.finops.fieldpath.field.Field;
import com.acme.finops.fieldpath.telemetry.AtomicTransformMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryTransformerTest {

    private static final String YAML = String.join("\n",
        "on_error: drop",
        "operations:",
        "  - type: add",
        "    field: resource['service.name']",
        "    value: checkout",
        "  - type: move",
        "    from: attributes['http.url']",
        "    to: body.request.url",
        "  - type: copy",
        "    from: resource['service.name']",
        "    to: attributes.service",
        "  - type: merge",
        "    field: body.request",
        "    values:",
        "      method: GET",
        "  - type: remove",
        "    field: attributes.secret",
        "");

    @Test
    void shouldParseOperationsFromYaml() throws Exception {
        EntryTransformer transformer = EntryTransformer.fromYaml("t1", YAML, null);

        assertEquals(OnError.DROP, transformer.onError());
        assertEquals(5, transformer.operations().size());
        FieldOperation.Move move = assertInstanceOf(FieldOperation.Move.class, transformer.operations().get(1));
        assertEquals(Field.attributes("http.url"), move.from());
        assertEquals(Field.body("request", "url"), move.to());
    }

    @Test
    void shouldApplyOperationsInOrder() throws Exception {
        AtomicTransformMetrics metrics = new AtomicTransformMetrics();
        EntryTransformer transformer = EntryTransformer.fromYaml("t1", YAML, metrics);

        Entry entry = new Entry();
        entry.addAttribute("http.url", "/cart");
        entry.addAttribute("secret", "hunter2");

        Optional<Entry> out = transformer.process(entry);

        assertSame(entry, out.orElseThrow());
        assertEquals(Map.of("service.name", "checkout"), entry.resource());
        assertEquals(Map.of("service", "checkout"), entry.attributes());
        assertEquals(Map.of("request", Map.of("url", "/cart", "method", "GET")), entry.body());

        AtomicTransformMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(1, snapshot.entriesIn());
        assertEquals(1, snapshot.entriesOut());
        assertEquals(5, snapshot.operationsApplied());
        assertEquals(0, snapshot.operationsFailed());
    }

    @Test
    void shouldDropEntryOnFailureWhenConfigured() throws Exception {
        AtomicTransformMetrics metrics = new AtomicTransformMetrics();
        EntryTransformer transformer = EntryTransformer.fromYaml("t1", YAML, metrics);

        Entry entry = new Entry();
        entry.addAttribute("secret", "hunter2");

        assertTrue(transformer.process(entry).isEmpty());
        AtomicTransformMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(1, snapshot.entriesDropped());
        assertEquals(0, snapshot.entriesOut());
        assertEquals(1L, snapshot.operationsFailedByCode().get(TransformErrorCode.FIELD_NOT_FOUND));
    }

    @Test
    void shouldSendPartiallyTransformedEntryByDefault() throws Exception {
        String json = "{\"operations\":["
            + "{\"type\":\"add\",\"field\":\"attributes.step\",\"value\":1},"
            + "{\"type\":\"add\",\"field\":\"attributes.step.deeper\",\"value\":2},"
            + "{\"type\":\"add\",\"field\":\"attributes.never\",\"value\":3}"
            + "]}";
        AtomicTransformMetrics metrics = new AtomicTransformMetrics();
        EntryTransformer transformer = EntryTransformer.fromJson("t2", json, metrics);
        assertEquals(OnError.SEND, transformer.onError());

        Entry entry = new Entry();
        Optional<Entry> out = transformer.process(entry);

        assertSame(entry, out.orElseThrow());
        assertEquals(Map.of("step", 1), entry.attributes());
        assertEquals(1L, metrics.snapshot().operationsFailedByCode().get(TransformErrorCode.WRITE_FAILED));
    }

    @Test
    void moveShouldRestoreSourceWhenTargetIsBlocked() throws Exception {
        Entry entry = new Entry();
        entry.addAttribute("src", "value");
        entry.setBody("plain text");

        FieldOperation.Move move = new FieldOperation.Move(Field.attributes("src"), Field.body("dst"));
        TransformException e = assertThrows(TransformException.class, () -> move.apply(entry));

        assertEquals(TransformErrorCode.WRITE_FAILED, e.code());
        assertEquals(Field.body("dst"), e.field());
        assertEquals(Map.of("src", "value"), entry.attributes());
        assertEquals("plain text", entry.body());
    }

    @Test
    void moveRootShouldRelocateWholeSubtree() throws Exception {
        Entry entry = new Entry();
        entry.setResource(Map.of("host", "a", "pod", "b"));

        new FieldOperation.Move(Field.resource(), Field.attributes("origin")).apply(entry);

        assertEquals(Map.of(), entry.resource());
        assertEquals(Map.of("origin", Map.of("host", "a", "pod", "b")), entry.attributes());
    }

    @Test
    void copyShouldNotAliasSource() throws Exception {
        Entry entry = new Entry();
        entry.addAttribute("labels", Map.of("env", "prod"));

        new FieldOperation.Copy(Field.attributes("labels"), Field.resource("labels")).apply(entry);
        entry.set(Field.resource("labels", "env"), "dev");

        assertEquals(Map.of("labels", Map.of("env", "prod")), entry.attributes());
        assertEquals(Map.of("labels", Map.of("env", "dev")), entry.resource());
    }

    @Test
    void shouldRejectUnknownOperationTypeAndBadFields() {
        assertThrows(JsonProcessingException.class, () -> EntryTransformer.fromJson("bad",
            "{\"operations\":[{\"type\":\"rename\",\"field\":\"body\"}]}", null));

        JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> EntryTransformer.fromYaml("bad",
            String.join("\n", "operations:", "  - type: remove", "    field: \"body['unclosed\"", ""), null));
        assertTrue(e.getMessage().contains("found unclosed left bracket"), e::getMessage);
    }

    @Test
    void onErrorShouldParseLeniently() {
        assertEquals(OnError.SEND, OnError.fromString(null));
        assertEquals(OnError.SEND, OnError.fromString(" send "));
        assertEquals(OnError.DROP, OnError.fromString("DROP"));
        assertEquals(List.of("send", "drop"), List.of(OnError.SEND.configName(), OnError.DROP.configName()));
    }
}
