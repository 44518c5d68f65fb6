package com.acme.finops.fieldpath.transform;

import com.acme.finops.fieldpath.entry.Entry;
import com.acme.finops.fieldpath.telemetry.NoopTransformMetrics;
import com.acme.finops.fieldpath.telemetry.TransformMetrics;
import com.acme.finops.fieldpath.util.ConfigCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Pipeline operator that applies a fixed list of {@link FieldOperation}s to each entry, in order.
 *
 * <p>Processing stops at the first failing operation; {@link OnError} decides whether the entry is
 * still passed on. Immutable once built and safe to share between worker threads, as long as each
 * entry is processed by one thread at a time.</p>
 */
public final class EntryTransformer {
    private static final Logger LOG = Logger.getLogger(EntryTransformer.class.getName());

    private final String id;
    private final OnError onError;
    private final List<FieldOperation> operations;
    private final TransformMetrics metrics;

    public EntryTransformer(String id, TransformerConfig config, TransformMetrics metrics) {
        this.id = Objects.requireNonNull(id, "id");
        Objects.requireNonNull(config, "config");
        this.onError = config.onError();
        this.operations = config.operations();
        this.metrics = metrics == null ? NoopTransformMetrics.INSTANCE : metrics;
        LOG.info(() -> "Transformer " + id + " configured with " + operations.size()
            + " operations, on_error=" + onError.configName());
    }

    public static EntryTransformer fromYaml(String id, String yaml, TransformMetrics metrics) throws JsonProcessingException {
        return new EntryTransformer(id, ConfigCodec.readYaml(yaml, TransformerConfig.class), metrics);
    }

    public static EntryTransformer fromJson(String id, String json, TransformMetrics metrics) throws JsonProcessingException {
        return new EntryTransformer(id, ConfigCodec.readJson(json, TransformerConfig.class), metrics);
    }

    public String id() {
        return id;
    }

    public OnError onError() {
        return onError;
    }

    public List<FieldOperation> operations() {
        return operations;
    }

    /**
     * @return the entry, mutated in place, or empty if it was dropped
     */
    public Optional<Entry> process(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        long start = System.nanoTime();
        metrics.incEntriesIn(1);
        try {
            for (FieldOperation operation : operations) {
                try {
                    operation.apply(entry);
                    metrics.incOperationsApplied(1);
                } catch (TransformException e) {
                    metrics.incOperationsFailed(1, e.code());
                    if (onError == OnError.DROP) {
                        LOG.warning("Transformer " + id + " dropped entry: " + e.getMessage());
                        metrics.incEntriesDropped(1);
                        return Optional.empty();
                    }
                    LOG.warning("Transformer " + id + " skipped remaining operations: " + e.getMessage());
                    break;
                }
            }
            metrics.incEntriesOut(1);
            return Optional.of(entry);
        } finally {
            metrics.observeProcessNanos(System.nanoTime() - start);
        }
    }
}
