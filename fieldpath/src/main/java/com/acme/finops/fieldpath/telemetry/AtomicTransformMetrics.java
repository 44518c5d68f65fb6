package com.acme.finops.fieldpath.telemetry;

import com.acme.finops.fieldpath.transform.TransformErrorCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicTransformMetrics implements TransformMetrics {
    private final LongAdder entriesIn = new LongAdder();
    private final LongAdder entriesOut = new LongAdder();
    private final LongAdder entriesDropped = new LongAdder();
    private final LongAdder operationsApplied = new LongAdder();
    private final LongAdder processNanos = new LongAdder();
    private final LongAdder processSamples = new LongAdder();
    private final ConcurrentHashMap<TransformErrorCode, LongAdder> failuresByCode = new ConcurrentHashMap<>();

    @Override
    public void incEntriesIn(long n) {
        entriesIn.add(Math.max(0L, n));
    }

    @Override
    public void incEntriesOut(long n) {
        entriesOut.add(Math.max(0L, n));
    }

    @Override
    public void incEntriesDropped(long n) {
        entriesDropped.add(Math.max(0L, n));
    }

    @Override
    public void incOperationsApplied(long n) {
        operationsApplied.add(Math.max(0L, n));
    }

    @Override
    public void incOperationsFailed(long n, TransformErrorCode code) {
        if (n <= 0 || code == null) return;
        failuresByCode.computeIfAbsent(code, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void observeProcessNanos(long nanos) {
        if (nanos < 0) return;
        processNanos.add(nanos);
        processSamples.increment();
    }

    public Snapshot snapshot() {
        Map<TransformErrorCode, Long> failures = new EnumMap<>(TransformErrorCode.class);
        failuresByCode.forEach((k, v) -> failures.put(k, v.sum()));
        return new Snapshot(
            entriesIn.sum(),
            entriesOut.sum(),
            entriesDropped.sum(),
            operationsApplied.sum(),
            processNanos.sum(),
            processSamples.sum(),
            Collections.unmodifiableMap(failures)
        );
    }

    public record Snapshot(long entriesIn,
                           long entriesOut,
                           long entriesDropped,
                           long operationsApplied,
                           long processNanosTotal,
                           long processSamples,
                           Map<TransformErrorCode, Long> operationsFailedByCode) {

        public long operationsFailed() {
            long total = 0;
            for (long v : operationsFailedByCode.values()) {
                total += v;
            }
            return total;
        }
    }
}
