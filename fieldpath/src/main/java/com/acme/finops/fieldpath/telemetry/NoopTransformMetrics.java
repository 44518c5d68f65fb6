package com.acme.finops.fieldpath.telemetry;

import com.acme.finops.fieldpath.transform.TransformErrorCode;

public final class NoopTransformMetrics implements TransformMetrics {
    public static final NoopTransformMetrics INSTANCE = new NoopTransformMetrics();

    private NoopTransformMetrics() {
    }

    @Override
    public void incEntriesIn(long n) {
    }

    @Override
    public void incEntriesOut(long n) {
    }

    @Override
    public void incEntriesDropped(long n) {
    }

    @Override
    public void incOperationsApplied(long n) {
    }

    @Override
    public void incOperationsFailed(long n, TransformErrorCode code) {
    }

    @Override
    public void observeProcessNanos(long nanos) {
    }
}
