package com.acme.finops.fieldpath.telemetry;

import com.acme.finops.fieldpath.transform.TransformErrorCode;

public interface TransformMetrics {
    void incEntriesIn(long n);
    void incEntriesOut(long n);
    void incEntriesDropped(long n);
    void incOperationsApplied(long n);
    void incOperationsFailed(long n, TransformErrorCode code);
    void observeProcessNanos(long nanos);
}
