package com.roomdrawapp.roomdraw.snapshot;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.estimate.EstimationResult;

public interface EstimationResultSink {

    /** Publishes a finished result. Failures are reported to {@code anomalies}, never thrown. */
    void publish(EstimationResult result, AnomalyLog anomalies);
}
