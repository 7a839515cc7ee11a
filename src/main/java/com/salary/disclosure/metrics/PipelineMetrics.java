package com.salary.disclosure.metrics;

import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.pipeline.PipelineStage;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpPipelineMetrics} does nothing.
 */
public interface PipelineMetrics {

    void recordStageDuration(PipelineStage stage, Duration duration);

    void incrementRecordsIngested(long count);

    void incrementInputsRejected();

    void incrementMalformedValues(long count);

    void incrementChainsCreated(long count);

    void incrementEntityRegistered(EntityKind kind);

    void recordCacheHit();

    void recordCacheMiss();
}
