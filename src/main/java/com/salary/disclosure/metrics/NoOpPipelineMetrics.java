package com.salary.disclosure.metrics;

import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.pipeline.PipelineStage;

import java.time.Duration;

/**
 * No-op implementation of {@link PipelineMetrics}.
 */
public class NoOpPipelineMetrics implements PipelineMetrics {

    @Override
    public void recordStageDuration(PipelineStage stage, Duration duration) {
    }

    @Override
    public void incrementRecordsIngested(long count) {
    }

    @Override
    public void incrementInputsRejected() {
    }

    @Override
    public void incrementMalformedValues(long count) {
    }

    @Override
    public void incrementChainsCreated(long count) {
    }

    @Override
    public void incrementEntityRegistered(EntityKind kind) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
