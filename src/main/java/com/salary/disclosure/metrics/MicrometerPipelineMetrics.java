package com.salary.disclosure.metrics;

import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.pipeline.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link PipelineMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code pipeline.stage.duration} - Timer (tag: stage)</li>
 *   <li>{@code pipeline.records.ingested} - Counter</li>
 *   <li>{@code pipeline.inputs.rejected} - Counter</li>
 *   <li>{@code pipeline.values.malformed} - Counter</li>
 *   <li>{@code pipeline.chains.created} - Counter</li>
 *   <li>{@code pipeline.entities.registered} - Counter (tag: kind)</li>
 *   <li>{@code pipeline.cache.hit} / {@code pipeline.cache.miss} - Counters</li>
 * </ul>
 */
public class MicrometerPipelineMetrics implements PipelineMetrics {

    private final MeterRegistry registry;
    private final Map<PipelineStage, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<EntityKind, Counter> entityCounters = new ConcurrentHashMap<>();
    private final Counter recordsIngested;
    private final Counter inputsRejected;
    private final Counter malformedValues;
    private final Counter chainsCreated;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.recordsIngested = Counter.builder("pipeline.records.ingested")
                .description("Raw records accepted from yearly extracts")
                .register(registry);
        this.inputsRejected = Counter.builder("pipeline.inputs.rejected")
                .description("Input files rejected for missing required columns")
                .register(registry);
        this.malformedValues = Counter.builder("pipeline.values.malformed")
                .description("Unparseable values replaced by a safe default")
                .register(registry);
        this.chainsCreated = Counter.builder("pipeline.chains.created")
                .description("Person chains produced by identity linkage")
                .register(registry);
        this.cacheHitCounter = Counter.builder("pipeline.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("pipeline.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordStageDuration(PipelineStage stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, s ->
                Timer.builder("pipeline.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", s.getId())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRecordsIngested(long count) {
        recordsIngested.increment(count);
    }

    @Override
    public void incrementInputsRejected() {
        inputsRejected.increment();
    }

    @Override
    public void incrementMalformedValues(long count) {
        malformedValues.increment(count);
    }

    @Override
    public void incrementChainsCreated(long count) {
        chainsCreated.increment(count);
    }

    @Override
    public void incrementEntityRegistered(EntityKind kind) {
        Counter counter = entityCounters.computeIfAbsent(kind, k ->
                Counter.builder("pipeline.entities.registered")
                        .description("Distinct canonical entities registered")
                        .tag("kind", k.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
