package com.medwatch.anomaly.engine;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.engine.spi.ModelDetector;
import com.medwatch.anomaly.engine.spi.RuleDetector;
import com.medwatch.anomaly.event.EngineErrorEvent;
import com.medwatch.anomaly.event.EngineInitializedEvent;
import com.medwatch.anomaly.event.EngineStartedEvent;
import com.medwatch.anomaly.event.EngineStoppedEvent;
import com.medwatch.anomaly.exception.BatchExecutionException;
import com.medwatch.anomaly.exception.EngineInitializationException;
import com.medwatch.anomaly.model.BatchRun;
import com.medwatch.anomaly.model.EngineState;
import com.medwatch.anomaly.model.EngineStatus;
import com.medwatch.anomaly.service.BatchProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the engine lifecycle and the batch cadence.
 *
 * STOPPED -> INITIALIZING -> READY -> RUNNING -> STOPPED, with FAILED when initialization fails.
 * A failed engine stays failed until the application is restarted.
 *
 * Ticks run on a single scheduler thread at a fixed rate. A tick that finds the previous batch
 * (or a manual run) still in flight is skipped rather than queued.
 */
@Component
public class AnomalyDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final RuleDetector ruleDetector;
    private final ModelDetector modelDetector;
    private final BatchProcessingService batchProcessingService;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final AnomalyEngineConfig engineConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean batchInFlight = new AtomicBoolean(false);
    private EngineState state = EngineState.STOPPED;
    private boolean initialized;
    private ScheduledFuture<?> tickHandle;
    private volatile BatchRun lastBatch;

    public AnomalyDetectionEngine(RuleDetector ruleDetector,
                                  ModelDetector modelDetector,
                                  BatchProcessingService batchProcessingService,
                                  @Qualifier("anomalyEngineScheduler") TaskScheduler scheduler,
                                  ApplicationEventPublisher eventPublisher,
                                  AnomalyEngineConfig engineConfig,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.ruleDetector = ruleDetector;
        this.modelDetector = modelDetector;
        this.batchProcessingService = batchProcessingService;
        this.scheduler = scheduler;
        this.eventPublisher = eventPublisher;
        this.engineConfig = engineConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!engineConfig.isAutoStart()) {
            log.info("Anomaly engine auto-start disabled; start it via POST /api/v1/engine/start");
            return;
        }
        if (initialize()) {
            start();
        }
    }

    /**
     * Load rules and, when model detection is enabled, the model.
     * Never throws: a failure moves the engine to FAILED and publishes {@link EngineErrorEvent}.
     *
     * @return true if the engine is ready to start
     */
    public synchronized boolean initialize() {
        if (initialized) {
            log.debug("Anomaly engine already initialized (state={})", state);
            return true;
        }
        if (state == EngineState.FAILED) {
            log.warn("Anomaly engine initialization previously failed; restart the application to retry");
            return false;
        }

        state = EngineState.INITIALIZING;
        log.info("Initializing anomaly engine (ruleEngine={}, mlModels={})",
                engineConfig.isEnableRuleEngine(), engineConfig.isEnableMlModels());
        try {
            int ruleCount = ruleDetector.loadRules();
            boolean modelsLoaded = engineConfig.isEnableMlModels() && modelDetector.loadModels();

            initialized = true;
            state = EngineState.READY;
            log.info("Anomaly engine initialized: {} active rules, model loaded={}", ruleCount, modelsLoaded);
            eventPublisher.publishEvent(new EngineInitializedEvent(ruleCount, modelsLoaded, clock.instant()));
            return true;
        } catch (RuntimeException e) {
            state = EngineState.FAILED;
            log.error("Anomaly engine initialization failed", e);
            eventPublisher.publishEvent(new EngineErrorEvent(
                    new EngineInitializationException("Anomaly engine initialization failed", e), clock.instant()));
            return false;
        }
    }

    /**
     * Arm the periodic tick. The first batch runs one interval from now.
     *
     * @return true if the engine was started by this call
     */
    public synchronized boolean start() {
        if (tickHandle != null) {
            log.info("Anomaly engine is already running");
            return false;
        }
        if (!initialized) {
            log.warn("Anomaly engine cannot start from state {}: not initialized", state);
            return false;
        }

        Duration interval = engineConfig.getProcessingInterval();
        tickHandle = scheduler.scheduleAtFixedRate(this::runTick, clock.instant().plus(interval), interval);
        state = EngineState.RUNNING;
        metricsConfig.updateEngineRunning(true);
        log.info("Anomaly engine started, processing every {}", interval);
        eventPublisher.publishEvent(new EngineStartedEvent(interval, clock.instant()));
        return true;
    }

    /**
     * Cancel future ticks. A batch already in flight is allowed to finish.
     *
     * @return true if the engine was running
     */
    public synchronized boolean stop() {
        if (tickHandle == null) {
            log.debug("Anomaly engine is not running; stop ignored");
            return false;
        }

        tickHandle.cancel(false);
        tickHandle = null;
        state = EngineState.STOPPED;
        metricsConfig.updateEngineRunning(false);
        log.info("Anomaly engine stopped");
        eventPublisher.publishEvent(new EngineStoppedEvent(clock.instant()));
        return true;
    }

    /**
     * Run one batch on the calling thread, outside the regular cadence.
     *
     * @return the batch, or empty if another batch was in flight
     * @throws IllegalStateException if the engine has not been initialized
     * @throws BatchExecutionException if the batch failed unexpectedly
     */
    public Optional<BatchRun> runOnce() {
        synchronized (this) {
            if (!initialized) {
                throw new IllegalStateException("Anomaly engine is not initialized (state=" + state + ")");
            }
        }
        try {
            return runGuarded();
        } catch (RuntimeException e) {
            throw new BatchExecutionException("Batch run failed: " + e.getMessage(), e);
        }
    }

    public synchronized EngineStatus getStatus() {
        return new EngineStatus(
                state,
                tickHandle != null,
                batchInFlight.get(),
                lastBatch,
                engineConfig.isEnableRuleEngine(),
                engineConfig.isEnableMlModels(),
                engineConfig.getProcessingInterval().toMillis(),
                engineConfig.getAlertThreshold());
    }

    Optional<BatchRun> runTick() {
        try {
            return runGuarded();
        } catch (RuntimeException e) {
            // An exception escaping a fixed-rate task would cancel every later tick
            log.error("Unexpected failure while processing batch", e);
            return Optional.empty();
        }
    }

    private Optional<BatchRun> runGuarded() {
        if (!batchInFlight.compareAndSet(false, true)) {
            log.warn("Previous batch still in flight, skipping this run");
            metricsConfig.recordSkippedTick();
            return Optional.empty();
        }
        try {
            BatchRun run = batchProcessingService.processBatch();
            lastBatch = run;
            return Optional.of(run);
        } finally {
            batchInFlight.set(false);
        }
    }
}
