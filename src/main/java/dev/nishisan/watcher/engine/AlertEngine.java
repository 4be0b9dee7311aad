/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */


package dev.nishisan.watcher.engine;

import dev.nishisan.watcher.alert.AlertBatch;
import dev.nishisan.watcher.alert.AlertEvent;
import dev.nishisan.watcher.config.WatcherConfig;
import dev.nishisan.watcher.source.ContainerSample;
import dev.nishisan.watcher.source.MetricsSource;
import dev.nishisan.watcher.state.ContainerState;
import dev.nishisan.watcher.state.ContainerStateStore;
import dev.nishisan.watcher.state.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Drives alert detection once per sampling tick and hands notifiable batches
 * to registered {@link AlertBatchListener listeners}.
 *
 * <h2>Tick</h2>
 * <ol>
 * <li>collect samples from the {@link MetricsSource};</li>
 * <li>for each sample of a container not disabled by rule: update its state,
 * then run the {@link AlertDetector};</li>
 * <li>evict state of containers absent from the sample set;</li>
 * <li>partition the emitted events into an {@link AlertBatch};</li>
 * <li>dispatch the batch when {@link #shouldNotify(AlertBatch, WatcherConfig)}
 * holds.</li>
 * </ol>
 *
 * <p>
 * Ticks never overlap. A failure on one container is logged and the rest of
 * the tick proceeds; that container keeps its previous state. A failure of
 * the metrics source skips the whole tick.
 * </p>
 */
public final class AlertEngine implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(AlertEngine.class);

    private final Supplier<WatcherConfig> configSupplier;
    private final MetricsSource metricsSource;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration tickInterval;
    private final ContainerStateStore stateStore;
    private final AlertDetector detector;

    private final List<AlertBatchListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean running;
    private volatile ScheduledFuture<?> tickTask;

    private AlertEngine(Builder builder) {
        this.configSupplier = Objects.requireNonNull(builder.configSupplier, "configSupplier");
        this.metricsSource = Objects.requireNonNull(builder.metricsSource, "metricsSource");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.clock = builder.clock;
        this.tickInterval = builder.tickInterval;
        this.stateStore = builder.stateStore != null
                ? builder.stateStore
                : new ContainerStateStore(() -> configSupplier.get().historySize());
        this.detector = new AlertDetector(stateStore);
    }

    /**
     * Starts the periodic tick loop. The first tick runs immediately.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        Duration interval = tickInterval != null ? tickInterval : configSupplier.get().sampleInterval();
        long periodMs = Math.max(100L, interval.toMillis());
        tickTask = scheduler.scheduleAtFixedRate(this::tickScheduled, 0L, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Alert engine started, tick every {} ms", periodMs);
    }

    /**
     * Registers a batch listener.
     *
     * @param listener the listener to add
     */
    public void addListener(AlertBatchListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     */
    public void removeListener(AlertBatchListener listener) {
        listeners.remove(listener);
    }

    /**
     * Runs one complete tick: collect, detect, and dispatch when notifiable.
     *
     * @return the batch, empty when the metrics source failed
     */
    public Optional<AlertBatch> tick() {
        List<ContainerSample> samples;
        try {
            samples = metricsSource.collect();
        } catch (IOException e) {
            logger.warn("Metrics collection failed, skipping tick: {}", e.getMessage());
            return Optional.empty();
        }
        WatcherConfig config = configSupplier.get();
        AlertBatch batch = runTick(samples == null ? List.of() : samples, config);
        if (shouldNotify(batch, config)) {
            dispatch(batch);
        }
        return Optional.of(batch);
    }

    private void tickScheduled() {
        if (!running) {
            return;
        }
        try {
            tick();
        } catch (Throwable t) {
            logger.warn("Alert tick failed", t);
        }
    }

    /**
     * Applies one sample set against the current configuration.
     *
     * @param samples the full sample set of this tick
     * @return the batch of events emitted by this tick
     */
    public AlertBatch runTick(List<ContainerSample> samples) {
        return runTick(samples, configSupplier.get());
    }

    /**
     * Applies one sample set against the given configuration snapshot.
     * Does not dispatch.
     *
     * @param samples the full sample set of this tick
     * @param config  the policy snapshot for the whole tick
     * @return the batch of events emitted by this tick
     */
    public synchronized AlertBatch runTick(List<ContainerSample> samples, WatcherConfig config) {
        Instant now = clock.instant();
        List<AlertEvent> events = new ArrayList<>();
        Set<String> present = new HashSet<>();

        for (ContainerSample sample : samples) {
            if (sample == null) {
                logger.warn("Skipping null sample");
                continue;
            }
            String id = sample.containerId();
            if (sample.containerName() != null && config.isAlertsDisabled(sample.containerName())) {
                logger.debug("Container:[{}] alerts disabled by rule...skipping", sample.containerName());
                continue;
            }
            if (id != null && !id.isBlank()) {
                present.add(id);
            }
            try {
                events.addAll(evaluateSample(sample, config, now));
            } catch (RuntimeException e) {
                logger.warn("Container:[{}] evaluation failed, keeping previous state: {}", id, e.getMessage());
            }
        }

        stateStore.evictNotIn(present);
        return AlertBatch.of(events, clock.instant());
    }

    private List<AlertEvent> evaluateSample(ContainerSample sample, WatcherConfig config, Instant now) {
        HealthStatus health = sample.validate();
        ContainerState state = stateStore.upsert(sample.containerId(), sample.containerName(),
                sample.cpuPercent(), sample.ramPercent(), health, now);
        List<AlertEvent> emitted = detector.evaluate(state, config, now);
        for (AlertEvent event : emitted) {
            logger.info("[ALERT] {} {} {}", event.severity().value(), event.kind().value(),
                    event.containerName());
        }
        return emitted;
    }

    /**
     * Whether a batch should be delivered under the current configuration.
     */
    public boolean shouldNotify(AlertBatch batch) {
        return shouldNotify(batch, configSupplier.get());
    }

    /**
     * A batch is delivered only when alerting and notifications are both
     * enabled and it holds at least one actionable or recovery event.
     *
     * @param batch  the batch
     * @param config the policy snapshot
     * @return {@code true} if listeners should receive the batch
     */
    public static boolean shouldNotify(AlertBatch batch, WatcherConfig config) {
        if (!config.isEnabled()) {
            return false;
        }
        return batch.hasAlerts() || batch.hasRecovery();
    }

    private void dispatch(AlertBatch batch) {
        for (AlertBatchListener listener : listeners) {
            try {
                listener.onBatch(batch);
            } catch (Throwable t) {
                logger.warn("Alert batch listener threw exception", t);
            }
        }
    }

    public ContainerStateStore stateStore() {
        return stateStore;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        running = false;
        ScheduledFuture<?> task = tickTask;
        if (task != null) {
            task.cancel(false);
            tickTask = null;
            logger.info("Alert engine stopped");
        }
    }

    /**
     * Returns the number of currently registered listeners.
     * Mainly for testing.
     *
     * @return the listener count
     */
    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Creates a builder for an alert engine.
     *
     * @param configSupplier supplier of the current configuration snapshot
     * @param metricsSource  source of per-tick samples
     * @param scheduler      the scheduler for periodic ticks
     * @return the builder
     */
    public static Builder builder(Supplier<WatcherConfig> configSupplier, MetricsSource metricsSource,
            ScheduledExecutorService scheduler) {
        return new Builder(configSupplier, metricsSource, scheduler);
    }

    /**
     * Builder for {@link AlertEngine}.
     */
    public static final class Builder {
        private final Supplier<WatcherConfig> configSupplier;
        private final MetricsSource metricsSource;
        private final ScheduledExecutorService scheduler;
        private Clock clock = Clock.systemUTC();
        private Duration tickInterval;
        private ContainerStateStore stateStore;

        private Builder(Supplier<WatcherConfig> configSupplier, MetricsSource metricsSource,
                ScheduledExecutorService scheduler) {
            this.configSupplier = configSupplier;
            this.metricsSource = metricsSource;
            this.scheduler = scheduler;
        }

        /**
         * Sets the time source for cooldowns, downtime and batch timestamps.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * Overrides the tick period. Defaults to the configured sample interval.
         *
         * @param interval the interval
         * @return this builder
         */
        public Builder tickInterval(Duration interval) {
            this.tickInterval = Objects.requireNonNull(interval);
            return this;
        }

        /**
         * Uses an existing state store instead of creating one.
         *
         * @param stateStore the store
         * @return this builder
         */
        public Builder stateStore(ContainerStateStore stateStore) {
            this.stateStore = Objects.requireNonNull(stateStore);
            return this;
        }

        /**
         * Builds the alert engine.
         *
         * @return the engine
         */
        public AlertEngine build() {
            return new AlertEngine(this);
        }
    }
}
