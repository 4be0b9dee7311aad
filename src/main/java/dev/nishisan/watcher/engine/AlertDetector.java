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

import dev.nishisan.watcher.alert.AlertEvent;
import dev.nishisan.watcher.alert.AlertKind;
import dev.nishisan.watcher.config.WatcherConfig;
import dev.nishisan.watcher.state.ContainerState;
import dev.nishisan.watcher.state.ContainerStateStore;
import dev.nishisan.watcher.state.MetricWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides which alerts a single container raises on the current tick.
 * <p>
 * Must be called after the state has ingested the tick's sample. Evaluation
 * order:
 * <ol>
 * <li>recovery (unhealthy to healthy), gated by the recovery cooldown. The
 * unhealthy latch is cleared even when the recovery alert is suppressed;</li>
 * <li>otherwise unhealthy (healthy or starting to unhealthy), gated by the
 * alert cooldown only;</li>
 * <li>sustained high CPU, gated by the active latch and the cooldown;</li>
 * <li>sustained high RAM, same rules as CPU.</li>
 * </ol>
 * A single call can therefore return up to three events.
 */
public class AlertDetector {

    private static final Logger logger = LoggerFactory.getLogger(AlertDetector.class);

    private final ContainerStateStore store;

    public AlertDetector(ContainerStateStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Evaluates one container and records every emitted alert on its state.
     *
     * @param state  the already updated container state
     * @param config the policy snapshot for this tick
     * @param now    the evaluation time
     * @return the emitted events, possibly empty
     */
    public List<AlertEvent> evaluate(ContainerState state, WatcherConfig config, Instant now) {
        List<AlertEvent> events = new ArrayList<>(3);

        if (state.isRecoveryTransition()) {
            checkRecovery(state, config, now, events);
        } else if (state.isUnhealthyTransition()) {
            checkUnhealthy(state, config, now, events);
        }

        String name = state.containerName();
        checkResource(state, AlertKind.HIGH_CPU, config.cpuThreshold(name), config, now, events);
        checkResource(state, AlertKind.HIGH_RAM, config.ramThreshold(name), config, now, events);
        return events;
    }

    private void checkRecovery(ContainerState state, WatcherConfig config, Instant now, List<AlertEvent> events) {
        state.clearAlert(AlertKind.UNHEALTHY);
        if (state.isInCooldown(AlertKind.RECOVERY, config.recoveryCooldown(), now)) {
            logger.debug("Container:[{}] recovery alert suppressed by cooldown", state.containerName());
            return;
        }
        events.add(AlertEvent.recovery(state.containerId(), state.containerName(),
                state.downtime().orElse(null), now));
        state.markAlertSent(AlertKind.RECOVERY, now);
    }

    private void checkUnhealthy(ContainerState state, WatcherConfig config, Instant now, List<AlertEvent> events) {
        if (state.isInCooldown(AlertKind.UNHEALTHY, config.cooldown(), now)) {
            logger.debug("Container:[{}] unhealthy alert suppressed by cooldown", state.containerName());
            return;
        }
        events.add(AlertEvent.unhealthy(state.containerId(), state.containerName(), now));
        state.markAlertSent(AlertKind.UNHEALTHY, now);
    }

    private void checkResource(ContainerState state, AlertKind kind, double threshold, WatcherConfig config,
            Instant now, List<AlertEvent> events) {
        MetricWindow window = state.window(kind);
        if (!window.isSustainedAtOrAbove(threshold)) {
            if (store.clearAlertIfBelow(state.containerId(), kind, threshold)) {
                logger.debug("Container:[{}] {} cleared", state.containerName(), kind.value());
            }
            return;
        }
        if (state.isAlertActive(kind)) {
            logger.debug("Container:[{}] {} still active", state.containerName(), kind.value());
            return;
        }
        if (state.isInCooldown(kind, config.cooldown(), now)) {
            logger.debug("Container:[{}] {} suppressed by cooldown", state.containerName(), kind.value());
            return;
        }
        double latest = window.latest().orElseThrow();
        events.add(AlertEvent.resource(state.containerId(), state.containerName(), kind, latest,
                window.snapshot(), now));
        state.markAlertSent(kind, now);
    }
}
