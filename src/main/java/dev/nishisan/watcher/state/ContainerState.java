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

package dev.nishisan.watcher.state;

import dev.nishisan.watcher.alert.AlertKind;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Alerting state of a single container: recent CPU/RAM samples, health
 * transitions, per-kind cooldown timestamps and active-alert latches.
 * <p>
 * Instances are owned by a {@link ContainerStateStore} and mutated only from
 * the tick that holds the engine lock, so no internal synchronization is done.
 */
public class ContainerState {

    private final String containerId;
    private String containerName;

    private final MetricWindow cpuWindow;
    private final MetricWindow ramWindow;

    private HealthStatus currentHealth = HealthStatus.UNKNOWN;
    private HealthStatus previousHealth = HealthStatus.UNKNOWN;
    private Instant unhealthySince;
    private Duration lastDowntime;

    private final Set<AlertKind> activeAlerts = EnumSet.noneOf(AlertKind.class);
    private final Map<AlertKind, Instant> lastAlertAt = new EnumMap<>(AlertKind.class);

    private Instant lastUpdate;

    /**
     * Creates an empty state.
     *
     * @param containerId   the container id
     * @param containerName the current display name
     * @param historySize   capacity of the CPU and RAM windows
     */
    public ContainerState(String containerId, String containerName, int historySize) {
        this.containerId = Objects.requireNonNull(containerId, "containerId");
        this.containerName = Objects.requireNonNull(containerName, "containerName");
        this.cpuWindow = new MetricWindow(historySize);
        this.ramWindow = new MetricWindow(historySize);
    }

    /**
     * Records a new sample: appends CPU/RAM to the windows and shifts the
     * health fields.
     *
     * @param name   latest display name
     * @param cpu    CPU percentage
     * @param ram    RAM percentage
     * @param health reported health
     * @param now    ingestion time
     */
    public void recordSample(String name, double cpu, double ram, HealthStatus health, Instant now) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(health, "health");
        this.containerName = name;
        cpuWindow.add(cpu);
        ramWindow.add(ram);
        updateHealth(health, now);
        this.lastUpdate = now;
    }

    private void updateHealth(HealthStatus health, Instant now) {
        this.previousHealth = this.currentHealth;
        this.currentHealth = health;

        lastDowntime = null;
        if (health == HealthStatus.UNHEALTHY && previousHealth != HealthStatus.UNHEALTHY) {
            unhealthySince = now;
        } else if (health == HealthStatus.HEALTHY) {
            if (unhealthySince != null) {
                lastDowntime = Duration.between(unhealthySince, now);
            }
            unhealthySince = null;
        }
    }

    /**
     * Whether health changed on the last sample. A change away from
     * {@link HealthStatus#UNKNOWN} does not count.
     */
    public boolean hasHealthChanged() {
        return currentHealth != previousHealth && previousHealth != HealthStatus.UNKNOWN;
    }

    /**
     * healthy/starting to unhealthy.
     */
    public boolean isUnhealthyTransition() {
        return currentHealth == HealthStatus.UNHEALTHY
                && (previousHealth == HealthStatus.HEALTHY || previousHealth == HealthStatus.STARTING);
    }

    /**
     * unhealthy to healthy.
     */
    public boolean isRecoveryTransition() {
        return currentHealth == HealthStatus.HEALTHY && previousHealth == HealthStatus.UNHEALTHY;
    }

    /**
     * Returns how long the container was unhealthy, measured on the sample
     * that recovered it.
     *
     * @return the downtime, empty if the last sample was not a recovery or the
     *         start of the unhealthy period was never observed
     */
    public Optional<Duration> downtime() {
        if (!isRecoveryTransition()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lastDowntime);
    }

    /**
     * Whether an alert of the given kind was raised less than {@code cooldown} ago.
     *
     * @param kind     alert kind
     * @param cooldown minimum spacing between two alerts of that kind
     * @param now      current time
     * @return {@code true} while in cooldown
     */
    public boolean isInCooldown(AlertKind kind, Duration cooldown, Instant now) {
        Instant last = lastAlertAt.get(kind);
        if (last == null) {
            return false;
        }
        return Duration.between(last, now).compareTo(cooldown) < 0;
    }

    /**
     * Stamps the cooldown timestamp for {@code kind} and latches its active
     * flag. Recovery has no latch.
     *
     * @param kind alert kind
     * @param now  emission time
     */
    public void markAlertSent(AlertKind kind, Instant now) {
        lastAlertAt.put(kind, now);
        if (kind != AlertKind.RECOVERY) {
            activeAlerts.add(kind);
        }
    }

    /**
     * Clears the active latch of {@code kind}.
     */
    public void clearAlert(AlertKind kind) {
        activeAlerts.remove(kind);
    }

    public boolean isAlertActive(AlertKind kind) {
        return activeAlerts.contains(kind);
    }

    public Optional<Instant> lastAlertAt(AlertKind kind) {
        return Optional.ofNullable(lastAlertAt.get(kind));
    }

    /**
     * Returns the window holding samples for a resource kind.
     *
     * @param kind {@link AlertKind#HIGH_CPU} or {@link AlertKind#HIGH_RAM}
     * @return the window
     */
    public MetricWindow window(AlertKind kind) {
        return switch (kind) {
            case HIGH_CPU -> cpuWindow;
            case HIGH_RAM -> ramWindow;
            default -> throw new IllegalArgumentException("No metric window for alert kind " + kind);
        };
    }

    public String containerId() {
        return containerId;
    }

    public String containerName() {
        return containerName;
    }

    public MetricWindow cpuWindow() {
        return cpuWindow;
    }

    public MetricWindow ramWindow() {
        return ramWindow;
    }

    public HealthStatus currentHealth() {
        return currentHealth;
    }

    public HealthStatus previousHealth() {
        return previousHealth;
    }

    public Optional<Instant> unhealthySince() {
        return Optional.ofNullable(unhealthySince);
    }

    public Optional<Instant> lastUpdate() {
        return Optional.ofNullable(lastUpdate);
    }
}
