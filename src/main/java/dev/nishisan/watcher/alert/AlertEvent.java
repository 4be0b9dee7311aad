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

package dev.nishisan.watcher.alert;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable alert raised for a single container during a tick.
 *
 * @param containerId   stable container identifier
 * @param containerName display name at the time of the alert
 * @param kind          alert kind
 * @param severity      severity, always {@code kind.severity()}
 * @param timestamp     when the alert was raised
 * @param detail        kind-specific payload
 */
public record AlertEvent(
        String containerId,
        String containerName,
        AlertKind kind,
        AlertSeverity severity,
        Instant timestamp,
        AlertDetail detail) {

    public AlertEvent {
        Objects.requireNonNull(containerId, "containerId");
        Objects.requireNonNull(containerName, "containerName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(detail, "detail");
        if (severity != kind.severity()) {
            throw new IllegalArgumentException("Alert kind " + kind + " requires severity " + kind.severity());
        }
        if (!detailMatches(kind, detail)) {
            throw new IllegalArgumentException(
                    "Detail " + detail.getClass().getSimpleName() + " does not belong to alert kind " + kind);
        }
    }

    /**
     * Creates an {@link AlertKind#UNHEALTHY} alert.
     */
    public static AlertEvent unhealthy(String containerId, String containerName, Instant timestamp) {
        return new AlertEvent(containerId, containerName, AlertKind.UNHEALTHY,
                AlertKind.UNHEALTHY.severity(), timestamp, new AlertDetail.HealthChange());
    }

    /**
     * Creates an {@link AlertKind#HIGH_CPU} or {@link AlertKind#HIGH_RAM} alert.
     *
     * @param kind    one of the resource kinds
     * @param value   latest sample
     * @param history window snapshot, oldest first
     */
    public static AlertEvent resource(String containerId, String containerName, AlertKind kind,
            double value, List<Double> history, Instant timestamp) {
        return new AlertEvent(containerId, containerName, kind, kind.severity(), timestamp,
                new AlertDetail.ResourceUsage(value, history));
    }

    /**
     * Creates an {@link AlertKind#RECOVERY} alert.
     *
     * @param downtime time spent unhealthy, {@code null} when unknown
     */
    public static AlertEvent recovery(String containerId, String containerName, Duration downtime,
            Instant timestamp) {
        return new AlertEvent(containerId, containerName, AlertKind.RECOVERY,
                AlertKind.RECOVERY.severity(), timestamp, new AlertDetail.Recovery(downtime));
    }

    /**
     * Returns the percentage that triggered a resource alert.
     *
     * @return the value, empty for health and recovery alerts
     */
    public OptionalDouble value() {
        if (detail instanceof AlertDetail.ResourceUsage usage) {
            return OptionalDouble.of(usage.value());
        }
        return OptionalDouble.empty();
    }

    /**
     * Returns the window snapshot of a resource alert.
     *
     * @return the history, empty for health and recovery alerts
     */
    public List<Double> history() {
        if (detail instanceof AlertDetail.ResourceUsage usage) {
            return usage.history();
        }
        return List.of();
    }

    /**
     * Returns the downtime of a recovery alert.
     *
     * @return the downtime, if this is a recovery with known downtime
     */
    public Optional<Duration> downtime() {
        if (detail instanceof AlertDetail.Recovery recovery) {
            return recovery.downtimeIfKnown();
        }
        return Optional.empty();
    }

    /**
     * Returns the downtime in whole minutes (truncated), e.g. {@code "10 minutes"}.
     *
     * @return the formatted downtime, if known
     */
    public Optional<String> downtimeText() {
        return downtime().map(d -> d.toMinutes() + " minutes");
    }

    /**
     * Returns an export-friendly view of this alert.
     *
     * @return ordered map of field names to values
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("container_id", containerId);
        map.put("container_name", containerName);
        map.put("alert_type", kind.value());
        map.put("priority", severity.value());
        OptionalDouble v = value();
        map.put("value", v.isPresent() ? v.getAsDouble() : null);
        map.put("timestamp", timestamp.toString());
        List<Double> history = history();
        map.put("history", history.isEmpty() ? null : history);
        map.put("downtime", downtimeText().orElse(null));
        return map;
    }

    private static boolean detailMatches(AlertKind kind, AlertDetail detail) {
        return switch (kind) {
            case UNHEALTHY -> detail instanceof AlertDetail.HealthChange;
            case HIGH_CPU, HIGH_RAM -> detail instanceof AlertDetail.ResourceUsage;
            case RECOVERY -> detail instanceof AlertDetail.Recovery;
        };
    }
}
