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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Alerts produced by one tick, partitioned for delivery.
 * <p>
 * Recovery alerts carry {@link AlertSeverity#INFO} and therefore never show up
 * in the critical or warning partitions.
 *
 * @param criticalAlerts alerts with severity {@link AlertSeverity#CRITICAL}
 * @param warningAlerts  alerts with severity {@link AlertSeverity#WARNING}
 * @param recoveryAlerts alerts of kind {@link AlertKind#RECOVERY}
 * @param timestamp      tick completion time
 */
public record AlertBatch(
        List<AlertEvent> criticalAlerts,
        List<AlertEvent> warningAlerts,
        List<AlertEvent> recoveryAlerts,
        Instant timestamp) {

    public AlertBatch {
        criticalAlerts = List.copyOf(criticalAlerts);
        warningAlerts = List.copyOf(warningAlerts);
        recoveryAlerts = List.copyOf(recoveryAlerts);
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Partitions the given alerts into a batch.
     *
     * @param alerts    every alert collected during the tick
     * @param timestamp tick completion time
     * @return the batch
     */
    public static AlertBatch of(Collection<AlertEvent> alerts, Instant timestamp) {
        List<AlertEvent> critical = new ArrayList<>();
        List<AlertEvent> warning = new ArrayList<>();
        List<AlertEvent> recovery = new ArrayList<>();
        for (AlertEvent alert : alerts) {
            if (alert.severity() == AlertSeverity.CRITICAL) {
                critical.add(alert);
            } else if (alert.severity() == AlertSeverity.WARNING) {
                warning.add(alert);
            }
            if (alert.kind() == AlertKind.RECOVERY) {
                recovery.add(alert);
            }
        }
        return new AlertBatch(critical, warning, recovery, timestamp);
    }

    /**
     * Returns an empty batch.
     */
    public static AlertBatch empty(Instant timestamp) {
        return new AlertBatch(List.of(), List.of(), List.of(), timestamp);
    }

    /**
     * Whether there is at least one critical or warning alert.
     */
    public boolean hasAlerts() {
        return !criticalAlerts.isEmpty() || !warningAlerts.isEmpty();
    }

    /**
     * Whether there is at least one recovery alert.
     */
    public boolean hasRecovery() {
        return !recoveryAlerts.isEmpty();
    }

    /**
     * Number of actionable (critical plus warning) alerts.
     */
    public int totalCount() {
        return criticalAlerts.size() + warningAlerts.size();
    }

    /**
     * Whether all three partitions are empty.
     */
    public boolean isEmpty() {
        return !hasAlerts() && !hasRecovery();
    }
}
