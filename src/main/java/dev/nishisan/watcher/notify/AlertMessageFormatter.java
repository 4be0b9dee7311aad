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


package dev.nishisan.watcher.notify;

import dev.nishisan.watcher.alert.AlertBatch;
import dev.nishisan.watcher.alert.AlertEvent;
import dev.nishisan.watcher.alert.AlertKind;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders alert subjects and plain-text bodies.
 */
public class AlertMessageFormatter {

    private static final String RULE = "=".repeat(50);
    private static final int SHORT_ID_LENGTH = 12;

    private final DateTimeFormatter timestampFormat;

    public AlertMessageFormatter() {
        this(ZoneId.systemDefault());
    }

    /**
     * @param zone zone used to print timestamps
     */
    public AlertMessageFormatter(ZoneId zone) {
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT)
                .withZone(Objects.requireNonNull(zone, "zone"));
    }

    /**
     * Subject for a batch: critical count first, warnings appended; warnings
     * alone get their own prefix.
     */
    public String batchSubject(AlertBatch batch) {
        int critical = batch.criticalAlerts().size();
        int warning = batch.warningAlerts().size();
        if (critical > 0) {
            String subject = "CRITICAL: " + critical + " Container Issue" + plural(critical);
            if (warning > 0) {
                subject += " (+ " + warning + " Warning" + plural(warning) + ")";
            }
            return subject;
        }
        return "WARNING: " + warning + " Resource Alert" + plural(warning);
    }

    public String recoverySubject(AlertEvent recovery) {
        return "RESOLVED: " + recovery.containerName() + " Container Recovered";
    }

    public String batchBody(AlertBatch batch, String baseUrl) {
        StringBuilder text = new StringBuilder();
        text.append("Container Watcher - Container Alerts\n");
        text.append("===================================\n\n");
        text.append("Timestamp: ").append(format(batch.timestamp())).append("\n\n");

        List<AlertEvent> critical = batch.criticalAlerts();
        if (!critical.isEmpty()) {
            text.append("\nCRITICAL ALERTS (").append(critical.size()).append(")\n");
            text.append(RULE).append("\n\n");
            for (AlertEvent alert : critical) {
                appendContainerLine(text, alert);
                if (alert.kind() == AlertKind.UNHEALTHY) {
                    text.append("Status: UNHEALTHY\n");
                }
                text.append("Time: ").append(format(alert.timestamp())).append('\n');
                text.append("Details: ").append(containerUrl(baseUrl, alert)).append("\n\n");
            }
        }

        List<AlertEvent> warnings = batch.warningAlerts();
        if (!warnings.isEmpty()) {
            text.append("\nWARNING ALERTS (").append(warnings.size()).append(")\n");
            text.append(RULE).append("\n\n");
            for (AlertEvent alert : warnings) {
                appendContainerLine(text, alert);
                if (alert.kind() == AlertKind.HIGH_CPU) {
                    text.append("Issue: High CPU Usage\n");
                } else if (alert.kind() == AlertKind.HIGH_RAM) {
                    text.append("Issue: High RAM Usage\n");
                }
                alert.value().ifPresent(v -> text.append("Current: ").append(percent(v)).append('\n'));
                if (!alert.history().isEmpty()) {
                    text.append("History: ").append(historyLine(alert.history())).append('\n');
                }
                text.append("Details: ").append(containerUrl(baseUrl, alert)).append("\n\n");
            }
        }

        text.append("\n---\nContainer Watcher Alert System\n");
        text.append("Dashboard: ").append(baseUrl).append('\n');
        return text.toString();
    }

    public String recoveryBody(AlertEvent recovery, String baseUrl) {
        StringBuilder text = new StringBuilder();
        text.append("Container Watcher - Container Recovered\n");
        text.append("=====================================\n\n");
        text.append("Container: ").append(recovery.containerName()).append('\n');
        text.append("ID: ").append(shortId(recovery.containerId())).append("\n\n");
        text.append("Previous Status: UNHEALTHY\n");
        text.append("Current Status: HEALTHY\n");
        recovery.downtimeText().ifPresent(d -> text.append("Downtime: ").append(d).append('\n'));
        text.append("\nRecovered At: ").append(format(recovery.timestamp())).append("\n\n");
        text.append("View Details: ").append(containerUrl(baseUrl, recovery)).append("\n\n");
        text.append("---\nContainer Watcher Alert System\n");
        return text.toString();
    }

    /**
     * Samples joined oldest first, e.g. {@code 85.0% -> 90.0% -> 95.0%}.
     */
    public String historyLine(List<Double> history) {
        return history.stream().map(AlertMessageFormatter::percent).collect(Collectors.joining(" -> "));
    }

    public String format(Instant instant) {
        return timestampFormat.format(instant);
    }

    private static void appendContainerLine(StringBuilder text, AlertEvent alert) {
        text.append("Container: ").append(alert.containerName())
                .append(" (ID: ").append(shortId(alert.containerId())).append(")\n");
    }

    static String shortId(String containerId) {
        return containerId.length() > SHORT_ID_LENGTH ? containerId.substring(0, SHORT_ID_LENGTH) : containerId;
    }

    private static String containerUrl(String baseUrl, AlertEvent alert) {
        return baseUrl + "/container/" + alert.containerId();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String plural(int count) {
        return count != 1 ? "s" : "";
    }
}
