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

/**
 * Kinds of alert raised for a container. Each kind has a fixed severity and
 * its own cooldown timestamp per container.
 */
public enum AlertKind {
    /** Health check went from healthy/starting to unhealthy. */
    UNHEALTHY("unhealthy", AlertSeverity.CRITICAL),
    /** CPU stayed at or above threshold for a full history window. */
    HIGH_CPU("high_cpu", AlertSeverity.WARNING),
    /** RAM stayed at or above threshold for a full history window. */
    HIGH_RAM("high_ram", AlertSeverity.WARNING),
    /** Health check went from unhealthy back to healthy. */
    RECOVERY("recovery", AlertSeverity.INFO);

    private final String value;
    private final AlertSeverity severity;

    AlertKind(String value, AlertSeverity severity) {
        this.value = value;
        this.severity = severity;
    }

    /**
     * Returns the lowercase wire value.
     *
     * @return the value
     */
    public String value() {
        return value;
    }

    /**
     * Returns the severity every alert of this kind carries.
     *
     * @return the severity
     */
    public AlertSeverity severity() {
        return severity;
    }
}
