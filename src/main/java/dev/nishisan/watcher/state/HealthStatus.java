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

import java.util.Locale;

/**
 * Container health as reported by the runtime health check.
 * {@link #UNKNOWN} is only ever assigned internally, before the first sample.
 */
public enum HealthStatus {
    UNKNOWN("unknown"),
    HEALTHY("healthy"),
    UNHEALTHY("unhealthy"),
    STARTING("starting"),
    /** Container has no health check configured. */
    NONE("none");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a reported health value. {@code null} or blank means {@link #NONE}.
     *
     * @param value the reported value, case-insensitive
     * @return the status
     * @throws IllegalArgumentException if the value is not a reportable status
     */
    public static HealthStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (HealthStatus status : values()) {
            if (status != UNKNOWN && status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + value);
    }
}
