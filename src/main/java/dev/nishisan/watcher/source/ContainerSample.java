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

package dev.nishisan.watcher.source;

import dev.nishisan.watcher.state.HealthStatus;

/**
 * One metrics reading for one container, as supplied by a {@link MetricsSource}.
 * <p>
 * The record itself accepts anything so that a source can hand over whatever
 * it read; {@link #validate()} is called by the engine per container, which
 * lets a malformed entry be skipped without losing the rest of the tick.
 *
 * @param containerId   stable container id
 * @param containerName display name
 * @param cpuPercent    CPU usage percentage
 * @param ramPercent    RAM usage percentage
 * @param healthStatus  raw health value ({@code healthy}, {@code unhealthy},
 *                      {@code starting}, {@code none}); {@code null} means none
 */
public record ContainerSample(
        String containerId,
        String containerName,
        double cpuPercent,
        double ramPercent,
        String healthStatus) {

    /**
     * Creates a sample without health information.
     */
    public static ContainerSample of(String containerId, String containerName, double cpuPercent,
            double ramPercent) {
        return new ContainerSample(containerId, containerName, cpuPercent, ramPercent, HealthStatus.NONE.value());
    }

    /**
     * Creates a sample with a health value.
     */
    public static ContainerSample of(String containerId, String containerName, double cpuPercent,
            double ramPercent, HealthStatus health) {
        return new ContainerSample(containerId, containerName, cpuPercent, ramPercent, health.value());
    }

    /**
     * Checks the sample and returns its parsed health.
     *
     * @return the parsed health status
     * @throws InvalidSampleException if any field is missing or out of range
     */
    public HealthStatus validate() {
        if (containerId == null || containerId.isBlank()) {
            throw new InvalidSampleException("Sample without container id");
        }
        if (containerName == null) {
            throw new InvalidSampleException("Sample for " + containerId + " has no container name");
        }
        checkPercent("cpu", cpuPercent);
        checkPercent("ram", ramPercent);
        try {
            return HealthStatus.fromValue(healthStatus);
        } catch (IllegalArgumentException e) {
            throw new InvalidSampleException("Sample for " + containerId + " has invalid health", e);
        }
    }

    private void checkPercent(String metric, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new InvalidSampleException(
                    "Sample for " + containerId + " has invalid " + metric + " percentage: " + value);
        }
    }
}
