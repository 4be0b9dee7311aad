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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Kind-specific payload of an {@link AlertEvent}. {@link AlertEvent} only
 * accepts the nested records, one per kind:
 * <ul>
 * <li>{@link HealthChange} for {@link AlertKind#UNHEALTHY}, no value</li>
 * <li>{@link ResourceUsage} for {@link AlertKind#HIGH_CPU} and
 * {@link AlertKind#HIGH_RAM}, the latest sample and the window that
 * triggered it</li>
 * <li>{@link Recovery} for {@link AlertKind#RECOVERY}, the downtime when
 * known</li>
 * </ul>
 */
public interface AlertDetail {

    /**
     * Health transition into the unhealthy state.
     */
    record HealthChange() implements AlertDetail {
    }

    /**
     * Sustained resource usage above threshold.
     *
     * @param value   the most recent percentage sample
     * @param history the samples of the full window, oldest first
     */
    record ResourceUsage(double value, List<Double> history) implements AlertDetail {
        public ResourceUsage {
            history = List.copyOf(Objects.requireNonNull(history, "history"));
        }
    }

    /**
     * Recovery from the unhealthy state.
     *
     * @param downtime time spent unhealthy, {@code null} when unknown
     */
    record Recovery(Duration downtime) implements AlertDetail {

        /**
         * Returns the downtime, if known.
         *
         * @return the downtime
         */
        public Optional<Duration> downtimeIfKnown() {
            return Optional.ofNullable(downtime);
        }
    }
}
