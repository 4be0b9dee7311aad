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

import java.io.IOException;
import java.util.List;

/**
 * Supplies the full set of container samples for one tick.
 * <p>
 * The returned list must contain every container currently running: any
 * container id missing from it has its alerting state discarded.
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * Collects one sample per running container.
     *
     * @return the samples, never {@code null}
     * @throws IOException if the runtime could not be queried; the tick is skipped
     */
    List<ContainerSample> collect() throws IOException;
}
