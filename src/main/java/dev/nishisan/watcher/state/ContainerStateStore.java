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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.IntSupplier;

/**
 * Holds one {@link ContainerState} per live container id.
 * <p>
 * States are created lazily on the first sample of an id and removed by
 * {@link #evictNotIn(Set)} as soon as the id is missing from a full sample set.
 * There is no time-based expiry.
 */
public class ContainerStateStore {

    private static final Logger logger = LoggerFactory.getLogger(ContainerStateStore.class);

    private final ConcurrentMap<String, ContainerState> states = new ConcurrentHashMap<>();
    private final IntSupplier historySize;

    /**
     * Creates a store whose new states get a fixed window capacity.
     *
     * @param historySize window capacity
     */
    public ContainerStateStore(int historySize) {
        this(fixed(historySize));
    }

    /**
     * Creates a store that asks for the window capacity whenever a state is created.
     *
     * @param historySize supplier of the window capacity for new states
     */
    public ContainerStateStore(IntSupplier historySize) {
        this.historySize = historySize;
    }

    private static IntSupplier fixed(int historySize) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("History size must be positive.");
        }
        return () -> historySize;
    }

    /**
     * Creates the state for {@code id} if absent, then records the sample on it.
     *
     * @return the updated state
     */
    public ContainerState upsert(String id, String name, double cpu, double ram, HealthStatus health,
            Instant now) {
        ContainerState state = states.computeIfAbsent(id,
                k -> new ContainerState(k, name, historySize.getAsInt()));
        state.recordSample(name, cpu, ram, health, now);
        return state;
    }

    public Optional<ContainerState> get(String id) {
        return Optional.ofNullable(states.get(id));
    }

    /**
     * Removes every state whose id is not in {@code activeIds}.
     *
     * @param activeIds ids observed in the latest full sample set
     * @return how many states were removed
     */
    public int evictNotIn(Set<String> activeIds) {
        int removed = 0;
        for (String id : states.keySet()) {
            if (!activeIds.contains(id) && states.remove(id) != null) {
                removed++;
                logger.debug("Container:[{}] no longer present...removing state", id);
            }
        }
        return removed;
    }

    /**
     * Clears the active latch of a resource alert when the latest sample of
     * that metric is strictly below {@code threshold}.
     *
     * @param id        container id
     * @param kind      {@link AlertKind#HIGH_CPU} or {@link AlertKind#HIGH_RAM}
     * @param threshold the threshold percentage
     * @return {@code true} if the latch was cleared
     */
    public boolean clearAlertIfBelow(String id, AlertKind kind, double threshold) {
        ContainerState state = states.get(id);
        if (state == null || !state.isAlertActive(kind)) {
            return false;
        }
        OptionalDouble latest = state.window(kind).latest();
        if (latest.isPresent() && latest.getAsDouble() < threshold) {
            state.clearAlert(kind);
            return true;
        }
        return false;
    }

    public int size() {
        return states.size();
    }

    public Set<String> containerIds() {
        return Collections.unmodifiableSet(states.keySet());
    }
}
