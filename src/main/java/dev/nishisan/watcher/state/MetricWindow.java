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

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Fixed-capacity circular buffer of percentage samples. Once full, each new
 * sample overwrites the oldest one.
 * <p>
 * Sustained-threshold checks only answer {@code true} on a full window, so no
 * decision can be made from fewer than {@link #capacity()} samples.
 */
public class MetricWindow {
    private final double[] samples;
    private int head;
    private int size;

    public MetricWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive.");
        }
        this.samples = new double[capacity];
    }

    /**
     * Appends a sample, evicting the oldest one when full.
     *
     * @param value the sample
     */
    public void add(double value) {
        samples[head] = value;
        head = (head + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    public boolean isFull() {
        return size == samples.length;
    }

    /**
     * Whether the window is full and every sample is {@code >= threshold}.
     *
     * @param threshold the threshold percentage
     * @return {@code true} for a sustained condition
     */
    public boolean isSustainedAtOrAbove(double threshold) {
        if (!isFull()) {
            return false;
        }
        for (double sample : samples) {
            if (sample < threshold) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the most recent sample.
     *
     * @return the latest sample, empty if nothing was added yet
     */
    public OptionalDouble latest() {
        if (size == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(samples[(head - 1 + samples.length) % samples.length]);
    }

    /**
     * Returns a copy of the samples, oldest first.
     *
     * @return the snapshot
     */
    public List<Double> snapshot() {
        List<Double> out = new ArrayList<>(size);
        int start = (head - size + samples.length) % samples.length;
        for (int i = 0; i < size; i++) {
            out.add(samples[(start + i) % samples.length]);
        }
        return out;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return samples.length;
    }
}
