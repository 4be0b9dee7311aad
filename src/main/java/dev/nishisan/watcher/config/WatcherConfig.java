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


package dev.nishisan.watcher.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable alerting policy snapshot consumed by the engine once per tick.
 * <p>
 * Instances are produced by {@link WatcherConfigLoader#convertToDomain} or
 * assembled directly through {@link #builder()}.
 */
public final class WatcherConfig {
    private final boolean alertsEnabled;
    private final boolean notificationsEnabled;
    private final double cpuThreshold;
    private final double ramThreshold;
    private final int durationMinutes;
    private final Duration sampleInterval;
    private final Duration cooldown;
    private final Duration recoveryCooldown;
    private final boolean recoveryEmailEnabled;
    private final String baseUrl;
    private final Map<String, ContainerOverride> overrides;
    private final SmtpSettings smtp;

    private WatcherConfig(Builder builder) {
        this.alertsEnabled = builder.alertsEnabled;
        this.notificationsEnabled = builder.notificationsEnabled;
        this.cpuThreshold = builder.cpuThreshold;
        this.ramThreshold = builder.ramThreshold;
        this.durationMinutes = builder.durationMinutes;
        this.sampleInterval = builder.sampleInterval;
        this.cooldown = builder.cooldown;
        this.recoveryCooldown = builder.recoveryCooldown;
        this.recoveryEmailEnabled = builder.recoveryEmailEnabled;
        this.baseUrl = builder.baseUrl;
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(builder.overrides));
        this.smtp = builder.smtp;
    }

    /**
     * Returns whether alert batches should be delivered at all: both the
     * alerting switch and the notification channel switch must be on.
     */
    public boolean isEnabled() {
        return alertsEnabled && notificationsEnabled;
    }

    public boolean alertsEnabled() {
        return alertsEnabled;
    }

    public boolean notificationsEnabled() {
        return notificationsEnabled;
    }

    /**
     * Resolves the CPU threshold for a container, preferring its override.
     *
     * @param containerName container name
     * @return threshold percentage
     */
    public double cpuThreshold(String containerName) {
        ContainerOverride override = overrides.get(containerName);
        if (override != null && override.cpuThreshold() != null) {
            return override.cpuThreshold();
        }
        return cpuThreshold;
    }

    /**
     * Resolves the RAM threshold for a container, preferring its override.
     *
     * @param containerName container name
     * @return threshold percentage
     */
    public double ramThreshold(String containerName) {
        ContainerOverride override = overrides.get(containerName);
        if (override != null && override.ramThreshold() != null) {
            return override.ramThreshold();
        }
        return ramThreshold;
    }

    public boolean isAlertsDisabled(String containerName) {
        ContainerOverride override = overrides.get(containerName);
        return override != null && override.alertsDisabled();
    }

    public Optional<ContainerOverride> override(String containerName) {
        return Optional.ofNullable(overrides.get(containerName));
    }

    public Map<String, ContainerOverride> overrides() {
        return overrides;
    }

    public Duration cooldown() {
        return cooldown;
    }

    public Duration recoveryCooldown() {
        return recoveryCooldown;
    }

    public boolean recoveryEmailEnabled() {
        return recoveryEmailEnabled;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Duration sampleInterval() {
        return sampleInterval;
    }

    public int durationMinutes() {
        return durationMinutes;
    }

    /**
     * Number of consecutive samples that cover {@link #durationMinutes()} at
     * the configured sampling interval, never less than one.
     */
    public int historySize() {
        long window = durationMinutes * 60L;
        long interval = Math.max(1L, sampleInterval.toSeconds());
        long size = (window + interval - 1) / interval;
        return (int) Math.max(1L, size);
    }

    /**
     * Returns the SMTP settings, absent when e-mail delivery is not configured.
     */
    public Optional<SmtpSettings> smtp() {
        return Optional.ofNullable(smtp);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean alertsEnabled = true;
        private boolean notificationsEnabled = true;
        private double cpuThreshold = 80.0;
        private double ramThreshold = 85.0;
        private int durationMinutes = 3;
        private Duration sampleInterval = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofMinutes(15);
        private Duration recoveryCooldown = Duration.ofMinutes(5);
        private boolean recoveryEmailEnabled = true;
        private String baseUrl = "http://localhost:5001";
        private final Map<String, ContainerOverride> overrides = new LinkedHashMap<>();
        private SmtpSettings smtp;

        private Builder() {
        }

        public Builder alertsEnabled(boolean enabled) {
            this.alertsEnabled = enabled;
            return this;
        }

        public Builder notificationsEnabled(boolean enabled) {
            this.notificationsEnabled = enabled;
            return this;
        }

        public Builder cpuThreshold(double threshold) {
            this.cpuThreshold = requirePercent(threshold, "cpuThreshold");
            return this;
        }

        public Builder ramThreshold(double threshold) {
            this.ramThreshold = requirePercent(threshold, "ramThreshold");
            return this;
        }

        public Builder durationMinutes(int minutes) {
            if (minutes < 1) {
                throw new IllegalArgumentException("Duration must be >= 1 minute");
            }
            this.durationMinutes = minutes;
            return this;
        }

        public Builder sampleInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.toSeconds() < 1) {
                throw new IllegalArgumentException("Sample interval must be >= 1 second");
            }
            this.sampleInterval = interval;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = requirePositive(cooldown, "cooldown");
            return this;
        }

        public Builder recoveryCooldown(Duration cooldown) {
            this.recoveryCooldown = requirePositive(cooldown, "recoveryCooldown");
            return this;
        }

        public Builder recoveryEmailEnabled(boolean enabled) {
            this.recoveryEmailEnabled = enabled;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder addOverride(ContainerOverride override) {
            Objects.requireNonNull(override, "override");
            overrides.put(override.name(), override);
            return this;
        }

        public Builder smtp(SmtpSettings smtp) {
            this.smtp = smtp;
            return this;
        }

        public WatcherConfig build() {
            return new WatcherConfig(this);
        }

        private static double requirePercent(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
                throw new IllegalArgumentException(name + " must be within 0..100");
            }
            return value;
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
