package dev.nishisan.watcher.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;

/**
 * Alert policy switches and cooldowns, deserialized from the {@code alerts} section.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertsConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private boolean enabled = true;

    @JsonProperty("cooldown_minutes")
    private int cooldownMinutes = 15;

    @JsonProperty("recovery_cooldown_minutes")
    private int recoveryCooldownMinutes = 5;

    /** Creates a default alerts config. */
    public AlertsConfig() {
    }

    /**
     * Returns whether alerting is enabled.
     *
     * @return {@code true} if enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Sets whether alerting is enabled.
     *
     * @param enabled {@code true} to enable
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Returns the cooldown applied to unhealthy, CPU and RAM alerts.
     *
     * @return the cooldown in minutes
     */
    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    /**
     * Sets the cooldown applied to unhealthy, CPU and RAM alerts.
     *
     * @param cooldownMinutes the cooldown in minutes
     */
    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    /**
     * Returns the cooldown applied to recovery alerts.
     *
     * @return the cooldown in minutes
     */
    public int getRecoveryCooldownMinutes() {
        return recoveryCooldownMinutes;
    }

    /**
     * Sets the cooldown applied to recovery alerts.
     *
     * @param recoveryCooldownMinutes the cooldown in minutes
     */
    public void setRecoveryCooldownMinutes(int recoveryCooldownMinutes) {
        this.recoveryCooldownMinutes = recoveryCooldownMinutes;
    }
}
