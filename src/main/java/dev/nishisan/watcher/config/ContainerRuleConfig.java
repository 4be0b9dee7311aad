package dev.nishisan.watcher.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;

/**
 * Per-container override, one entry of the {@code container_rules} list.
 * Matched against the container name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContainerRuleConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private String name;

    @JsonProperty("cpu_threshold")
    private Double cpuThreshold;

    @JsonProperty("ram_threshold")
    private Double ramThreshold;

    @JsonProperty("alerts_disabled")
    private boolean alertsDisabled;

    /** Creates an empty rule. */
    public ContainerRuleConfig() {
    }

    /**
     * Returns the container name this rule applies to.
     *
     * @return the name
     */
    public String getName() {
        return name;
    }

    /**
     * Sets the container name this rule applies to.
     *
     * @param name the name
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * Returns the CPU threshold override.
     *
     * @return the threshold, {@code null} to use the global one
     */
    public Double getCpuThreshold() {
        return cpuThreshold;
    }

    public void setCpuThreshold(Double cpuThreshold) {
        this.cpuThreshold = cpuThreshold;
    }

    /**
     * Returns the RAM threshold override.
     *
     * @return the threshold, {@code null} to use the global one
     */
    public Double getRamThreshold() {
        return ramThreshold;
    }

    public void setRamThreshold(Double ramThreshold) {
        this.ramThreshold = ramThreshold;
    }

    public boolean isAlertsDisabled() {
        return alertsDisabled;
    }

    public void setAlertsDisabled(boolean alertsDisabled) {
        this.alertsDisabled = alertsDisabled;
    }
}
