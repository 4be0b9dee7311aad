package dev.nishisan.watcher.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;

/**
 * Global alert thresholds, deserialized from the {@code thresholds} section.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdsConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    @JsonProperty("cpu_percent")
    private Double cpuPercent;

    @JsonProperty("ram_percent")
    private Double ramPercent;

    // Time a metric must stay high before alerting; sizes the history window.
    @JsonProperty("duration_minutes")
    private Integer durationMinutes;

    public ThresholdsConfig() {
    }

    public Double getCpuPercent() {
        return cpuPercent;
    }

    public void setCpuPercent(Double cpuPercent) {
        this.cpuPercent = cpuPercent;
    }

    public Double getRamPercent() {
        return ramPercent;
    }

    public void setRamPercent(Double ramPercent) {
        this.ramPercent = ramPercent;
    }

    public Integer getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(Integer durationMinutes) {
        this.durationMinutes = durationMinutes;
    }
}
