package dev.nishisan.watcher.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WatcherYamlConfig {

    @JsonProperty("app")
    private AppConfig app;

    @JsonProperty("monitoring")
    private MonitoringConfig monitoring = new MonitoringConfig();

    @JsonProperty("thresholds")
    private ThresholdsConfig thresholds;

    @JsonProperty("alerts")
    private AlertsConfig alerts;

    @JsonProperty("recovery")
    private RecoveryConfig recovery = new RecoveryConfig();

    @JsonProperty("email")
    private EmailConfig email;

    @JsonProperty("container_rules")
    private List<ContainerRuleConfig> containerRules = Collections.emptyList();

    public AppConfig getApp() {
        return app;
    }

    public void setApp(AppConfig app) {
        this.app = app;
    }

    public MonitoringConfig getMonitoring() {
        return monitoring;
    }

    public void setMonitoring(MonitoringConfig monitoring) {
        this.monitoring = monitoring;
    }

    public ThresholdsConfig getThresholds() {
        return thresholds;
    }

    public void setThresholds(ThresholdsConfig thresholds) {
        this.thresholds = thresholds;
    }

    public AlertsConfig getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertsConfig alerts) {
        this.alerts = alerts;
    }

    public RecoveryConfig getRecovery() {
        return recovery;
    }

    public void setRecovery(RecoveryConfig recovery) {
        this.recovery = recovery;
    }

    public EmailConfig getEmail() {
        return email;
    }

    public void setEmail(EmailConfig email) {
        this.email = email;
    }

    public List<ContainerRuleConfig> getContainerRules() {
        return containerRules;
    }

    public void setContainerRules(List<ContainerRuleConfig> containerRules) {
        this.containerRules = containerRules;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AppConfig {
        @JsonProperty("base_url")
        private String baseUrl;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonitoringConfig {
        @JsonProperty("interval_seconds")
        private int intervalSeconds = 60;

        public int getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecoveryConfig {
        @JsonProperty("send_email")
        private boolean sendEmail = true;

        public boolean isSendEmail() {
            return sendEmail;
        }

        public void setSendEmail(boolean sendEmail) {
            this.sendEmail = sendEmail;
        }
    }
}
