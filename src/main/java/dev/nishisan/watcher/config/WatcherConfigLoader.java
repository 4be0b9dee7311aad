package dev.nishisan.watcher.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class WatcherConfigLoader {

    private static final ObjectMapper mapper;
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private WatcherConfigLoader() {
    }

    public static WatcherYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    /**
     * Reads, interpolates and validates a YAML configuration file.
     *
     * @param yamlFile    the file to read
     * @param envProvider lookup for {@code ${VAR}} placeholders
     * @return the validated YAML model
     * @throws IOException            if the file cannot be read
     * @throws WatcherConfigException if the content is empty, malformed or invalid
     */
    public static WatcherYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        String content = Files.readString(yamlFile);
        if (content.isBlank()) {
            throw new WatcherConfigException("Configuration file is empty: " + yamlFile);
        }
        String processedContent = resolveVariables(content, envProvider);
        WatcherYamlConfig yamlConfig;
        try {
            yamlConfig = mapper.readValue(processedContent, WatcherYamlConfig.class);
        } catch (JsonProcessingException e) {
            throw new WatcherConfigException("Malformed configuration file " + yamlFile + ": "
                    + e.getOriginalMessage(), e);
        }
        if (yamlConfig == null) {
            throw new WatcherConfigException("Configuration file is empty: " + yamlFile);
        }
        validate(yamlConfig);
        return yamlConfig;
    }

    /**
     * Loads a file and converts it to the domain snapshot in one step.
     */
    public static WatcherConfig loadDomain(Path yamlFile, Function<String, String> envProvider) throws IOException {
        return convertToDomain(load(yamlFile, envProvider));
    }

    private static String resolveVariables(String content, Function<String, String> envProvider) {
        // ${VAR} and ${VAR:default}; unresolved placeholders stay as written
        Matcher matcher = PLACEHOLDER.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            String replacement = getReplacement(matcher.group(1), envProvider);
            builder.append(content, i, matcher.start());
            if (replacement == null) {
                builder.append(matcher.group(0));
            } else {
                builder.append(replacement);
            }
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String value = envProvider.apply(parts[0].trim());
        if (value != null) {
            return value;
        }
        return parts.length > 1 ? parts[1] : null;
    }

    public static void save(Path yamlFile, WatcherYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    /**
     * Checks every rule and reports all violations at once.
     *
     * @throws WatcherConfigException if any rule is violated
     */
    public static void validate(WatcherYamlConfig config) {
        List<String> errors = new ArrayList<>();

        if (config.getApp() == null) {
            errors.add("Missing required section: app");
        } else if (isBlank(config.getApp().getBaseUrl())) {
            errors.add("Missing required field: app.base_url");
        }

        if (config.getMonitoring() != null && config.getMonitoring().getIntervalSeconds() < 1) {
            errors.add("monitoring.interval_seconds must be >= 1");
        }

        ThresholdsConfig thresholds = config.getThresholds();
        if (thresholds == null) {
            errors.add("Missing required section: thresholds");
        } else {
            checkPercent(errors, "thresholds.cpu_percent", thresholds.getCpuPercent(), true);
            checkPercent(errors, "thresholds.ram_percent", thresholds.getRamPercent(), true);
            if (thresholds.getDurationMinutes() == null) {
                errors.add("Missing required field: thresholds.duration_minutes");
            } else if (thresholds.getDurationMinutes() < 1) {
                errors.add("thresholds.duration_minutes must be >= 1");
            }
        }

        AlertsConfig alerts = config.getAlerts();
        if (alerts == null) {
            errors.add("Missing required section: alerts");
        } else {
            if (alerts.getCooldownMinutes() < 1) {
                errors.add("alerts.cooldown_minutes must be >= 1");
            }
            if (alerts.getRecoveryCooldownMinutes() < 1) {
                errors.add("alerts.recovery_cooldown_minutes must be >= 1");
            }
        }

        EmailConfig email = config.getEmail();
        if (email == null) {
            errors.add("Missing required section: email");
        } else if (email.isEnabled()) {
            validateEmail(errors, email);
        }

        List<ContainerRuleConfig> rules = config.getContainerRules();
        if (rules != null) {
            for (int idx = 0; idx < rules.size(); idx++) {
                ContainerRuleConfig rule = rules.get(idx);
                String prefix = "container_rules[" + idx + "]";
                if (rule == null || isBlank(rule.getName())) {
                    errors.add("Missing required field: " + prefix + ".name");
                    continue;
                }
                checkPercent(errors, prefix + ".cpu_threshold", rule.getCpuThreshold(), false);
                checkPercent(errors, prefix + ".ram_threshold", rule.getRamThreshold(), false);
            }
        }

        if (!errors.isEmpty()) {
            throw new WatcherConfigException("Invalid configuration: " + String.join("; ", errors));
        }
    }

    private static void validateEmail(List<String> errors, EmailConfig email) {
        if (isBlank(email.getSmtpServer())) {
            errors.add("Missing required field: email.smtp_server");
        }
        if (email.getSmtpPort() == null) {
            errors.add("Missing required field: email.smtp_port");
        } else if (email.getSmtpPort() < 1 || email.getSmtpPort() > 65535) {
            errors.add("email.smtp_port must be within 1..65535");
        }
        if (isBlank(email.getSenderEmail())) {
            errors.add("Missing required field: email.sender_email");
        } else if (!EMAIL.matcher(email.getSenderEmail()).matches()) {
            errors.add("Invalid sender email: " + email.getSenderEmail());
        }
        if (isBlank(email.getSenderPassword())) {
            errors.add("Missing required field: email.sender_password");
        }
        List<String> recipients = email.getRecipientEmails();
        if (recipients == null) {
            errors.add("Missing required field: email.recipient_emails");
        } else if (recipients.isEmpty()) {
            errors.add("At least one recipient email is required");
        } else {
            for (String recipient : recipients) {
                if (recipient == null || !EMAIL.matcher(recipient).matches()) {
                    errors.add("Invalid recipient email: " + recipient);
                }
            }
        }
    }

    private static void checkPercent(List<String> errors, String field, Double value, boolean required) {
        if (value == null) {
            if (required) {
                errors.add("Missing required field: " + field);
            }
            return;
        }
        if (value.isNaN() || value < 0.0 || value > 100.0) {
            errors.add(field + " must be within 0..100");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Converts a validated YAML model into the immutable domain snapshot.
     *
     * @throws WatcherConfigException if the model is invalid
     */
    public static WatcherConfig convertToDomain(WatcherYamlConfig yamlConfig) {
        validate(yamlConfig);

        ThresholdsConfig thresholds = yamlConfig.getThresholds();
        AlertsConfig alerts = yamlConfig.getAlerts();
        EmailConfig email = yamlConfig.getEmail();

        WatcherConfig.Builder builder = WatcherConfig.builder()
                .baseUrl(stripTrailingSlash(yamlConfig.getApp().getBaseUrl().trim()))
                .alertsEnabled(alerts.isEnabled())
                .notificationsEnabled(email.isEnabled())
                .cpuThreshold(thresholds.getCpuPercent())
                .ramThreshold(thresholds.getRamPercent())
                .durationMinutes(thresholds.getDurationMinutes())
                .cooldown(Duration.ofMinutes(alerts.getCooldownMinutes()))
                .recoveryCooldown(Duration.ofMinutes(alerts.getRecoveryCooldownMinutes()));

        if (yamlConfig.getMonitoring() != null) {
            builder.sampleInterval(Duration.ofSeconds(yamlConfig.getMonitoring().getIntervalSeconds()));
        }
        if (yamlConfig.getRecovery() != null) {
            builder.recoveryEmailEnabled(yamlConfig.getRecovery().isSendEmail());
        }

        if (yamlConfig.getContainerRules() != null) {
            for (ContainerRuleConfig rule : yamlConfig.getContainerRules()) {
                builder.addOverride(new ContainerOverride(rule.getName().trim(), rule.getCpuThreshold(),
                        rule.getRamThreshold(), rule.isAlertsDisabled()));
            }
        }

        if (email.isEnabled()) {
            builder.smtp(new SmtpSettings(
                    email.getSmtpServer().trim(),
                    email.getSmtpPort(),
                    email.getSenderEmail(),
                    email.getSenderPassword(),
                    email.getRecipientEmails(),
                    email.isUseTls()));
        }
        return builder.build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
