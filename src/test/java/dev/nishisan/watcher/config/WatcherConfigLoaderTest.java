package dev.nishisan.watcher.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WatcherConfigLoaderTest {

    static final String VALID_YAML = """
            app:
              base_url: http://watcher.local:5001/
            monitoring:
              interval_seconds: 30
            thresholds:
              cpu_percent: 80
              ram_percent: 85.5
              duration_minutes: 3
            alerts:
              enabled: true
              cooldown_minutes: 10
              recovery_cooldown_minutes: 2
            recovery:
              send_email: false
            email:
              enabled: true
              smtp_server: smtp.example.com
              smtp_port: 587
              use_tls: true
              sender_email: watcher@example.com
              sender_password: ${SMTP_PASSWORD}
              recipient_emails:
                - ops@example.com
                - oncall@example.com
            container_rules:
              - name: batch-worker
                cpu_threshold: 95
              - name: noisy-sidecar
                alerts_disabled: true
            """;

    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("alerts.yml");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void loadsAndConvertsFullConfig() throws IOException {
        Path file = write(VALID_YAML);

        WatcherConfig config = WatcherConfigLoader.loadDomain(file, Map.of("SMTP_PASSWORD", "s3cret")::get);

        assertEquals("http://watcher.local:5001", config.baseUrl());
        assertEquals(Duration.ofSeconds(30), config.sampleInterval());
        assertEquals(6, config.historySize());
        assertEquals(80.0, config.cpuThreshold("web"));
        assertEquals(95.0, config.cpuThreshold("batch-worker"));
        assertEquals(85.5, config.ramThreshold("batch-worker"));
        assertTrue(config.isAlertsDisabled("noisy-sidecar"));
        assertFalse(config.isAlertsDisabled("batch-worker"));
        assertEquals(Duration.ofMinutes(10), config.cooldown());
        assertEquals(Duration.ofMinutes(2), config.recoveryCooldown());
        assertFalse(config.recoveryEmailEnabled());
        assertTrue(config.isEnabled());

        SmtpSettings smtp = config.smtp().orElseThrow();
        assertEquals("smtp.example.com", smtp.host());
        assertEquals(587, smtp.port());
        assertEquals("s3cret", smtp.password());
        assertEquals(List.of("ops@example.com", "oncall@example.com"), smtp.recipients());
        assertTrue(smtp.useTls());
        assertFalse(smtp.toString().contains("s3cret"));
    }

    @Test
    void appliesDefaultsForOptionalSections() throws IOException {
        Path file = write("""
                app:
                  base_url: http://localhost:5001
                thresholds:
                  cpu_percent: 80
                  ram_percent: 85
                  duration_minutes: 3
                alerts: {}
                email:
                  enabled: false
                """);

        WatcherConfig config = WatcherConfigLoader.loadDomain(file, name -> null);

        assertEquals(Duration.ofSeconds(60), config.sampleInterval());
        assertEquals(3, config.historySize());
        assertEquals(Duration.ofMinutes(15), config.cooldown());
        assertEquals(Duration.ofMinutes(5), config.recoveryCooldown());
        assertTrue(config.recoveryEmailEnabled());
        assertTrue(config.alertsEnabled());
        assertFalse(config.isEnabled());
        assertTrue(config.smtp().isEmpty());
    }

    @Test
    void placeholderDefaultsAndUnresolvedValues() throws IOException {
        Path file = write(VALID_YAML.replace("smtp.example.com", "${SMTP_HOST:mail.internal}"));

        WatcherYamlConfig yaml = WatcherConfigLoader.load(file, name -> null);

        assertEquals("mail.internal", yaml.getEmail().getSmtpServer());
        assertEquals("${SMTP_PASSWORD}", yaml.getEmail().getSenderPassword());
    }

    @Test
    void rejectsEmptyFile() throws IOException {
        Path file = write("   \n");
        assertThrows(WatcherConfigException.class, () -> WatcherConfigLoader.load(file, name -> null));
    }

    @Test
    void rejectsMalformedYaml() throws IOException {
        Path file = write("app: [unterminated\n");
        assertThrows(WatcherConfigException.class, () -> WatcherConfigLoader.load(file, name -> null));
    }

    @Test
    void reportsEveryViolation() throws IOException {
        Path file = write("""
                app: {}
                thresholds:
                  cpu_percent: 120
                  duration_minutes: 0
                alerts:
                  cooldown_minutes: 0
                email:
                  smtp_server: smtp.example.com
                  smtp_port: 70000
                  sender_email: not-an-address
                  sender_password: x
                  recipient_emails: []
                container_rules:
                  - cpu_threshold: 50
                """);

        WatcherConfigException e = assertThrows(WatcherConfigException.class,
                () -> WatcherConfigLoader.load(file, name -> null));

        String message = e.getMessage();
        assertTrue(message.contains("app.base_url"), message);
        assertTrue(message.contains("thresholds.cpu_percent must be within 0..100"), message);
        assertTrue(message.contains("Missing required field: thresholds.ram_percent"), message);
        assertTrue(message.contains("thresholds.duration_minutes must be >= 1"), message);
        assertTrue(message.contains("alerts.cooldown_minutes must be >= 1"), message);
        assertTrue(message.contains("email.smtp_port"), message);
        assertTrue(message.contains("Invalid sender email"), message);
        assertTrue(message.contains("At least one recipient"), message);
        assertTrue(message.contains("container_rules[0].name"), message);
    }

    @Test
    void rejectsMissingSections() throws IOException {
        Path file = write("app:\n  base_url: http://localhost\n");

        WatcherConfigException e = assertThrows(WatcherConfigException.class,
                () -> WatcherConfigLoader.load(file, name -> null));

        assertTrue(e.getMessage().contains("thresholds"));
        assertTrue(e.getMessage().contains("alerts"));
        assertTrue(e.getMessage().contains("email"));
    }

    @Test
    void emailFieldsOnlyRequiredWhenEnabled() throws IOException {
        Path file = write("""
                app:
                  base_url: http://localhost
                thresholds:
                  cpu_percent: 80
                  ram_percent: 85
                  duration_minutes: 1
                alerts:
                  enabled: false
                email:
                  enabled: false
                  sender_email: broken
                """);

        assertDoesNotThrow(() -> WatcherConfigLoader.load(file, name -> null));
    }

    @Test
    void rejectsInvalidRecipient() throws IOException {
        Path file = write(VALID_YAML.replace("oncall@example.com", "oncall@"));

        WatcherConfigException e = assertThrows(WatcherConfigException.class,
                () -> WatcherConfigLoader.load(file, name -> "pw"));
        assertTrue(e.getMessage().contains("Invalid recipient email: oncall@"));
    }

    @Test
    void savedConfigLoadsBack() throws IOException {
        Path file = write(VALID_YAML);
        WatcherYamlConfig yaml = WatcherConfigLoader.load(file, name -> "pw");

        Path copy = tempDir.resolve("copy.yml");
        WatcherConfigLoader.save(copy, yaml);
        WatcherConfig reloaded = WatcherConfigLoader.loadDomain(copy, name -> null);

        assertEquals(95.0, reloaded.cpuThreshold("batch-worker"));
        assertEquals("pw", reloaded.smtp().orElseThrow().password());
    }
}
