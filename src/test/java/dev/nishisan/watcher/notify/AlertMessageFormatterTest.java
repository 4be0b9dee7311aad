package dev.nishisan.watcher.notify;

import dev.nishisan.watcher.alert.AlertBatch;
import dev.nishisan.watcher.alert.AlertEvent;
import dev.nishisan.watcher.alert.AlertKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertMessageFormatterTest {

    private static final Instant TS = Instant.parse("2025-03-01T12:30:45Z");
    private static final String BASE = "http://localhost:5001";
    private static final String LONG_ID = "0123456789abcdef0123";

    private final AlertMessageFormatter formatter = new AlertMessageFormatter(ZoneOffset.UTC);

    private static AlertEvent cpu(String id) {
        return AlertEvent.resource(id, "api", AlertKind.HIGH_CPU, 95, List.of(85.0, 90.0, 95.0), TS);
    }

    @Test
    void subjects() {
        AlertEvent down = AlertEvent.unhealthy(LONG_ID, "db", TS);

        assertEquals("CRITICAL: 1 Container Issue",
                formatter.batchSubject(AlertBatch.of(List.of(down), TS)));
        assertEquals("CRITICAL: 2 Container Issues (+ 1 Warning)",
                formatter.batchSubject(AlertBatch.of(List.of(down, down, cpu("x")), TS)));
        assertEquals("CRITICAL: 1 Container Issue (+ 2 Warnings)",
                formatter.batchSubject(AlertBatch.of(List.of(down, cpu("x"), cpu("y")), TS)));
        assertEquals("WARNING: 1 Resource Alert",
                formatter.batchSubject(AlertBatch.of(List.of(cpu("x")), TS)));
        assertEquals("WARNING: 2 Resource Alerts",
                formatter.batchSubject(AlertBatch.of(List.of(cpu("x"), cpu("y")), TS)));
        assertEquals("RESOLVED: db Container Recovered",
                formatter.recoverySubject(AlertEvent.recovery(LONG_ID, "db", null, TS)));
    }

    @Test
    void batchBodyListsSections() {
        AlertBatch batch = AlertBatch.of(List.of(AlertEvent.unhealthy(LONG_ID, "db", TS), cpu("abc")), TS);

        String body = formatter.batchBody(batch, BASE);

        assertTrue(body.contains("Timestamp: 2025-03-01 12:30:45"), body);
        assertTrue(body.contains("CRITICAL ALERTS (1)"), body);
        assertTrue(body.contains("Container: db (ID: 0123456789ab)"), body);
        assertTrue(body.contains("Status: UNHEALTHY"), body);
        assertTrue(body.contains("Details: http://localhost:5001/container/" + LONG_ID), body);
        assertTrue(body.contains("WARNING ALERTS (1)"), body);
        assertTrue(body.contains("Issue: High CPU Usage"), body);
        assertTrue(body.contains("Current: 95.0%"), body);
        assertTrue(body.contains("History: 85.0% -> 90.0% -> 95.0%"), body);
        assertTrue(body.contains("Dashboard: " + BASE), body);
    }

    @Test
    void warningOnlyBodyHasNoCriticalSection() {
        String body = formatter.batchBody(AlertBatch.of(List.of(
                AlertEvent.resource("r", "cache", AlertKind.HIGH_RAM, 88.25, List.of(88.25), TS)), TS), BASE);

        assertFalse(body.contains("CRITICAL ALERTS"));
        assertTrue(body.contains("Issue: High RAM Usage"));
        assertTrue(body.contains("Current: 88.2%") || body.contains("Current: 88.3%"));
    }

    @Test
    void recoveryBody() {
        String body = formatter.recoveryBody(
                AlertEvent.recovery(LONG_ID, "db", Duration.ofMinutes(10), TS), BASE);

        assertTrue(body.contains("Container: db"));
        assertTrue(body.contains("ID: 0123456789ab"));
        assertTrue(body.contains("Previous Status: UNHEALTHY"));
        assertTrue(body.contains("Current Status: HEALTHY"));
        assertTrue(body.contains("Downtime: 10 minutes"));
        assertTrue(body.contains("Recovered At: 2025-03-01 12:30:45"));
        assertTrue(body.contains("View Details: http://localhost:5001/container/" + LONG_ID));
    }

    @Test
    void recoveryBodyOmitsUnknownDowntime() {
        String body = formatter.recoveryBody(AlertEvent.recovery("short", "db", null, TS), BASE);

        assertFalse(body.contains("Downtime"));
        assertTrue(body.contains("ID: short"));
    }
}
