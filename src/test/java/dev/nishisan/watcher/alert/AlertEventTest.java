package dev.nishisan.watcher.alert;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlertEventTest {

    private static final Instant TS = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    void resourceAlertCarriesValueAndHistory() {
        List<Double> history = new ArrayList<>(List.of(85.0, 90.0, 95.0));
        AlertEvent event = AlertEvent.resource("id", "web", AlertKind.HIGH_CPU, 95.0, history, TS);
        history.clear();

        assertEquals(AlertSeverity.WARNING, event.severity());
        assertEquals(95.0, event.value().getAsDouble());
        assertEquals(List.of(85.0, 90.0, 95.0), event.history());
        assertTrue(event.downtime().isEmpty());
    }

    @Test
    void healthAlertHasNoValue() {
        AlertEvent event = AlertEvent.unhealthy("id", "web", TS);

        assertEquals(AlertSeverity.CRITICAL, event.severity());
        assertTrue(event.value().isEmpty());
        assertTrue(event.history().isEmpty());
    }

    @Test
    void recoveryDowntimeTruncatesToMinutes() {
        AlertEvent event = AlertEvent.recovery("id", "web", Duration.ofSeconds(10 * 60 + 59), TS);

        assertEquals(AlertSeverity.INFO, event.severity());
        assertEquals("10 minutes", event.downtimeText().orElseThrow());
    }

    @Test
    void recoveryWithUnknownDowntime() {
        AlertEvent event = AlertEvent.recovery("id", "web", null, TS);

        assertTrue(event.downtime().isEmpty());
        assertTrue(event.downtimeText().isEmpty());
    }

    @Test
    void rejectsSeverityThatDoesNotMatchKind() {
        assertThrows(IllegalArgumentException.class, () -> new AlertEvent("id", "web", AlertKind.HIGH_RAM,
                AlertSeverity.CRITICAL, TS, new AlertDetail.ResourceUsage(90.0, List.of(90.0))));
    }

    @Test
    void rejectsDetailOfAnotherKind() {
        assertThrows(IllegalArgumentException.class, () -> new AlertEvent("id", "web", AlertKind.UNHEALTHY,
                AlertSeverity.CRITICAL, TS, new AlertDetail.Recovery(null)));
    }

    @Test
    void exportsLowercaseValues() {
        Map<String, Object> map = AlertEvent.resource("id", "web", AlertKind.HIGH_RAM, 91.5,
                List.of(90.0, 91.5), TS).toMap();

        assertEquals("high_ram", map.get("alert_type"));
        assertEquals("warning", map.get("priority"));
        assertEquals(91.5, map.get("value"));
        assertEquals("2025-03-01T12:00:00Z", map.get("timestamp"));
        assertEquals(List.of(90.0, 91.5), map.get("history"));
        assertNull(map.get("downtime"));
    }
}
