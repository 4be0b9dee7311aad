package dev.nishisan.watcher.alert;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertBatchTest {

    private static final Instant TS = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    void partitionsBySeverityAndRecovery() {
        AlertEvent unhealthy = AlertEvent.unhealthy("a", "alpha", TS);
        AlertEvent cpu = AlertEvent.resource("b", "beta", AlertKind.HIGH_CPU, 95, List.of(95.0), TS);
        AlertEvent ram = AlertEvent.resource("b", "beta", AlertKind.HIGH_RAM, 90, List.of(90.0), TS);
        AlertEvent recovery = AlertEvent.recovery("c", "gamma", Duration.ofMinutes(3), TS);

        AlertBatch batch = AlertBatch.of(List.of(unhealthy, cpu, recovery, ram), TS);

        assertEquals(List.of(unhealthy), batch.criticalAlerts());
        assertEquals(List.of(cpu, ram), batch.warningAlerts());
        assertEquals(List.of(recovery), batch.recoveryAlerts());
        assertEquals(3, batch.totalCount());
        assertTrue(batch.hasAlerts());
        assertTrue(batch.hasRecovery());
    }

    @Test
    void recoveryOnlyBatchHasNoActionableAlerts() {
        AlertBatch batch = AlertBatch.of(List.of(AlertEvent.recovery("c", "gamma", null, TS)), TS);

        assertFalse(batch.hasAlerts());
        assertTrue(batch.hasRecovery());
        assertEquals(0, batch.totalCount());
        assertFalse(batch.isEmpty());
    }

    @Test
    void emptyBatch() {
        AlertBatch batch = AlertBatch.empty(TS);

        assertTrue(batch.isEmpty());
        assertEquals(TS, batch.timestamp());
    }

    @Test
    void partitionsAreUnmodifiable() {
        AlertBatch batch = AlertBatch.of(List.of(AlertEvent.unhealthy("a", "alpha", TS)), TS);
        assertThrows(UnsupportedOperationException.class, () -> batch.criticalAlerts().clear());
    }
}
