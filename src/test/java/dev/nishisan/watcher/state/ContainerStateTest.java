package dev.nishisan.watcher.state;

import dev.nishisan.watcher.alert.AlertKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ContainerStateTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    @Test
    void firstSampleIsNotATransition() {
        ContainerState state = new ContainerState("abc", "web", 3);
        state.recordSample("web", 1, 1, HealthStatus.UNHEALTHY, T0);

        assertEquals(HealthStatus.UNKNOWN, state.previousHealth());
        assertEquals(HealthStatus.UNHEALTHY, state.currentHealth());
        assertFalse(state.hasHealthChanged());
        assertFalse(state.isUnhealthyTransition());
        assertEquals(T0, state.unhealthySince().orElseThrow());
    }

    @Test
    void tracksUnhealthyPeriodAndDowntime() {
        ContainerState state = new ContainerState("abc", "web", 3);
        state.recordSample("web", 1, 1, HealthStatus.HEALTHY, T0);
        state.recordSample("web", 1, 1, HealthStatus.UNHEALTHY, T0.plusSeconds(60));

        assertTrue(state.isUnhealthyTransition());
        assertEquals(T0.plusSeconds(60), state.unhealthySince().orElseThrow());

        state.recordSample("web", 1, 1, HealthStatus.UNHEALTHY, T0.plusSeconds(120));
        assertFalse(state.isUnhealthyTransition());
        assertEquals(T0.plusSeconds(60), state.unhealthySince().orElseThrow());

        state.recordSample("web", 1, 1, HealthStatus.HEALTHY, T0.plusSeconds(660));
        assertTrue(state.isRecoveryTransition());
        assertTrue(state.unhealthySince().isEmpty());
        assertEquals(Duration.ofMinutes(10), state.downtime().orElseThrow());

        state.recordSample("web", 1, 1, HealthStatus.HEALTHY, T0.plusSeconds(720));
        assertFalse(state.isRecoveryTransition());
        assertTrue(state.downtime().isEmpty());
    }

    @Test
    void startingToUnhealthyIsATransition() {
        ContainerState state = new ContainerState("abc", "web", 3);
        state.recordSample("web", 1, 1, HealthStatus.STARTING, T0);
        state.recordSample("web", 1, 1, HealthStatus.UNHEALTHY, T0.plusSeconds(60));

        assertTrue(state.isUnhealthyTransition());
    }

    @Test
    void noneToUnhealthyIsNotATransition() {
        ContainerState state = new ContainerState("abc", "web", 3);
        state.recordSample("web", 1, 1, HealthStatus.NONE, T0);
        state.recordSample("web", 1, 1, HealthStatus.UNHEALTHY, T0.plusSeconds(60));

        assertTrue(state.hasHealthChanged());
        assertFalse(state.isUnhealthyTransition());
    }

    @Test
    void cooldownIsStrictlyShorterThanWindow() {
        ContainerState state = new ContainerState("abc", "web", 3);
        Duration cooldown = Duration.ofMinutes(15);
        assertFalse(state.isInCooldown(AlertKind.HIGH_CPU, cooldown, T0));

        state.markAlertSent(AlertKind.HIGH_CPU, T0);
        assertTrue(state.isAlertActive(AlertKind.HIGH_CPU));
        assertTrue(state.isInCooldown(AlertKind.HIGH_CPU, cooldown, T0.plus(Duration.ofMinutes(14))));
        assertFalse(state.isInCooldown(AlertKind.HIGH_CPU, cooldown, T0.plus(cooldown)));
        assertFalse(state.isInCooldown(AlertKind.HIGH_RAM, cooldown, T0));
    }

    @Test
    void recoveryHasNoLatch() {
        ContainerState state = new ContainerState("abc", "web", 3);
        state.markAlertSent(AlertKind.RECOVERY, T0);

        assertFalse(state.isAlertActive(AlertKind.RECOVERY));
        assertEquals(T0, state.lastAlertAt(AlertKind.RECOVERY).orElseThrow());
    }

    @Test
    void nameFollowsLatestSample() {
        ContainerState state = new ContainerState("abc", "web", 3);
        state.recordSample("web", 1, 1, HealthStatus.NONE, T0);
        state.recordSample("web-renamed", 1, 1, HealthStatus.NONE, T0.plusSeconds(60));

        assertEquals("web-renamed", state.containerName());
        assertEquals(T0.plusSeconds(60), state.lastUpdate().orElseThrow());
    }

    @Test
    void windowOnlyForResourceKinds() {
        ContainerState state = new ContainerState("abc", "web", 3);
        assertSame(state.cpuWindow(), state.window(AlertKind.HIGH_CPU));
        assertSame(state.ramWindow(), state.window(AlertKind.HIGH_RAM));
        assertThrows(IllegalArgumentException.class, () -> state.window(AlertKind.UNHEALTHY));
    }
}
