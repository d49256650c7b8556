package me.vaultlock.domain.service;

import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.domain.model.LockoutDecision;
import me.vaultlock.domain.model.LockoutStatus;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import me.vaultlock.testsupport.InMemoryCredentialStorePort;
import me.vaultlock.testsupport.MutableClock;
import me.vaultlock.testsupport.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockoutPolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryCredentialStorePort port;
    private VaultLockProperties properties;
    private MutableClock clock;
    private LockoutPolicy lockoutPolicy;

    @BeforeEach
    void setUp() {
        port = new InMemoryCredentialStorePort();
        port.setStored(AuthSettings.builder().passwordHash("p").recoveryKeyHash("r").build());
        properties = TestProperties.create();
        clock = new MutableClock(NOW);
        CredentialStore store = new CredentialStore(port, properties, clock);
        lockoutPolicy = new LockoutPolicy(store, properties);
    }

    @Test
    void shouldCountDownRemainingAttempts() {
        LockoutDecision first = lockoutPolicy.recordFailure(NOW);
        LockoutDecision second = lockoutPolicy.recordFailure(NOW);

        assertEquals(1, first.failedAttempts());
        assertEquals(4, first.remainingAttempts());
        assertEquals(3, second.remainingAttempts());
        assertFalse(second.isLockedOut());
        assertEquals(2, port.getStored().getFailedAttempts());
    }

    @Test
    void shouldArmLockoutOnFifthFailure() {
        for (int i = 0; i < 4; i++) {
            lockoutPolicy.recordFailure(NOW);
        }
        LockoutDecision fifth = lockoutPolicy.recordFailure(NOW);

        assertTrue(fifth.isLockedOut());
        assertEquals(0, fifth.remainingAttempts());
        assertEquals(NOW.plus(Duration.ofMinutes(15)), fifth.lockoutUntil());
        assertEquals(NOW.plus(Duration.ofMinutes(15)), port.getStored().getLockoutUntil());
    }

    @Test
    void shouldReportRemainingLockoutTime() {
        for (int i = 0; i < 5; i++) {
            lockoutPolicy.recordFailure(NOW);
        }

        LockoutStatus status = lockoutPolicy.check(NOW.plus(Duration.ofMinutes(5)));

        assertTrue(status.lockedOut());
        assertEquals(Duration.ofMinutes(10), status.remaining());
        assertEquals(5, status.failedAttempts());
    }

    @Test
    void shouldExpireLockoutWithoutClearingCounter() {
        for (int i = 0; i < 5; i++) {
            lockoutPolicy.recordFailure(NOW);
        }

        Instant later = NOW.plus(Duration.ofMinutes(15));
        LockoutStatus status = lockoutPolicy.check(later);

        assertFalse(status.lockedOut());
        assertEquals(5, status.failedAttempts());
        assertEquals(5, port.getStored().getFailedAttempts());
    }

    @Test
    void shouldRearmFullLockoutOnFailureAfterExpiry() {
        for (int i = 0; i < 5; i++) {
            lockoutPolicy.recordFailure(NOW);
        }
        Instant later = NOW.plus(Duration.ofMinutes(16));

        LockoutDecision decision = lockoutPolicy.recordFailure(later);

        assertEquals(6, decision.failedAttempts());
        assertEquals(later.plus(Duration.ofMinutes(15)), decision.lockoutUntil());
        assertTrue(lockoutPolicy.isLockedOut(later.plusSeconds(1)));
    }

    @Test
    void shouldResetOnSuccess() {
        for (int i = 0; i < 5; i++) {
            lockoutPolicy.recordFailure(NOW);
        }
        Instant later = NOW.plus(Duration.ofMinutes(20));

        lockoutPolicy.recordSuccess(later);

        AuthSettings stored = port.getStored();
        assertEquals(0, stored.getFailedAttempts());
        assertNull(stored.getLockoutUntil());
        assertEquals(later, stored.getLastSuccessAt());
    }

    @Test
    void shouldHonourConfiguredThreshold() {
        properties.getAuth().setMaxFailedAttempts(2);
        properties.getAuth().setLockoutDuration(Duration.ofMinutes(1));

        lockoutPolicy.recordFailure(NOW);
        LockoutDecision second = lockoutPolicy.recordFailure(NOW);

        assertEquals(NOW.plus(Duration.ofMinutes(1)), second.lockoutUntil());
    }

    @Test
    void shouldNeverUseThresholdBelowOne() {
        properties.getAuth().setMaxFailedAttempts(0);

        assertEquals(1, lockoutPolicy.getThreshold());
        assertTrue(lockoutPolicy.recordFailure(NOW).isLockedOut());
    }
}
