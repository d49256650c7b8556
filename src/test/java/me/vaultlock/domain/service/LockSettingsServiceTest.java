package me.vaultlock.domain.service;

import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.testsupport.InMemoryCredentialStorePort;
import me.vaultlock.testsupport.MutableClock;
import me.vaultlock.testsupport.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LockSettingsServiceTest {

    private InMemoryCredentialStorePort port;
    private SessionStateMachine sessionStateMachine;
    private LockSettingsService lockSettingsService;

    @BeforeEach
    void setUp() {
        port = new InMemoryCredentialStorePort();
        CredentialStore store = new CredentialStore(port, TestProperties.create(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        sessionStateMachine = mock(SessionStateMachine.class);
        when(sessionStateMachine.isUnlocked()).thenReturn(true);
        lockSettingsService = new LockSettingsService(store, sessionStateMachine);
    }

    @Test
    void shouldReturnDefaults() {
        AuthSettings settings = lockSettingsService.getSettings();

        assertFalse(settings.isAutoLockEnabled());
        assertEquals(1800, settings.getAutoLockTimeoutSeconds());
        assertTrue(settings.isOsLockIntegrationEnabled());
    }

    @Test
    void shouldApplyOnlyProvidedFields() {
        lockSettingsService.update(true, null, null);
        AuthSettings updated = lockSettingsService.update(null, 300, false);

        assertTrue(updated.isAutoLockEnabled());
        assertEquals(300, updated.getAutoLockTimeoutSeconds());
        assertFalse(updated.isOsLockIntegrationEnabled());
        assertEquals(300, port.getStored().getAutoLockTimeoutSeconds());
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> lockSettingsService.update(null, 0, null));
        assertThrows(IllegalArgumentException.class, () -> lockSettingsService.update(null, -5, null));
        assertEquals(0, port.getSaveCount());
    }

    @Test
    void shouldRefuseChangesWhileLocked() {
        when(sessionStateMachine.isUnlocked()).thenReturn(false);

        assertThrows(IllegalStateException.class, () -> lockSettingsService.update(false, null, null));
    }
}
