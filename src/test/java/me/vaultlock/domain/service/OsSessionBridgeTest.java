package me.vaultlock.domain.service;

import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.domain.model.HostSessionEvent;
import me.vaultlock.domain.model.HostSessionEventKind;
import me.vaultlock.domain.model.LockRequest;
import me.vaultlock.domain.model.LockSource;
import me.vaultlock.infrastructure.event.SpringEventBus;
import me.vaultlock.port.inbound.HostSessionEventSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OsSessionBridgeTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private CredentialStore credentialStore;
    private SpringEventBus eventBus;
    private HostSessionEventSource available;
    private HostSessionEventSource unavailable;
    private OsSessionBridge bridge;

    @BeforeEach
    void setUp() {
        credentialStore = mock(CredentialStore.class);
        when(credentialStore.snapshot()).thenReturn(AuthSettings.builder().build());
        eventBus = mock(SpringEventBus.class);
        available = source("logind", true);
        unavailable = source("windows", false);
        bridge = new OsSessionBridge(List.of(available, unavailable), credentialStore, eventBus);
    }

    @Test
    void shouldStartOnlyAvailableSources() {
        bridge.init();

        verify(available).start(bridge);
        verify(unavailable, never()).start(any());
        assertEquals(List.of("logind"), bridge.getActiveSources());
    }

    @Test
    void shouldSurviveSourceThatFailsToStart() {
        doThrow(new IllegalStateException("no dbus")).when(available).start(any());

        bridge.init();

        assertTrue(bridge.getActiveSources().isEmpty());
    }

    @Test
    void shouldStopStartedSourcesOnShutdown() {
        bridge.init();

        bridge.shutdown();

        verify(available).stop();
        verify(unavailable, never()).stop();
    }

    @Test
    void shouldRequestLockForEveryEventKind() {
        for (HostSessionEventKind kind : HostSessionEventKind.values()) {
            bridge.onHostSessionEvent(new HostSessionEvent(kind, "logind", NOW));
        }

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventBus, times(HostSessionEventKind.values().length)).publish(captor.capture());
        LockRequest first = (LockRequest) captor.getAllValues().get(0);
        assertEquals(LockSource.OS_EVENT, first.source());
        assertEquals(HostSessionEventKind.SCREEN_LOCKED.name(), first.detail());
        assertEquals(NOW, first.requestedAt());
    }

    @Test
    void shouldIgnoreEventsWhenIntegrationDisabled() {
        when(credentialStore.snapshot()).thenReturn(AuthSettings.builder().osLockIntegrationEnabled(false).build());

        bridge.onHostSessionEvent(new HostSessionEvent(HostSessionEventKind.SCREEN_LOCKED, "logind", NOW));

        verify(eventBus, never()).publish(any());
    }

    @Test
    void shouldStillLockWhenStoreIsCorrupt() {
        when(credentialStore.snapshot()).thenThrow(new CorruptStoreException("malformed"));

        bridge.onHostSessionEvent(new HostSessionEvent(HostSessionEventKind.SLEEP_OR_HIBERNATE, "logind", NOW));

        verify(eventBus).publish(any(LockRequest.class));
    }

    private static HostSessionEventSource source(String name, boolean isAvailable) {
        HostSessionEventSource source = mock(HostSessionEventSource.class);
        when(source.getName()).thenReturn(name);
        when(source.isAvailable()).thenReturn(isAvailable);
        return source;
    }
}
