package me.vaultlock.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.exception.CredentialStoreException;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.infrastructure.config.AutoConfiguration;
import me.vaultlock.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JsonCredentialStoreAdapterTest {

    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private JsonCredentialStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        objectMapper = AutoConfiguration.objectMapper();
        adapter = new JsonCredentialStoreAdapter(storagePort, objectMapper);
    }

    @Test
    void shouldReturnEmptyWhenNoFile() {
        when(storagePort.getText("auth", "auth-settings.json")).thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(adapter.load().isEmpty());
    }

    @Test
    void shouldLoadStoredRow() {
        String json = "{\"passwordHash\":\"p\",\"recoveryKeyHash\":\"r\",\"failedAttempts\":3,"
                + "\"lockoutUntil\":\"2026-03-01T10:15:00Z\",\"autoLockEnabled\":true,"
                + "\"autoLockTimeoutSeconds\":600,\"osLockIntegrationEnabled\":false,\"futureField\":1}";
        when(storagePort.getText("auth", "auth-settings.json")).thenReturn(CompletableFuture.completedFuture(json));

        Optional<AuthSettings> loaded = adapter.load();

        assertTrue(loaded.isPresent());
        AuthSettings settings = loaded.get();
        assertEquals("p", settings.getPasswordHash());
        assertEquals(3, settings.getFailedAttempts());
        assertEquals(Instant.parse("2026-03-01T10:15:00Z"), settings.getLockoutUntil());
        assertEquals(600, settings.getAutoLockTimeoutSeconds());
        assertFalse(settings.isOsLockIntegrationEnabled());
    }

    @Test
    void shouldFlagMalformedJsonAsCorrupt() {
        when(storagePort.getText("auth", "auth-settings.json"))
                .thenReturn(CompletableFuture.completedFuture("{\"passwordHash\":"));

        assertThrows(CorruptStoreException.class, adapter::load);
    }

    @Test
    void shouldFlagEmptyFileAsCorrupt() {
        when(storagePort.getText("auth", "auth-settings.json")).thenReturn(CompletableFuture.completedFuture("  "));

        assertThrows(CorruptStoreException.class, adapter::load);
    }

    @Test
    void shouldFlagUnreadableFileAsCorrupt() {
        when(storagePort.getText("auth", "auth-settings.json")).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException(new IOException("EACCES"))));

        assertThrows(CorruptStoreException.class, adapter::load);
    }

    @Test
    void shouldWriteAtomicallyWithBackup() throws Exception {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), eq(true)))
                .thenReturn(CompletableFuture.completedFuture(null));
        AuthSettings settings = AuthSettings.builder()
                .passwordHash("p")
                .recoveryKeyHash("r")
                .lockoutUntil(Instant.parse("2026-03-01T10:15:00Z"))
                .build();

        adapter.save(settings);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort).putTextAtomic(eq("auth"), eq("auth-settings.json"), json.capture(), eq(true));
        assertTrue(json.getValue().contains("\"lockoutUntil\" : \"2026-03-01T10:15:00Z\""));
        assertFalse(json.getValue().contains("protectionEnabled"));
        AuthSettings roundTrip = objectMapper.readValue(json.getValue(), AuthSettings.class);
        assertEquals(settings, roundTrip);
    }

    @Test
    void shouldReportFailedWrite() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), eq(true)))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("ENOSPC"))));

        assertThrows(CredentialStoreException.class, () -> adapter.save(AuthSettings.builder().build()));
    }
}
