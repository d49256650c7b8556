package me.vaultlock.adapter.outbound.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.vaultlock.adapter.outbound.storage.LocalStorageAdapter;
import me.vaultlock.domain.model.AuditRecord;
import me.vaultlock.domain.model.SessionState;
import me.vaultlock.infrastructure.config.AutoConfiguration;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import me.vaultlock.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonlAuditLogAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private JsonlAuditLogAdapter adapter;

    @BeforeEach
    void setUp() {
        VaultLockProperties properties = new VaultLockProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        adapter = new JsonlAuditLogAdapter(storage, objectMapper);
    }

    @Test
    void shouldAppendOneJsonLinePerRecord() throws Exception {
        adapter.append(record("LOGIN_FAILURE"));
        awaitLines(1);
        adapter.append(record("LOGIN_SUCCESS"));

        List<String> lines = awaitLines(2);
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("SESSION_TRANSITION", first.get("type").asText());
        assertEquals("LOGIN_FAILURE", first.get("cause").asText());
        assertEquals("2026-03-01T10:00:00Z", first.get("timestamp").asText());
        assertEquals("LOGIN_SUCCESS", objectMapper.readTree(lines.get(1)).get("cause").asText());
    }

    @Test
    void shouldNotPropagateWriteFailures() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("EROFS"))));
        JsonlAuditLogAdapter failingAdapter = new JsonlAuditLogAdapter(failing, objectMapper);

        assertDoesNotThrow(() -> failingAdapter.append(record("LOCKOUT")));
    }

    private AuditRecord record(String cause) {
        return AuditRecord.builder()
                .timestamp(NOW)
                .type("SESSION_TRANSITION")
                .previousState(SessionState.LOCKED)
                .state(SessionState.LOCKED)
                .cause(cause)
                .build();
    }

    private List<String> awaitLines(int expected) throws Exception {
        Path file = tempDir.resolve("audit").resolve("session-audit.jsonl");
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            if (Files.exists(file)) {
                List<String> lines = Files.readAllLines(file);
                if (lines.size() >= expected) {
                    return lines;
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Expected " + expected + " audit lines");
    }
}
