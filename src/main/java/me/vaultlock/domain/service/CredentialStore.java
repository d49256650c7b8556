package me.vaultlock.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import me.vaultlock.port.outbound.CredentialStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Sole owner of the {@link AuthSettings} row.
 *
 * <p>
 * Keeps the last persisted row in memory and hands out copies. Every change
 * goes through {@link #update(UnaryOperator)}, which validates the new row,
 * writes it durably through {@link CredentialStorePort} and only then makes it
 * visible. Read-modify-write cycles are serialized.
 *
 * <p>
 * When the stored row cannot be read or breaks an invariant the store enters
 * a corrupt mode: every {@link #snapshot()} throws
 * {@link CorruptStoreException} until {@link #reload()} succeeds. Protection
 * is never silently disabled because of a damaged row.
 */
@Service
@Slf4j
public class CredentialStore {

    private final CredentialStorePort credentialStorePort;
    private final VaultLockProperties properties;
    private final Clock clock;
    private final Object lock = new Object();

    private AuthSettings current;
    private CorruptStoreException corruption;
    private boolean loaded;

    public CredentialStore(CredentialStorePort credentialStorePort, VaultLockProperties properties, Clock clock) {
        this.credentialStorePort = credentialStorePort;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        try {
            reload();
        } catch (CorruptStoreException e) { // NOSONAR - corrupt mode already recorded, callers stay locked
            log.error("[CredentialStore] Stored settings are corrupt: {}", e.getMessage());
        }
    }

    /**
     * Re-read the row from storage, leaving corrupt mode on success.
     *
     * @throws CorruptStoreException
     *             if the stored row is still unusable
     */
    public void reload() {
        synchronized (lock) {
            loaded = true;
            try {
                Optional<AuthSettings> stored = credentialStorePort.load();
                if (stored.isPresent()) {
                    String violation = findViolation(stored.get());
                    if (violation != null) {
                        throw new CorruptStoreException("Stored settings violate an invariant: " + violation);
                    }
                    current = stored.get();
                    log.info("[CredentialStore] Loaded settings (protection {})",
                            current.isProtectionEnabled() ? "enabled" : "disabled");
                } else {
                    current = defaults();
                    log.info("[CredentialStore] No stored settings, protection disabled");
                }
                corruption = null;
            } catch (CorruptStoreException e) {
                current = null;
                corruption = e;
                throw e;
            }
        }
    }

    /**
     * Copy of the current row.
     *
     * @throws CorruptStoreException
     *             while the store is in corrupt mode
     */
    public AuthSettings snapshot() {
        synchronized (lock) {
            ensureLoaded();
            if (corruption != null) {
                throw new CorruptStoreException(corruption.getMessage(), corruption);
            }
            return current.copy();
        }
    }

    /**
     * Apply a change to the row and persist it before returning.
     *
     * @return copy of the persisted row
     * @throws CorruptStoreException
     *             while the store is in corrupt mode
     * @throws me.vaultlock.domain.exception.CredentialStoreException
     *             if the write failed; the in-memory row is left unchanged
     */
    public AuthSettings update(UnaryOperator<AuthSettings> mutation) {
        synchronized (lock) {
            AuthSettings base = snapshot();
            AuthSettings next = mutation.apply(base).toBuilder()
                    .updatedAt(clock.instant())
                    .build();
            String violation = findViolation(next);
            if (violation != null) {
                throw new IllegalArgumentException("Refusing to store settings: " + violation);
            }
            credentialStorePort.save(next);
            current = next;
            return next.copy();
        }
    }

    public boolean isCorrupt() {
        synchronized (lock) {
            ensureLoaded();
            return corruption != null;
        }
    }

    private void ensureLoaded() {
        if (!loaded) {
            try {
                reload();
            } catch (CorruptStoreException e) { // NOSONAR - surfaced by the caller through corruption
                log.error("[CredentialStore] Stored settings are corrupt: {}", e.getMessage());
            }
        }
    }

    private AuthSettings defaults() {
        return AuthSettings.builder()
                .autoLockEnabled(properties.getAutoLock().isDefaultEnabled())
                .autoLockTimeoutSeconds(properties.getAutoLock().getDefaultTimeoutSeconds())
                .osLockIntegrationEnabled(properties.getOsBridge().isDefaultEnabled())
                .build();
    }

    private static String findViolation(AuthSettings settings) {
        if ((settings.getPasswordHash() == null) != (settings.getRecoveryKeyHash() == null)) {
            return "password hash and recovery key hash must be set together";
        }
        if (settings.getFailedAttempts() < 0) {
            return "failed attempts must not be negative";
        }
        if (settings.getAutoLockTimeoutSeconds() <= 0) {
            return "auto-lock timeout must be positive";
        }
        return null;
    }
}
