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

import lombok.extern.slf4j.Slf4j;
import me.vaultlock.domain.model.AuthSettings;
import org.springframework.stereotype.Service;

/**
 * Reads and updates the auto-lock and OS integration preferences stored next
 * to the credentials.
 */
@Service
@Slf4j
public class LockSettingsService {

    private final CredentialStore credentialStore;
    private final SessionStateMachine sessionStateMachine;

    public LockSettingsService(CredentialStore credentialStore, SessionStateMachine sessionStateMachine) {
        this.credentialStore = credentialStore;
        this.sessionStateMachine = sessionStateMachine;
    }

    public AuthSettings getSettings() {
        return credentialStore.snapshot();
    }

    /**
     * Apply the non-null values. Requires an unlocked session.
     *
     * @throws IllegalArgumentException
     *             if the timeout is not positive
     */
    public AuthSettings update(Boolean autoLockEnabled, Integer autoLockTimeoutSeconds,
            Boolean osLockIntegrationEnabled) {
        if (!sessionStateMachine.isUnlocked()) {
            throw new IllegalStateException("Session is locked");
        }
        if (autoLockTimeoutSeconds != null && autoLockTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Auto-lock timeout must be positive");
        }

        AuthSettings updated = credentialStore.update(settings -> {
            AuthSettings.AuthSettingsBuilder builder = settings.toBuilder();
            if (autoLockEnabled != null) {
                builder.autoLockEnabled(autoLockEnabled);
            }
            if (autoLockTimeoutSeconds != null) {
                builder.autoLockTimeoutSeconds(autoLockTimeoutSeconds);
            }
            if (osLockIntegrationEnabled != null) {
                builder.osLockIntegrationEnabled(osLockIntegrationEnabled);
            }
            return builder.build();
        });
        log.info("[Settings] Updated: autoLock={}, timeout={}s, osIntegration={}",
                updated.isAutoLockEnabled(), updated.getAutoLockTimeoutSeconds(),
                updated.isOsLockIntegrationEnabled());
        return updated;
    }
}
