package me.vaultlock.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The single persisted authentication row.
 *
 * <p>
 * A {@code null} {@link #passwordHash} means protection is disabled. Whenever
 * a password hash is present a recovery key hash is present too, and the other
 * way round. {@link #failedAttempts} only goes back to zero on a successful
 * verification; an expired {@link #lockoutUntil} does not clear it.
 *
 * <p>
 * Instances handed out by the credential store are copies. Mutate through
 * {@code toBuilder()} and write back through the store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AuthSettings {

    public static final int DEFAULT_AUTO_LOCK_TIMEOUT_SECONDS = 1800;

    private String passwordHash;

    private String recoveryKeyHash;

    @Builder.Default
    private int failedAttempts = 0;

    private Instant lockoutUntil;

    @Builder.Default
    private boolean autoLockEnabled = false;

    @Builder.Default
    private int autoLockTimeoutSeconds = DEFAULT_AUTO_LOCK_TIMEOUT_SECONDS;

    @Builder.Default
    private boolean osLockIntegrationEnabled = true;

    private Instant lastSuccessAt;

    private Instant updatedAt;

    @JsonIgnore
    public boolean isProtectionEnabled() {
        return passwordHash != null;
    }

    public AuthSettings copy() {
        return toBuilder().build();
    }
}
