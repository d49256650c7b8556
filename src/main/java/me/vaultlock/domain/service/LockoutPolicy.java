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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.domain.model.LockoutDecision;
import me.vaultlock.domain.model.LockoutStatus;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Persistent brute-force lockout.
 *
 * <p>
 * Consecutive failures are counted in the stored settings row. When the count
 * reaches {@code vaultlock.auth.max-failed-attempts} (5) the row gets
 * {@code lockoutUntil = now + lockout-duration} (15 minutes), written durably
 * before the call returns.
 *
 * <p>
 * The counter only resets on a successful verification. Once a window has
 * expired exactly one attempt is evaluated; if it fails the counter is still
 * at or above the threshold and a new full window is armed immediately, so
 * after the first threshold failures an attacker gets one guess per window.
 *
 * @see CredentialVerifier
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LockoutPolicy {

    private final CredentialStore credentialStore;
    private final VaultLockProperties properties;

    public LockoutStatus check(Instant now) {
        return statusOf(credentialStore.snapshot(), now);
    }

    public boolean isLockedOut(Instant now) {
        return check(now).lockedOut();
    }

    LockoutStatus statusOf(AuthSettings settings, Instant now) {
        Instant until = settings.getLockoutUntil();
        if (until != null && now.isBefore(until)) {
            return new LockoutStatus(true, settings.getFailedAttempts(), until, Duration.between(now, until));
        }
        return LockoutStatus.open(settings.getFailedAttempts());
    }

    /**
     * Count one failed verification and arm a lockout when the threshold is
     * reached. Returns after the new counter is on disk.
     */
    public LockoutDecision recordFailure(Instant now) {
        int threshold = getThreshold();
        AuthSettings updated = credentialStore.update(settings -> {
            int attempts = settings.getFailedAttempts() + 1;
            Instant lockoutUntil = attempts >= threshold
                    ? now.plus(properties.getAuth().getLockoutDuration())
                    : null;
            return settings.toBuilder()
                    .failedAttempts(attempts)
                    .lockoutUntil(lockoutUntil)
                    .build();
        });

        int attempts = updated.getFailedAttempts();
        if (updated.getLockoutUntil() != null) {
            log.warn("[Lockout] Locked out after {} failed attempts until {}", attempts, updated.getLockoutUntil());
        } else {
            log.info("[Lockout] Failed attempt {} of {}", attempts, threshold);
        }
        return new LockoutDecision(attempts, Math.max(0, threshold - attempts), updated.getLockoutUntil());
    }

    /**
     * Reset the counter and clear any lockout after a successful verification.
     */
    public void recordSuccess(Instant now) {
        credentialStore.update(settings -> settings.toBuilder()
                .failedAttempts(0)
                .lockoutUntil(null)
                .lastSuccessAt(now)
                .build());
    }

    int getThreshold() {
        return Math.max(1, properties.getAuth().getMaxFailedAttempts());
    }
}
