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
import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.exception.CredentialStoreException;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.domain.model.CredentialKind;
import me.vaultlock.domain.model.LockoutDecision;
import me.vaultlock.domain.model.LockoutStatus;
import me.vaultlock.domain.model.VerificationResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Guarded verification pipeline shared by login, password change, disabling
 * protection and recovery key redemption.
 *
 * <p>
 * Order of checks:
 * <ol>
 * <li>store readable, otherwise {@code CORRUPT_STORE}</li>
 * <li>protection enabled, otherwise {@code NO_CREDENTIAL_SET}</li>
 * <li>no active lockout, otherwise {@code LOCKED_OUT} without hashing</li>
 * <li>hash comparison, then the failure or success is persisted before the
 * result is returned</li>
 * </ol>
 *
 * <p>
 * Verifications are serialized so two concurrent guesses cannot both slip in
 * under the threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialVerifier {

    private final CredentialStore credentialStore;
    private final LockoutPolicy lockoutPolicy;
    private final PasswordHashingService hashingService;
    private final RecoveryKeyService recoveryKeyService;
    private final Clock clock;

    public synchronized VerificationResult verify(CharSequence secret, CredentialKind kind) {
        Instant now = clock.instant();
        AuthSettings settings;
        try {
            settings = credentialStore.snapshot();
        } catch (CorruptStoreException e) {
            log.error("[Verifier] Refusing verification, credential store is corrupt: {}", e.getMessage());
            return VerificationResult.corruptStore();
        }

        if (!settings.isProtectionEnabled()) {
            return VerificationResult.noCredentialSet();
        }

        LockoutStatus status = lockoutPolicy.statusOf(settings, now);
        if (status.lockedOut()) {
            log.info("[Verifier] Attempt rejected during lockout, {}s remaining", status.remaining().toSeconds());
            return VerificationResult.lockedOut(status);
        }

        boolean matched = kind == CredentialKind.RECOVERY_KEY
                ? recoveryKeyService.redeem(secret, settings.getRecoveryKeyHash())
                : hashingService.verify(secret, settings.getPasswordHash());

        try {
            if (matched) {
                lockoutPolicy.recordSuccess(now);
                return VerificationResult.success();
            }
            LockoutDecision decision = lockoutPolicy.recordFailure(now);
            return VerificationResult.invalid(decision, now);
        } catch (CredentialStoreException | CorruptStoreException e) {
            log.error("[Verifier] Failed to persist verification outcome: {}", e.getMessage());
            return VerificationResult.corruptStore();
        }
    }
}
