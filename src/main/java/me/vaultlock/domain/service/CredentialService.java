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
import me.vaultlock.domain.model.CredentialChangeResult;
import me.vaultlock.domain.model.CredentialChangedEvent;
import me.vaultlock.domain.model.CredentialKind;
import me.vaultlock.domain.model.IssuedRecoveryKey;
import me.vaultlock.domain.model.VerificationOutcome;
import me.vaultlock.domain.model.VerificationResult;
import me.vaultlock.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Setting, changing and removing the master password.
 *
 * <p>
 * Every operation needs an unlocked session. Setting or changing the password
 * always issues a new recovery key in the same write, so there is never a
 * window where an old recovery key still works against a new password.
 */
@Service
@Slf4j
public class CredentialService {

    private final CredentialStore credentialStore;
    private final CredentialVerifier credentialVerifier;
    private final PasswordHashingService hashingService;
    private final RecoveryKeyService recoveryKeyService;
    private final RecoveryService recoveryService;
    private final PasswordPolicy passwordPolicy;
    private final SessionStateMachine sessionStateMachine;
    private final SpringEventBus eventBus;
    private final Clock clock;

    public CredentialService(CredentialStore credentialStore, CredentialVerifier credentialVerifier,
            PasswordHashingService hashingService, RecoveryKeyService recoveryKeyService,
            RecoveryService recoveryService, PasswordPolicy passwordPolicy,
            SessionStateMachine sessionStateMachine, SpringEventBus eventBus, Clock clock) {
        this.credentialStore = credentialStore;
        this.credentialVerifier = credentialVerifier;
        this.hashingService = hashingService;
        this.recoveryKeyService = recoveryKeyService;
        this.recoveryService = recoveryService;
        this.passwordPolicy = passwordPolicy;
        this.sessionStateMachine = sessionStateMachine;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public boolean isProtectionEnabled() {
        return credentialStore.snapshot().isProtectionEnabled();
    }

    /**
     * Turn protection on with a first password.
     *
     * @return the recovery key, to be shown once
     * @throws IllegalStateException
     *             if a password is already set or the session is locked
     */
    public IssuedRecoveryKey setupPassword(String newPassword) {
        requireUnlocked();
        if (credentialStore.snapshot().isProtectionEnabled()) {
            throw new IllegalStateException("A master password is already set");
        }
        passwordPolicy.requireAcceptable(newPassword);

        String passwordHash = hashingService.hash(newPassword);
        IssuedRecoveryKey recoveryKey = recoveryKeyService.issue();
        credentialStore.update(settings -> {
            if (settings.isProtectionEnabled()) {
                throw new IllegalStateException("A master password is already set");
            }
            return settings.toBuilder()
                    .passwordHash(passwordHash)
                    .recoveryKeyHash(recoveryKey.hash())
                    .failedAttempts(0)
                    .lockoutUntil(null)
                    .build();
        });

        log.info("[Credentials] Master password set, protection enabled");
        eventBus.publish(new CredentialChangedEvent(CredentialChangedEvent.Kind.SET, clock.instant()));
        return recoveryKey;
    }

    /**
     * Replace the password after checking the current one. A wrong current
     * password counts as a failed attempt.
     */
    public CredentialChangeResult changePassword(String currentPassword, String newPassword) {
        requireUnlocked();
        passwordPolicy.requireAcceptable(newPassword);

        VerificationResult verification = credentialVerifier.verify(currentPassword, CredentialKind.PASSWORD);
        if (verification.outcome() == VerificationOutcome.NO_CREDENTIAL_SET) {
            throw new IllegalStateException("No master password is set");
        }
        if (verification.outcome() != VerificationOutcome.SUCCESS) {
            log.info("[Credentials] Password change refused: {}", verification.outcome());
            return new CredentialChangeResult(verification, null);
        }

        String passwordHash = hashingService.hash(newPassword);
        IssuedRecoveryKey recoveryKey = recoveryKeyService.issue();
        credentialStore.update(settings -> settings.toBuilder()
                .passwordHash(passwordHash)
                .recoveryKeyHash(recoveryKey.hash())
                .failedAttempts(0)
                .lockoutUntil(null)
                .build());
        recoveryService.cancelPendingReset();

        log.info("[Credentials] Master password changed, new recovery key issued");
        eventBus.publish(new CredentialChangedEvent(CredentialChangedEvent.Kind.CHANGED, clock.instant()));
        return new CredentialChangeResult(verification, recoveryKey);
    }

    /**
     * Remove the password and recovery key after checking the current password.
     */
    public VerificationResult disableProtection(String currentPassword) {
        requireUnlocked();
        VerificationResult verification = credentialVerifier.verify(currentPassword, CredentialKind.PASSWORD);
        if (verification.outcome() != VerificationOutcome.SUCCESS) {
            log.info("[Credentials] Disabling protection refused: {}", verification.outcome());
            return verification;
        }

        credentialStore.update(settings -> settings.toBuilder()
                .passwordHash(null)
                .recoveryKeyHash(null)
                .failedAttempts(0)
                .lockoutUntil(null)
                .build());
        recoveryService.cancelPendingReset();

        log.warn("[Credentials] Protection disabled, master password removed");
        eventBus.publish(new CredentialChangedEvent(CredentialChangedEvent.Kind.DISABLED, clock.instant()));
        return verification;
    }

    private void requireUnlocked() {
        if (!sessionStateMachine.isUnlocked()) {
            throw new IllegalStateException("Session is locked");
        }
    }
}
