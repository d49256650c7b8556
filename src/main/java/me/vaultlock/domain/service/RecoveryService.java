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
import me.vaultlock.domain.exception.InvalidResetTicketException;
import me.vaultlock.domain.model.CredentialChangedEvent;
import me.vaultlock.domain.model.CredentialKind;
import me.vaultlock.domain.model.CredentialResetTicket;
import me.vaultlock.domain.model.IssuedRecoveryKey;
import me.vaultlock.domain.model.RecoveryRedemption;
import me.vaultlock.domain.model.VerificationOutcome;
import me.vaultlock.domain.model.VerificationResult;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import me.vaultlock.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Forgotten-password flow.
 *
 * <p>
 * {@link #redeem(String)} verifies a recovery key through the same guarded
 * pipeline as a login, so wrong keys count towards the lockout. Success opens
 * credential-reset mode by handing out a single-use
 * {@link CredentialResetTicket}. {@link #completeReset(String, String)}
 * consumes the ticket, stores the new password together with a freshly issued
 * recovery key and clears the failure counter. The previous recovery key stops
 * working at that same write.
 *
 * <p>
 * The session stays locked; the user logs in with the new password afterwards.
 * There is no other way back in: losing both the password and the recovery key
 * leaves the data unreachable through this subsystem.
 */
@Service
@Slf4j
public class RecoveryService {

    private static final int TICKET_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final CredentialVerifier credentialVerifier;
    private final CredentialStore credentialStore;
    private final RecoveryKeyService recoveryKeyService;
    private final PasswordHashingService hashingService;
    private final PasswordPolicy passwordPolicy;
    private final SpringEventBus eventBus;
    private final VaultLockProperties properties;
    private final Clock clock;
    private final AtomicReference<CredentialResetTicket> pendingTicket = new AtomicReference<>();

    public RecoveryService(CredentialVerifier credentialVerifier, CredentialStore credentialStore,
            RecoveryKeyService recoveryKeyService, PasswordHashingService hashingService,
            PasswordPolicy passwordPolicy, SpringEventBus eventBus, VaultLockProperties properties, Clock clock) {
        this.credentialVerifier = credentialVerifier;
        this.credentialStore = credentialStore;
        this.recoveryKeyService = recoveryKeyService;
        this.hashingService = hashingService;
        this.passwordPolicy = passwordPolicy;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    public RecoveryRedemption redeem(String candidate) {
        VerificationResult result = credentialVerifier.verify(candidate, CredentialKind.RECOVERY_KEY);
        if (result.outcome() != VerificationOutcome.SUCCESS) {
            log.info("[Recovery] Redemption refused: {}", result.outcome());
            return new RecoveryRedemption(result, null);
        }

        byte[] random = new byte[TICKET_BYTES];
        SECURE_RANDOM.nextBytes(random);
        String ticketId = Base64.getUrlEncoder().withoutPadding().encodeToString(random);
        CredentialResetTicket ticket = new CredentialResetTicket(ticketId,
                clock.instant().plus(properties.getRecovery().getResetTicketTtl()));
        pendingTicket.set(ticket);
        log.info("[Recovery] Recovery key accepted, credential reset open until {}", ticket.expiresAt());
        return new RecoveryRedemption(result, ticket);
    }

    /**
     * Set a new password using a ticket from {@link #redeem(String)}.
     *
     * @return the new recovery key, to be shown once
     * @throws InvalidResetTicketException
     *             if the ticket is unknown, used or expired
     * @throws me.vaultlock.domain.exception.WeakPasswordException
     *             if the password is rejected; the ticket stays usable
     */
    public IssuedRecoveryKey completeReset(String ticketId, String newPassword) {
        Instant now = clock.instant();
        CredentialResetTicket ticket = pendingTicket.get();
        if (ticket == null || ticketId == null || !matches(ticket.id(), ticketId)) {
            throw new InvalidResetTicketException("Credential reset ticket is not valid");
        }
        if (ticket.isExpired(now)) {
            pendingTicket.compareAndSet(ticket, null);
            throw new InvalidResetTicketException("Credential reset ticket has expired");
        }
        passwordPolicy.requireAcceptable(newPassword);
        if (!pendingTicket.compareAndSet(ticket, null)) {
            throw new InvalidResetTicketException("Credential reset ticket is not valid");
        }

        String passwordHash = hashingService.hash(newPassword);
        IssuedRecoveryKey recoveryKey = recoveryKeyService.issue();
        credentialStore.update(settings -> settings.toBuilder()
                .passwordHash(passwordHash)
                .recoveryKeyHash(recoveryKey.hash())
                .failedAttempts(0)
                .lockoutUntil(null)
                .build());

        log.info("[Recovery] Password reset with recovery key, new recovery key issued");
        eventBus.publish(new CredentialChangedEvent(CredentialChangedEvent.Kind.RESET, now));
        return recoveryKey;
    }

    /**
     * Drop any open credential reset, e.g. after the password changed by other
     * means.
     */
    public void cancelPendingReset() {
        if (pendingTicket.getAndSet(null) != null) {
            log.info("[Recovery] Pending credential reset cancelled");
        }
    }

    public boolean hasPendingReset() {
        CredentialResetTicket ticket = pendingTicket.get();
        return ticket != null && !ticket.isExpired(clock.instant());
    }

    private static boolean matches(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
