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
import me.vaultlock.domain.model.CredentialKind;
import me.vaultlock.domain.model.LockRequest;
import me.vaultlock.domain.model.LockSource;
import me.vaultlock.domain.model.SessionState;
import me.vaultlock.domain.model.SessionTransitionEvent;
import me.vaultlock.domain.model.TransitionCause;
import me.vaultlock.domain.model.VerificationResult;
import me.vaultlock.infrastructure.event.SpringEventBus;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single authority over {@link SessionState}.
 *
 * <p>
 * Transitions:
 * <ul>
 * <li>{@code LOCKED --login--> UNLOCKED} when protection is disabled or the
 * password verifies outside a lockout window</li>
 * <li>{@code LOCKED --login--> LOCKED} on a wrong password, an active lockout
 * or an unusable credential store</li>
 * <li>{@code UNLOCKED --lock request--> LOCKED} for every source; a lock
 * request on a locked session is a no-op</li>
 * </ul>
 *
 * <p>
 * All transitions run under one fair lock. A lock request that arrives while a
 * login is being verified waits for that login to finish and is applied right
 * after it, so a login can never leave the session unlocked past a pending
 * lock. The state starts as {@link SessionState#LOCKED} and is only computed
 * from the stored settings once construction completes.
 *
 * <p>
 * Each transition, including the LOCKED to LOCKED outcome of a failed login,
 * is published as a {@link SessionTransitionEvent}.
 */
@Service
@Slf4j
public class SessionStateMachine {

    private final CredentialStore credentialStore;
    private final CredentialVerifier credentialVerifier;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final ReentrantLock transitionLock = new ReentrantLock(true);

    private volatile SessionState state = SessionState.LOCKED;
    private boolean initialized;

    public SessionStateMachine(CredentialStore credentialStore, CredentialVerifier credentialVerifier,
            SpringEventBus eventBus, Clock clock) {
        this.credentialStore = credentialStore;
        this.credentialVerifier = credentialVerifier;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        transitionLock.lock();
        try {
            ensureInitialized();
        } finally {
            transitionLock.unlock();
        }
    }

    public SessionState getState() {
        return state;
    }

    public boolean isUnlocked() {
        return state == SessionState.UNLOCKED;
    }

    /**
     * Attempt to unlock with the master password. Runs to completion even when
     * lock requests arrive meanwhile.
     */
    public VerificationResult login(CharSequence password) {
        transitionLock.lock();
        try {
            ensureInitialized();
            if (state == SessionState.UNLOCKED) {
                log.debug("[Session] Login ignored, session already unlocked");
                return VerificationResult.success();
            }

            VerificationResult result = credentialVerifier.verify(password, CredentialKind.PASSWORD);
            switch (result.outcome()) {
                case SUCCESS, NO_CREDENTIAL_SET -> transition(SessionState.UNLOCKED, TransitionCause.LOGIN_SUCCESS,
                        result.outcome().name());
                case INVALID_CREDENTIAL -> transition(SessionState.LOCKED,
                        result.triggeredLockout() ? TransitionCause.LOCKOUT : TransitionCause.LOGIN_FAILURE,
                        result.outcome().name());
                case LOCKED_OUT -> transition(SessionState.LOCKED, TransitionCause.LOCKOUT, result.outcome().name());
                case CORRUPT_STORE -> transition(SessionState.LOCKED, TransitionCause.LOGIN_FAILURE,
                        result.outcome().name());
                default -> throw new IllegalStateException("Unexpected outcome: " + result.outcome());
            }
            return result;
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Entry point of the lock request channel. Idle monitor, OS session bridge
     * and manual logout all end up here.
     */
    @EventListener
    public void onLockRequest(LockRequest request) {
        lock(request);
    }

    public void lock(LockRequest request) {
        transitionLock.lock();
        try {
            ensureInitialized();
            if (state == SessionState.LOCKED) {
                log.debug("[Session] Lock request from {} ignored, already locked", request.source());
                return;
            }
            transition(SessionState.LOCKED, request.source().getCause(), request.detail());
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Lock after the user confirmed a logout.
     */
    public void manualLogout() {
        lock(new LockRequest(LockSource.MANUAL_LOGOUT, "user logout", clock.instant()));
    }

    private void ensureInitialized() {
        if (initialized) {
            return;
        }
        SessionState initial = SessionState.LOCKED;
        try {
            if (!credentialStore.snapshot().isProtectionEnabled()) {
                initial = SessionState.UNLOCKED;
            }
        } catch (CorruptStoreException e) {
            log.error("[Session] Credential store is corrupt, staying locked: {}", e.getMessage());
        }
        state = initial;
        initialized = true;
        log.info("[Session] Initial state: {}", initial);
    }

    private void transition(SessionState next, TransitionCause cause, String detail) {
        SessionState previous = state;
        state = next;
        if (previous != next) {
            log.info("[Session] {} -> {} ({})", previous, next, cause);
        } else {
            log.debug("[Session] Stayed {} ({})", next, cause);
        }
        eventBus.publish(new SessionTransitionEvent(previous, next, cause, detail, clock.instant()));
    }
}
