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

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a guarded verification.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code outcome} - what happened</li>
 * <li>{@code remainingAttempts} - failures left before a lockout, when the
 * outcome is {@link VerificationOutcome#INVALID_CREDENTIAL}</li>
 * <li>{@code lockoutUntil} - end of the active lockout window, if any</li>
 * <li>{@code retryAfter} - how long until the next attempt is evaluated</li>
 * </ul>
 *
 * <p>
 * The result never says which credential kind was wrong.
 */
public record VerificationResult(VerificationOutcome outcome, int remainingAttempts, Instant lockoutUntil,
        Duration retryAfter) {

    public static VerificationResult success() {
        return new VerificationResult(VerificationOutcome.SUCCESS, 0, null, Duration.ZERO);
    }

    public static VerificationResult noCredentialSet() {
        return new VerificationResult(VerificationOutcome.NO_CREDENTIAL_SET, 0, null, Duration.ZERO);
    }

    public static VerificationResult invalid(LockoutDecision decision, Instant now) {
        Duration retryAfter = decision.lockoutUntil() != null
                ? Duration.between(now, decision.lockoutUntil())
                : Duration.ZERO;
        return new VerificationResult(VerificationOutcome.INVALID_CREDENTIAL, decision.remainingAttempts(),
                decision.lockoutUntil(), retryAfter);
    }

    public static VerificationResult lockedOut(LockoutStatus status) {
        return new VerificationResult(VerificationOutcome.LOCKED_OUT, 0, status.lockoutUntil(), status.remaining());
    }

    public static VerificationResult corruptStore() {
        return new VerificationResult(VerificationOutcome.CORRUPT_STORE, 0, null, Duration.ZERO);
    }

    public boolean isGranted() {
        return outcome == VerificationOutcome.SUCCESS || outcome == VerificationOutcome.NO_CREDENTIAL_SET;
    }

    /**
     * Whether this failed attempt started a new lockout window.
     */
    public boolean triggeredLockout() {
        return outcome == VerificationOutcome.INVALID_CREDENTIAL && lockoutUntil != null;
    }
}
