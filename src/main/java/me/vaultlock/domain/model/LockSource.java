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

/**
 * Producers of lock requests. Every source is unconditional: a lock request
 * from any of them moves an unlocked session to {@link SessionState#LOCKED}.
 */
public enum LockSource {

    IDLE_TIMEOUT(TransitionCause.IDLE_TIMEOUT),
    OS_EVENT(TransitionCause.OS_EVENT),
    MANUAL_LOGOUT(TransitionCause.MANUAL_LOGOUT);

    private final TransitionCause cause;

    LockSource(TransitionCause cause) {
        this.cause = cause;
    }

    public TransitionCause getCause() {
        return cause;
    }
}
