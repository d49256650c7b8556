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
 * A freshly generated recovery key: the plaintext, shown to the user exactly
 * once, and the hash that gets persisted. {@link #toString()} never includes
 * the plaintext.
 */
public record IssuedRecoveryKey(String plaintext, String hash) {

    @Override
    public String toString() {
        return "IssuedRecoveryKey[plaintext=****-****-****-****]";
    }
}
