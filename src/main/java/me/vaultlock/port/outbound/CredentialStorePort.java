package me.vaultlock.port.outbound;

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

import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.exception.CredentialStoreException;
import me.vaultlock.domain.model.AuthSettings;

import java.util.Optional;

/**
 * Narrow persistence boundary for the single {@link AuthSettings} row. Both
 * calls are durable before they return.
 */
public interface CredentialStorePort {

    /**
     * Load the stored row.
     *
     * @return empty when nothing was ever stored
     * @throws CorruptStoreException
     *             if the row exists but cannot be read or parsed
     */
    Optional<AuthSettings> load();

    /**
     * Replace the stored row.
     *
     * @throws CredentialStoreException
     *             if the write did not reach the disk
     */
    void save(AuthSettings settings);
}
