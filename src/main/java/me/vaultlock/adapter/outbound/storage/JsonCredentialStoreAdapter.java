package me.vaultlock.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.exception.CredentialStoreException;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.port.outbound.CredentialStorePort;
import me.vaultlock.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Stores the authentication settings row as {@code auth/auth-settings.json}
 * through {@link StoragePort}. Writes go through
 * {@link StoragePort#putTextAtomic} with a backup copy, and block until the
 * data is on disk.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonCredentialStoreAdapter implements CredentialStorePort {

    static final String AUTH_DIR = "auth";
    static final String SETTINGS_FILE = "auth-settings.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<AuthSettings> load() {
        String json;
        try {
            json = storagePort.getText(AUTH_DIR, SETTINGS_FILE).join();
        } catch (CompletionException e) {
            throw new CorruptStoreException("Authentication settings are unreadable", e.getCause());
        }
        if (json == null) {
            return Optional.empty();
        }
        if (json.isBlank()) {
            throw new CorruptStoreException("Authentication settings file is empty");
        }
        try {
            AuthSettings settings = objectMapper.readValue(json, AuthSettings.class);
            if (settings == null) {
                throw new CorruptStoreException("Authentication settings file holds no record");
            }
            return Optional.of(settings);
        } catch (JsonProcessingException e) {
            throw new CorruptStoreException("Authentication settings are malformed", e);
        }
    }

    @Override
    public void save(AuthSettings settings) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
            storagePort.putTextAtomic(AUTH_DIR, SETTINGS_FILE, json, true).join();
        } catch (JsonProcessingException e) {
            throw new CredentialStoreException("Failed to serialize authentication settings", e);
        } catch (CompletionException e) {
            throw new CredentialStoreException("Failed to persist authentication settings", e.getCause());
        }
    }
}
