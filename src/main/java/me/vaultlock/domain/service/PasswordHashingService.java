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
import me.vaultlock.infrastructure.config.VaultLockProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * One-way hashing of passwords and recovery keys with BCrypt.
 *
 * <p>
 * Every {@link #hash(CharSequence)} call draws a fresh random salt, so hashing
 * the same secret twice gives different digests. Work factor comes from
 * {@code vaultlock.auth.bcrypt-strength} (12 by default, 4096 rounds).
 * {@link #verify(CharSequence, String)} relies on the encoder's own
 * comparison and treats a malformed digest as a mismatch.
 */
@Service
@Slf4j
public class PasswordHashingService {

    private final PasswordEncoder passwordEncoder;

    public PasswordHashingService(VaultLockProperties properties) {
        this.passwordEncoder = new BCryptPasswordEncoder(properties.getAuth().getBcryptStrength());
    }

    public String hash(CharSequence secret) {
        Objects.requireNonNull(secret, "secret");
        return passwordEncoder.encode(secret);
    }

    public boolean verify(CharSequence secret, String digest) {
        if (secret == null || digest == null || digest.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(secret, digest);
        } catch (IllegalArgumentException e) {
            log.warn("[Hashing] Stored digest rejected: {}", e.getMessage());
            return false;
        }
    }
}
