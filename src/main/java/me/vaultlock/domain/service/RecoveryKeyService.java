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
import me.vaultlock.domain.model.IssuedRecoveryKey;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * Generates and checks recovery keys.
 *
 * <p>
 * A key is 16 symbols from a 32-symbol alphabet without the look-alikes
 * {@code O}, {@code I}, {@code 0} and {@code 1}, grouped as
 * {@code XXXX-XXXX-XXXX-XXXX}: 2^80 combinations. Only the hash is ever
 * stored.
 */
@Service
@RequiredArgsConstructor
public class RecoveryKeyService {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int GROUP_COUNT = 4;
    static final int GROUP_LENGTH = 4;
    private static final int KEY_SYMBOLS = GROUP_COUNT * GROUP_LENGTH;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final PasswordHashingService hashingService;

    /**
     * Generate a new key. The plaintext in the result must be shown to the user
     * once and then dropped.
     */
    public IssuedRecoveryKey issue() {
        String plaintext = generate();
        return new IssuedRecoveryKey(plaintext, hashingService.hash(plaintext));
    }

    public boolean redeem(CharSequence candidate, String storedHash) {
        if (candidate == null) {
            return false;
        }
        return hashingService.verify(normalize(candidate), storedHash);
    }

    /**
     * Canonical form of user input: upper case, no whitespace, hyphens between
     * groups. Input that does not have exactly 16 symbols is returned stripped
     * and upper-cased, and simply fails verification.
     */
    static String normalize(CharSequence candidate) {
        StringBuilder symbols = new StringBuilder(KEY_SYMBOLS);
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (!Character.isWhitespace(c) && c != '-') {
                symbols.append(c);
            }
        }
        String stripped = symbols.toString().toUpperCase(Locale.ROOT);
        if (stripped.length() != KEY_SYMBOLS) {
            return stripped;
        }
        return group(stripped);
    }

    private static String generate() {
        StringBuilder sb = new StringBuilder(KEY_SYMBOLS);
        for (int i = 0; i < KEY_SYMBOLS; i++) {
            sb.append(ALPHABET.charAt(SECURE_RANDOM.nextInt(ALPHABET.length())));
        }
        return group(sb.toString());
    }

    private static String group(String symbols) {
        StringBuilder grouped = new StringBuilder(KEY_SYMBOLS + GROUP_COUNT - 1);
        for (int i = 0; i < symbols.length(); i++) {
            if (i > 0 && i % GROUP_LENGTH == 0) {
                grouped.append('-');
            }
            grouped.append(symbols.charAt(i));
        }
        return grouped.toString();
    }
}
