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
import me.vaultlock.domain.exception.WeakPasswordException;
import me.vaultlock.domain.model.PasswordStrength;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Rules for new master passwords: a minimum length, the 72-byte BCrypt input
 * limit, and a coarse 0-4 strength score shown while the user types.
 */
@Component
@RequiredArgsConstructor
public class PasswordPolicy {

    static final int MAX_BYTES = 72;
    private static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
    private static final int LONG_PASSWORD_LENGTH = 12;

    private final VaultLockProperties properties;

    public PasswordStrength evaluate(String password) {
        int minLength = properties.getAuth().getMinPasswordLength();
        if (password == null || password.length() < minLength) {
            return new PasswordStrength(0, "Too short (minimum " + minLength + " characters)");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            return new PasswordStrength(0, "Too long (maximum " + MAX_BYTES + " bytes)");
        }

        // half points
        int points = password.length() >= LONG_PASSWORD_LENGTH ? 2 : 1;
        if (password.chars().anyMatch(Character::isLowerCase)) {
            points += 1;
        }
        if (password.chars().anyMatch(Character::isUpperCase)) {
            points += 1;
        }
        if (password.chars().anyMatch(Character::isDigit)) {
            points += 1;
        }
        if (password.chars().anyMatch(c -> PUNCTUATION.indexOf(c) >= 0)) {
            points += 2;
        }

        if (points >= 7) {
            return new PasswordStrength(4, "Very strong password");
        } else if (points >= 5) {
            return new PasswordStrength(3, "Strong password");
        } else if (points >= 3) {
            return new PasswordStrength(2, "Medium password");
        }
        return new PasswordStrength(1, "Weak password - add digits and special characters");
    }

    /**
     * @throws WeakPasswordException
     *             if the password scores 0
     */
    public void requireAcceptable(String password) {
        PasswordStrength strength = evaluate(password);
        if (!strength.isAcceptable()) {
            throw new WeakPasswordException(strength);
        }
    }
}
