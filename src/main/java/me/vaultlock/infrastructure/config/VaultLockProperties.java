package me.vaultlock.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the lock subsystem, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code vaultlock.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link AuthProperties} - hashing cost and lockout thresholds</li>
 * <li>{@link RecoveryProperties} - credential-reset ticket lifetime</li>
 * <li>{@link AutoLockProperties} - idle monitor cadence and defaults</li>
 * <li>{@link OsBridgeProperties} - host session event sources</li>
 * </ul>
 *
 * <p>
 * Auto-lock and OS integration values here only seed a fresh settings row.
 * Once the row has been persisted the stored values win.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "vaultlock")
@Data
public class VaultLockProperties {

    private StorageProperties storage = new StorageProperties();
    private AuthProperties auth = new AuthProperties();
    private RecoveryProperties recovery = new RecoveryProperties();
    private AutoLockProperties autoLock = new AutoLockProperties();
    private OsBridgeProperties osBridge = new OsBridgeProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.vaultlock/workspace";
    }

    @Data
    public static class AuthProperties {
        private int bcryptStrength = 12;
        private int maxFailedAttempts = 5;
        private Duration lockoutDuration = Duration.ofMinutes(15);
        private int minPasswordLength = 8;
    }

    @Data
    public static class RecoveryProperties {
        private Duration resetTicketTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class AutoLockProperties {
        private Duration checkInterval = Duration.ofSeconds(60);
        private boolean defaultEnabled = false;
        private int defaultTimeoutSeconds = 1800;
    }

    @Data
    public static class OsBridgeProperties {
        private boolean defaultEnabled = true;
        private LogindProperties logind = new LogindProperties();
    }

    @Data
    public static class LogindProperties {
        private boolean enabled = true;
        private String command = "gdbus monitor --system --dest org.freedesktop.login1";
    }
}
