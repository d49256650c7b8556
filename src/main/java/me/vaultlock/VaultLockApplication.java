package me.vaultlock;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for VaultLock.
 *
 * <p>
 * VaultLock gates a local application's data behind a single master password.
 * It owns credential storage and verification, recovery keys, a persistent
 * brute-force lockout, idle auto-lock and locking on host session events.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → local HTTP API, host session event sources
 * Domain Layer       → SessionStateMachine, LockoutPolicy, RecoveryService, IdleMonitor
 * Infrastructure     → Storage/Audit adapters, Spring event bus
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code vaultlock.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VaultLockApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultLockApplication.class, args);
    }

}
