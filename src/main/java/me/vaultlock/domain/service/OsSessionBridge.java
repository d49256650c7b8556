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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.model.HostSessionEvent;
import me.vaultlock.domain.model.LockRequest;
import me.vaultlock.domain.model.LockSource;
import me.vaultlock.infrastructure.event.SpringEventBus;
import me.vaultlock.port.inbound.HostSessionEventListener;
import me.vaultlock.port.inbound.HostSessionEventSource;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns host session notifications into lock requests.
 *
 * <p>
 * The callback never verifies anything: it reads one flag and publishes a
 * {@link LockRequest}. Sources that report themselves unavailable are skipped;
 * with none running the session is only locked by the idle monitor or a
 * manual logout.
 */
@Service
@Slf4j
public class OsSessionBridge implements HostSessionEventListener {

    private final List<HostSessionEventSource> sources;
    private final CredentialStore credentialStore;
    private final SpringEventBus eventBus;
    private final List<HostSessionEventSource> started = new ArrayList<>();

    public OsSessionBridge(List<HostSessionEventSource> sources, CredentialStore credentialStore,
            SpringEventBus eventBus) {
        this.sources = sources;
        this.credentialStore = credentialStore;
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void init() {
        for (HostSessionEventSource source : sources) {
            if (!source.isAvailable()) {
                log.info("[OsBridge] Source '{}' not available on this host", source.getName());
                continue;
            }
            try {
                source.start(this);
                started.add(source);
                log.info("[OsBridge] Listening to '{}'", source.getName());
            } catch (RuntimeException e) {
                log.warn("[OsBridge] Failed to start source '{}': {}", source.getName(), e.getMessage());
            }
        }
        if (started.isEmpty()) {
            log.info("[OsBridge] No host session source active, relying on idle monitor and manual lock");
        }
    }

    @PreDestroy
    public void shutdown() {
        for (HostSessionEventSource source : started) {
            source.stop();
        }
        started.clear();
    }

    @Override
    public void onHostSessionEvent(HostSessionEvent event) {
        if (!isIntegrationEnabled()) {
            log.debug("[OsBridge] Ignoring {} from {}, OS integration disabled", event.kind(), event.sourceName());
            return;
        }
        log.info("[OsBridge] {} from {}, requesting lock", event.kind(), event.sourceName());
        eventBus.publish(new LockRequest(LockSource.OS_EVENT, event.kind().name(), event.receivedAt()));
    }

    public List<String> getActiveSources() {
        List<String> names = new ArrayList<>();
        for (HostSessionEventSource source : started) {
            names.add(source.getName());
        }
        return names;
    }

    private boolean isIntegrationEnabled() {
        try {
            return credentialStore.snapshot().isOsLockIntegrationEnabled();
        } catch (CorruptStoreException e) {
            return true;
        }
    }
}
