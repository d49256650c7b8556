package me.vaultlock.auto;

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
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.domain.model.LockRequest;
import me.vaultlock.domain.model.LockSource;
import me.vaultlock.domain.model.SessionTransitionEvent;
import me.vaultlock.domain.service.CredentialStore;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import me.vaultlock.infrastructure.event.SpringEventBus;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Locks the session after a period without user activity.
 *
 * <p>
 * Activity signals only move {@code lastActivityAt}; the periodic check
 * compares it against the stored timeout and publishes a single
 * {@link LockRequest} per idle period. Turning auto-lock off stops the checks
 * from firing but keeps the last activity time, so turning it back on measures
 * idleness from the real last activity.
 */
@Component
@Slf4j
public class IdleMonitor {

    private final CredentialStore credentialStore;
    private final SpringEventBus eventBus;
    private final VaultLockProperties properties;
    private final Clock clock;
    private final AtomicReference<Instant> lastActivityAt;
    private final AtomicBoolean lockRequested = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> checkTask;

    public IdleMonitor(CredentialStore credentialStore, SpringEventBus eventBus, VaultLockProperties properties,
            Clock clock) {
        this.credentialStore = credentialStore;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
        this.lastActivityAt = new AtomicReference<>(clock.instant());
    }

    @PostConstruct
    public void init() {
        Duration interval = properties.getAutoLock().getCheckInterval();
        long intervalMillis = Math.max(1000L, interval.toMillis());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "idle-monitor");
            t.setDaemon(true);
            return t;
        });
        checkTask = scheduler.scheduleAtFixedRate(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[IdleMonitor] Started with check interval: {}ms", intervalMillis);
    }

    @PreDestroy
    public void shutdown() {
        if (checkTask != null) {
            checkTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[IdleMonitor] Shut down");
    }

    public void recordActivity() {
        lastActivityAt.set(clock.instant());
        lockRequested.set(false);
    }

    public Instant getLastActivityAt() {
        return lastActivityAt.get();
    }

    @EventListener
    public void onTransition(SessionTransitionEvent event) {
        if (event.isUnlock()) {
            recordActivity();
        }
    }

    /**
     * Run one idle check.
     *
     * @return whether a lock request was published
     */
    public boolean check() {
        AuthSettings settings;
        try {
            settings = credentialStore.snapshot();
        } catch (CorruptStoreException e) {
            log.debug("[IdleMonitor] Skipping check, credential store unavailable");
            return false;
        }
        if (!settings.isAutoLockEnabled() || !settings.isProtectionEnabled()) {
            return false;
        }

        Instant now = clock.instant();
        Duration idle = Duration.between(lastActivityAt.get(), now);
        if (idle.getSeconds() < settings.getAutoLockTimeoutSeconds()) {
            return false;
        }
        if (!lockRequested.compareAndSet(false, true)) {
            return false;
        }
        log.info("[IdleMonitor] Idle for {}s (timeout {}s), requesting lock", idle.getSeconds(),
                settings.getAutoLockTimeoutSeconds());
        eventBus.publish(new LockRequest(LockSource.IDLE_TIMEOUT, "idle " + idle.getSeconds() + "s", now));
        return true;
    }

    private void tick() {
        try {
            check();
        } catch (Exception e) { // NOSONAR - keep the scheduler alive
            log.error("[IdleMonitor] Check failed", e);
        }
    }
}
