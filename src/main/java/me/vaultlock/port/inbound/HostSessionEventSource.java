package me.vaultlock.port.inbound;

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
 * Capability "host session event source": a host-specific notification
 * mechanism that reports when the desktop session becomes inaccessible.
 *
 * <p>
 * Implementations only translate and forward notifications. They never lock
 * anything themselves and never verify secrets. A source that reports
 * {@link #isAvailable()} {@code false} is skipped; running without any source
 * is a supported configuration.
 */
public interface HostSessionEventSource {

    /**
     * Short identifier used in logs and audit records.
     */
    String getName();

    /**
     * Whether the mechanism exists on this host.
     */
    boolean isAvailable();

    /**
     * Start delivering events to the listener.
     */
    void start(HostSessionEventListener listener);

    /**
     * Stop delivering events. Safe to call when never started.
     */
    void stop();
}
