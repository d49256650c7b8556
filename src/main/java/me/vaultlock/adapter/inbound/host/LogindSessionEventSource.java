package me.vaultlock.adapter.inbound.host;

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
import me.vaultlock.domain.model.HostSessionEvent;
import me.vaultlock.domain.model.HostSessionEventKind;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import me.vaultlock.port.inbound.HostSessionEventListener;
import me.vaultlock.port.inbound.HostSessionEventSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Host session events from systemd-logind, read from a {@code gdbus monitor}
 * child process.
 *
 * <p>
 * Recognized signals:
 * <ul>
 * <li>{@code Session.Lock} on our session - SCREEN_LOCKED</li>
 * <li>{@code Manager.PrepareForSleep (true,)} - SLEEP_OR_HIBERNATE</li>
 * <li>{@code PropertiesChanged} with {@code 'Active': <false>} on our session -
 * USER_SWITCHED</li>
 * <li>{@code Manager.SessionRemoved} for our session - LOGGED_OFF</li>
 * </ul>
 * Without {@code XDG_SESSION_ID} every session's signals are taken.
 */
@Component
@Slf4j
public class LogindSessionEventSource implements HostSessionEventSource {

    static final String NAME = "logind";
    private static final String SESSION_PATH_PREFIX = "/org/freedesktop/login1/session/";
    private static final Path SYSTEMD_RUNTIME_DIR = Path.of("/run/systemd/system");

    private final VaultLockProperties.LogindProperties logindProperties;
    private final Clock clock;
    private final String sessionPath;

    private volatile boolean running;
    private Process process;
    private Thread readerThread;

    @Autowired
    public LogindSessionEventSource(VaultLockProperties properties, Clock clock) {
        this(properties, clock, System.getenv("XDG_SESSION_ID"));
    }

    LogindSessionEventSource(VaultLockProperties properties, Clock clock, String sessionId) {
        this.logindProperties = properties.getOsBridge().getLogind();
        this.clock = clock;
        this.sessionPath = sessionId == null || sessionId.isBlank()
                ? null
                : SESSION_PATH_PREFIX + escapeObjectPathLabel(sessionId);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        if (!logindProperties.isEnabled()) {
            return false;
        }
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("linux") && Files.isDirectory(SYSTEMD_RUNTIME_DIR);
    }

    @Override
    public synchronized void start(HostSessionEventListener listener) {
        if (running) {
            return;
        }
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", logindProperties.getCommand());
        pb.redirectErrorStream(true);
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start logind monitor", e);
        }
        running = true;

        Process p = process;
        readerThread = new Thread(() -> readLoop(p, listener), "logind-monitor");
        readerThread.setDaemon(true);
        readerThread.start();
        log.info("[Logind] Monitoring {}", sessionPath != null ? sessionPath : "all sessions");
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
        process = null;
    }

    private void readLoop(Process p, HostSessionEventListener listener) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                HostSessionEventKind kind = parse(line, sessionPath);
                if (kind != null) {
                    listener.onHostSessionEvent(new HostSessionEvent(kind, NAME, clock.instant()));
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[Logind] Monitor stream failed: {}", e.getMessage());
            }
        }
        if (running) {
            log.warn("[Logind] Monitor process exited, OS session events no longer received");
        }
    }

    /**
     * Map one line of {@code gdbus monitor} output to an event kind.
     *
     * @param ownSessionPath
     *            object path of our session, or null to accept any session
     * @return the kind, or null when the line is not relevant
     */
    static HostSessionEventKind parse(String line, String ownSessionPath) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        int colon = trimmed.indexOf(": ");
        if (colon <= 0) {
            return null;
        }
        String path = trimmed.substring(0, colon);
        String signal = trimmed.substring(colon + 2);

        if (signal.startsWith("org.freedesktop.login1.Manager.PrepareForSleep")) {
            return signal.contains("(true,") ? HostSessionEventKind.SLEEP_OR_HIBERNATE : null;
        }
        if (signal.startsWith("org.freedesktop.login1.Manager.SessionRemoved")) {
            return ownSessionPath == null || signal.contains("'" + ownSessionPath + "'")
                    ? HostSessionEventKind.LOGGED_OFF
                    : null;
        }
        if (!isSessionPath(path, ownSessionPath)) {
            return null;
        }
        if (signal.startsWith("org.freedesktop.login1.Session.Lock ")
                || signal.equals("org.freedesktop.login1.Session.Lock")) {
            return HostSessionEventKind.SCREEN_LOCKED;
        }
        if (signal.startsWith("org.freedesktop.DBus.Properties.PropertiesChanged")
                && signal.contains("'org.freedesktop.login1.Session'")
                && signal.contains("'Active': <false>")) {
            return HostSessionEventKind.USER_SWITCHED;
        }
        return null;
    }

    private static boolean isSessionPath(String path, String ownSessionPath) {
        if (ownSessionPath != null) {
            return ownSessionPath.equals(path);
        }
        return path.startsWith(SESSION_PATH_PREFIX);
    }

    /**
     * D-Bus object path label escaping as done by sd-bus: a leading digit and
     * anything outside {@code [A-Za-z0-9]} become {@code _xx}.
     */
    static String escapeObjectPathLabel(String label) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
            boolean digit = c >= '0' && c <= '9';
            if (letter || (digit && i > 0)) {
                sb.append(c);
            } else {
                sb.append('_').append(String.format("%02x", (int) c & 0xff));
            }
        }
        return sb.toString();
    }
}
