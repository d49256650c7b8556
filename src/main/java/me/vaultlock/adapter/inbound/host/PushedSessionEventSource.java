package me.vaultlock.adapter.inbound.host;

import lombok.extern.slf4j.Slf4j;
import me.vaultlock.domain.model.HostSessionEvent;
import me.vaultlock.domain.model.HostSessionEventKind;
import me.vaultlock.port.inbound.HostSessionEventListener;
import me.vaultlock.port.inbound.HostSessionEventSource;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Session events pushed by a host helper over the local HTTP API, for hosts
 * where no native source is implemented (Windows session notifications, macOS
 * distributed notifications, RDP disconnect hooks).
 */
@Component
@Slf4j
public class PushedSessionEventSource implements HostSessionEventSource {

    static final String NAME = "http-push";

    private final Clock clock;
    private volatile HostSessionEventListener listener;

    public PushedSessionEventSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void start(HostSessionEventListener listener) {
        this.listener = listener;
    }

    @Override
    public void stop() {
        this.listener = null;
    }

    /**
     * @return false when the source has not been started
     */
    public boolean push(HostSessionEventKind kind) {
        HostSessionEventListener current = listener;
        if (current == null) {
            log.warn("[HostPush] Dropping {}, source not started", kind);
            return false;
        }
        current.onHostSessionEvent(new HostSessionEvent(kind, NAME, clock.instant()));
        return true;
    }
}
