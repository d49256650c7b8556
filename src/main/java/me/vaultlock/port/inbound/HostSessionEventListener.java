package me.vaultlock.port.inbound;

import me.vaultlock.domain.model.HostSessionEvent;

/**
 * Receiver of host session notifications. Called on the source's own thread
 * and must return quickly.
 */
@FunctionalInterface
public interface HostSessionEventListener {

    void onHostSessionEvent(HostSessionEvent event);
}
