package me.vaultlock.adapter.inbound.web.security;

import me.vaultlock.domain.service.SessionStateMachine;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Answers 423 Locked with an empty body for API calls while the session is
 * locked. Only the endpoints needed to unlock, recover or report host events
 * stay reachable.
 */
public class SessionLockWebFilter implements WebFilter {

    static final List<String> OPEN_PREFIXES = List.of(
            "/api/session",
            "/api/credentials/recovery/",
            "/api/password-strength",
            "/api/host-events");

    private final SessionStateMachine sessionStateMachine;

    public SessionLockWebFilter(SessionStateMachine sessionStateMachine) {
        this.sessionStateMachine = sessionStateMachine;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!path.startsWith("/api/") || isOpen(path) || sessionStateMachine.isUnlocked()) {
            return chain.filter(exchange);
        }
        exchange.getResponse().setStatusCode(HttpStatus.LOCKED);
        return exchange.getResponse().setComplete();
    }

    static boolean isOpen(String path) {
        for (String prefix : OPEN_PREFIXES) {
            if (path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
                return true;
            }
        }
        return false;
    }
}
