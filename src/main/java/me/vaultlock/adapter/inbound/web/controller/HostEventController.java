package me.vaultlock.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.vaultlock.adapter.inbound.host.PushedSessionEventSource;
import me.vaultlock.adapter.inbound.web.dto.HostEventRequest;
import me.vaultlock.domain.model.HostSessionEventKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Receives session notifications from host helper processes.
 */
@RestController
@RequestMapping("/api/host-events")
@RequiredArgsConstructor
public class HostEventController {

    private final PushedSessionEventSource pushedSessionEventSource;

    @PostMapping
    public Mono<ResponseEntity<Void>> push(@RequestBody HostEventRequest request) {
        HostSessionEventKind kind = parseKind(request.getKind());
        if (!pushedSessionEventSource.push(kind)) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Host event source not started");
        }
        return Mono.just(ResponseEntity.accepted().build());
    }

    private HostSessionEventKind parseKind(String kind) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Event kind is required");
        }
        try {
            return HostSessionEventKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event kind: " + kind, e);
        }
    }
}
