package me.vaultlock.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.vaultlock.adapter.inbound.web.SessionEventStream;
import me.vaultlock.adapter.inbound.web.VerificationResponses;
import me.vaultlock.adapter.inbound.web.dto.LoginRequest;
import me.vaultlock.adapter.inbound.web.dto.SessionEventDto;
import me.vaultlock.adapter.inbound.web.dto.SessionStateResponse;
import me.vaultlock.adapter.inbound.web.dto.VerificationResponse;
import me.vaultlock.auto.IdleMonitor;
import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.model.LockoutStatus;
import me.vaultlock.domain.service.CredentialService;
import me.vaultlock.domain.service.LockoutPolicy;
import me.vaultlock.domain.service.SessionStateMachine;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Session state, login, logout and activity signals for the hosting UI.
 */
@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionStateMachine sessionStateMachine;
    private final CredentialService credentialService;
    private final LockoutPolicy lockoutPolicy;
    private final IdleMonitor idleMonitor;
    private final SessionEventStream sessionEventStream;
    private final Clock clock;

    @GetMapping
    public Mono<ResponseEntity<SessionStateResponse>> getSession() {
        return Mono.just(ResponseEntity.ok(buildState()));
    }

    @PostMapping("/login")
    public Mono<ResponseEntity<VerificationResponse>> login(@RequestBody LoginRequest request) {
        return Mono.fromCallable(() -> sessionStateMachine.login(request.getPassword()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(VerificationResponses::toResponse);
    }

    @PostMapping("/logout")
    public Mono<ResponseEntity<SessionStateResponse>> logout() {
        sessionStateMachine.manualLogout();
        return Mono.just(ResponseEntity.ok(buildState()));
    }

    @PostMapping("/activity")
    public Mono<ResponseEntity<Void>> activity() {
        idleMonitor.recordActivity();
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SessionEventDto>> events() {
        return sessionEventStream.stream()
                .map(event -> ServerSentEvent.<SessionEventDto>builder()
                        .event("session")
                        .data(event)
                        .build());
    }

    private SessionStateResponse buildState() {
        SessionStateResponse.SessionStateResponseBuilder builder = SessionStateResponse.builder()
                .state(sessionStateMachine.getState().name())
                .lastActivityAt(idleMonitor.getLastActivityAt());
        try {
            LockoutStatus lockout = lockoutPolicy.check(clock.instant());
            builder.protectionEnabled(credentialService.isProtectionEnabled())
                    .lockedOut(lockout.lockedOut())
                    .lockoutUntil(lockout.lockoutUntil());
        } catch (CorruptStoreException e) {
            builder.protectionEnabled(true);
        }
        return builder.build();
    }
}
