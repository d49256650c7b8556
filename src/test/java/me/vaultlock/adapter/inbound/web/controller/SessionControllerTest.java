package me.vaultlock.adapter.inbound.web.controller;

import me.vaultlock.adapter.inbound.web.SessionEventStream;
import me.vaultlock.adapter.inbound.web.dto.LoginRequest;
import me.vaultlock.adapter.inbound.web.dto.SessionEventDto;
import me.vaultlock.adapter.inbound.web.dto.SessionStateResponse;
import me.vaultlock.adapter.inbound.web.dto.VerificationResponse;
import me.vaultlock.auto.IdleMonitor;
import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.model.LockoutDecision;
import me.vaultlock.domain.model.LockoutStatus;
import me.vaultlock.domain.model.SessionState;
import me.vaultlock.domain.model.VerificationResult;
import me.vaultlock.domain.service.CredentialService;
import me.vaultlock.domain.service.LockoutPolicy;
import me.vaultlock.domain.service.SessionStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SessionStateMachine sessionStateMachine;
    private CredentialService credentialService;
    private LockoutPolicy lockoutPolicy;
    private IdleMonitor idleMonitor;
    private SessionEventStream sessionEventStream;
    private SessionController controller;

    @BeforeEach
    void setUp() {
        sessionStateMachine = mock(SessionStateMachine.class);
        credentialService = mock(CredentialService.class);
        lockoutPolicy = mock(LockoutPolicy.class);
        idleMonitor = mock(IdleMonitor.class);
        sessionEventStream = mock(SessionEventStream.class);
        when(sessionStateMachine.getState()).thenReturn(SessionState.LOCKED);
        when(credentialService.isProtectionEnabled()).thenReturn(true);
        when(lockoutPolicy.check(any())).thenReturn(LockoutStatus.open(0));
        when(idleMonitor.getLastActivityAt()).thenReturn(NOW);
        controller = new SessionController(sessionStateMachine, credentialService, lockoutPolicy, idleMonitor,
                sessionEventStream, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReturnSessionState() {
        StepVerifier.create(controller.getSession())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    SessionStateResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("LOCKED", body.getState());
                    assertTrue(body.isProtectionEnabled());
                    assertFalse(body.isLockedOut());
                    assertEquals(NOW, body.getLastActivityAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportLockoutInState() {
        Instant until = NOW.plus(Duration.ofMinutes(15));
        when(lockoutPolicy.check(any()))
                .thenReturn(new LockoutStatus(true, 5, until, Duration.ofMinutes(15)));

        StepVerifier.create(controller.getSession())
                .assertNext(response -> {
                    assertTrue(response.getBody().isLockedOut());
                    assertEquals(until, response.getBody().getLockoutUntil());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportLockedStateWhenStoreIsCorrupt() {
        when(lockoutPolicy.check(any())).thenThrow(new CorruptStoreException("malformed"));

        StepVerifier.create(controller.getSession())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("LOCKED", response.getBody().getState());
                    assertTrue(response.getBody().isProtectionEnabled());
                })
                .verifyComplete();
    }

    @Test
    void shouldLoginSuccessfully() {
        when(sessionStateMachine.login("correct horse")).thenReturn(VerificationResult.success());

        StepVerifier.create(controller.login(new LoginRequest("correct horse")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("SUCCESS", response.getBody().getOutcome());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturn401WithRemainingAttempts() {
        when(sessionStateMachine.login("wrong"))
                .thenReturn(VerificationResult.invalid(new LockoutDecision(2, 3, null), NOW));

        StepVerifier.create(controller.login(new LoginRequest("wrong")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
                    VerificationResponse body = response.getBody();
                    assertEquals("INVALID_CREDENTIAL", body.getOutcome());
                    assertEquals(3, body.getRemainingAttempts());
                    assertNull(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                })
                .verifyComplete();
    }

    @Test
    void shouldReturn429WithRetryAfterDuringLockout() {
        Instant until = NOW.plus(Duration.ofMinutes(15));
        when(sessionStateMachine.login("f")).thenReturn(VerificationResult.lockedOut(
                new LockoutStatus(true, 5, until, Duration.ofSeconds(899).plusMillis(500))));

        StepVerifier.create(controller.login(new LoginRequest("f")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
                    assertEquals("900", response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                    assertEquals(900, response.getBody().getRetryAfterSeconds());
                    assertEquals(until, response.getBody().getLockoutUntil());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturn503WhenStoreIsCorrupt() {
        when(sessionStateMachine.login("x")).thenReturn(VerificationResult.corruptStore());

        StepVerifier.create(controller.login(new LoginRequest("x")))
                .assertNext(response -> assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldLogout() {
        StepVerifier.create(controller.logout())
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();

        verify(sessionStateMachine).manualLogout();
    }

    @Test
    void shouldRecordActivity() {
        StepVerifier.create(controller.activity())
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();

        verify(idleMonitor).recordActivity();
    }

    @Test
    void shouldStreamSessionEvents() {
        SessionEventDto event = SessionEventDto.builder().state("UNLOCKED").cause("LOGIN_SUCCESS").build();
        when(sessionEventStream.stream()).thenReturn(Flux.just(event));

        StepVerifier.create(controller.events())
                .assertNext(sse -> {
                    assertEquals("session", sse.event());
                    assertEquals("UNLOCKED", sse.data().getState());
                })
                .verifyComplete();
    }
}
