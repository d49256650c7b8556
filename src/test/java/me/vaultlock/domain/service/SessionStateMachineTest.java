package me.vaultlock.domain.service;

import me.vaultlock.domain.exception.CorruptStoreException;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.domain.model.CredentialKind;
import me.vaultlock.domain.model.LockRequest;
import me.vaultlock.domain.model.LockSource;
import me.vaultlock.domain.model.SessionState;
import me.vaultlock.domain.model.SessionTransitionEvent;
import me.vaultlock.domain.model.TransitionCause;
import me.vaultlock.domain.model.VerificationOutcome;
import me.vaultlock.domain.model.VerificationResult;
import me.vaultlock.infrastructure.config.VaultLockProperties;
import me.vaultlock.infrastructure.event.SpringEventBus;
import me.vaultlock.testsupport.InMemoryCredentialStorePort;
import me.vaultlock.testsupport.MutableClock;
import me.vaultlock.testsupport.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String PASSWORD = "correct horse";

    private VaultLockProperties properties;
    private InMemoryCredentialStorePort port;
    private MutableClock clock;
    private PasswordHashingService hashingService;
    private List<Object> events;
    private SpringEventBus eventBus;

    @BeforeEach
    void setUp() {
        properties = TestProperties.create();
        port = new InMemoryCredentialStorePort();
        clock = new MutableClock(NOW);
        hashingService = new PasswordHashingService(properties);
        events = new CopyOnWriteArrayList<>();
        eventBus = mock(SpringEventBus.class);
        doAnswer(invocation -> events.add(invocation.getArgument(0))).when(eventBus).publish(any());
    }

    @Test
    void shouldStartLockedWhenPasswordIsSet() {
        protect();

        SessionStateMachine machine = newMachine();

        assertEquals(SessionState.LOCKED, machine.getState());
        assertFalse(machine.isUnlocked());
    }

    @Test
    void shouldStayLockedUntilInitializedEvenWithoutPassword() {
        SessionStateMachine machine = new SessionStateMachine(storeFor(port), mock(CredentialVerifier.class),
                eventBus, clock);

        assertEquals(SessionState.LOCKED, machine.getState());

        machine.init();

        assertEquals(SessionState.UNLOCKED, machine.getState());
    }

    @Test
    void shouldStayLockedWhenStoreIsCorrupt() {
        port.failLoadWith(new CorruptStoreException("malformed"));
        SessionStateMachine machine = newMachine();

        VerificationResult result = machine.login(PASSWORD);

        assertEquals(VerificationOutcome.CORRUPT_STORE, result.outcome());
        assertEquals(SessionState.LOCKED, machine.getState());
        assertEquals(TransitionCause.LOGIN_FAILURE, lastTransition().cause());
    }

    @Test
    void shouldUnlockWithCorrectPassword() {
        protect();
        SessionStateMachine machine = newMachine();

        VerificationResult result = machine.login(PASSWORD);

        assertEquals(VerificationOutcome.SUCCESS, result.outcome());
        assertEquals(SessionState.UNLOCKED, machine.getState());
        SessionTransitionEvent event = lastTransition();
        assertTrue(event.isUnlock());
        assertEquals(TransitionCause.LOGIN_SUCCESS, event.cause());
    }

    @Test
    void shouldPublishFailureWithoutChangingState() {
        protect();
        SessionStateMachine machine = newMachine();

        machine.login("wrong");

        SessionTransitionEvent event = lastTransition();
        assertEquals(SessionState.LOCKED, event.previous());
        assertEquals(SessionState.LOCKED, event.current());
        assertEquals(TransitionCause.LOGIN_FAILURE, event.cause());
    }

    @Test
    void shouldLockOutAfterFiveWrongPasswordsAndRecoverAfterWindow() {
        protect();
        SessionStateMachine machine = newMachine();

        for (String attempt : List.of("a", "b", "c", "d", "e")) {
            assertEquals(VerificationOutcome.INVALID_CREDENTIAL, machine.login(attempt).outcome());
        }
        assertEquals(TransitionCause.LOCKOUT, lastTransition().cause());

        assertEquals(VerificationOutcome.LOCKED_OUT, machine.login("f").outcome());
        assertEquals(VerificationOutcome.LOCKED_OUT, machine.login(PASSWORD).outcome());
        assertEquals(SessionState.LOCKED, machine.getState());

        clock.advance(Duration.ofMinutes(15));

        assertEquals(VerificationOutcome.SUCCESS, machine.login(PASSWORD).outcome());
        assertEquals(SessionState.UNLOCKED, machine.getState());
        assertEquals(0, port.getStored().getFailedAttempts());
    }

    @Test
    void shouldKeepLockoutAcrossRestart() {
        protect();
        SessionStateMachine first = newMachine();
        for (int i = 0; i < 5; i++) {
            first.login("wrong" + i);
        }

        SessionStateMachine restarted = newMachine();
        clock.advance(Duration.ofMinutes(3));

        VerificationResult result = restarted.login(PASSWORD);

        assertEquals(VerificationOutcome.LOCKED_OUT, result.outcome());
        assertEquals(Duration.ofMinutes(12), result.retryAfter());
        assertEquals(SessionState.LOCKED, restarted.getState());
    }

    @Test
    void shouldLockOnRequestFromAnySource() {
        protect();
        SessionStateMachine machine = newMachine();

        for (LockSource source : LockSource.values()) {
            machine.login(PASSWORD);
            machine.onLockRequest(new LockRequest(source, "test", clock.instant()));

            assertEquals(SessionState.LOCKED, machine.getState());
            assertEquals(source.getCause(), lastTransition().cause());
        }
    }

    @Test
    void shouldIgnoreLockRequestWhenAlreadyLocked() {
        protect();
        SessionStateMachine machine = newMachine();
        int before = events.size();

        machine.lock(new LockRequest(LockSource.OS_EVENT, "SCREEN_LOCKED", clock.instant()));
        machine.manualLogout();

        assertEquals(before, events.size());
        assertEquals(SessionState.LOCKED, machine.getState());
    }

    @Test
    void shouldNotReverifyWhenAlreadyUnlocked() {
        protect();
        SessionStateMachine machine = newMachine();
        machine.login(PASSWORD);

        VerificationResult result = machine.login("wrong");

        assertEquals(VerificationOutcome.SUCCESS, result.outcome());
        assertEquals(0, port.getStored().getFailedAttempts());
    }

    @Test
    void shouldApplyLockRequestArrivingDuringLoginAfterLoginResolves() throws Exception {
        protect();
        CredentialVerifier slowVerifier = mock(CredentialVerifier.class);
        CountDownLatch verifying = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(slowVerifier.verify(any(), eq(CredentialKind.PASSWORD))).thenAnswer(invocation -> {
            verifying.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return VerificationResult.success();
        });
        SessionStateMachine machine = new SessionStateMachine(storeFor(port), slowVerifier, eventBus, clock);
        machine.init();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<VerificationResult> login = executor.submit(() -> machine.login(PASSWORD));
            assertTrue(verifying.await(5, TimeUnit.SECONDS));

            Future<?> lock = executor.submit(() -> machine.onLockRequest(
                    new LockRequest(LockSource.OS_EVENT, "SCREEN_LOCKED", clock.instant())));
            Thread.sleep(100);
            assertFalse(lock.isDone());
            assertTrue(transitions().isEmpty());

            release.countDown();
            assertEquals(VerificationOutcome.SUCCESS, login.get(5, TimeUnit.SECONDS).outcome());
            lock.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        List<TransitionCause> causes = transitions().stream()
                .map(SessionTransitionEvent::cause)
                .collect(Collectors.toList());
        assertEquals(List.of(TransitionCause.LOGIN_SUCCESS, TransitionCause.OS_EVENT), causes);
        assertEquals(SessionState.LOCKED, machine.getState());
    }

    private void protect() {
        port.setStored(AuthSettings.builder()
                .passwordHash(hashingService.hash(PASSWORD))
                .recoveryKeyHash(hashingService.hash("AAAA-BBBB-CCCC-DDDD"))
                .build());
    }

    private CredentialStore storeFor(InMemoryCredentialStorePort storePort) {
        return new CredentialStore(storePort, properties, clock);
    }

    private SessionStateMachine newMachine() {
        CredentialStore store = storeFor(port);
        LockoutPolicy lockoutPolicy = new LockoutPolicy(store, properties);
        CredentialVerifier verifier = new CredentialVerifier(store, lockoutPolicy, hashingService,
                new RecoveryKeyService(hashingService), clock);
        SessionStateMachine machine = new SessionStateMachine(store, verifier, eventBus, clock);
        machine.init();
        return machine;
    }

    private List<SessionTransitionEvent> transitions() {
        return events.stream()
                .filter(SessionTransitionEvent.class::isInstance)
                .map(SessionTransitionEvent.class::cast)
                .collect(Collectors.toList());
    }

    private SessionTransitionEvent lastTransition() {
        List<SessionTransitionEvent> transitions = transitions();
        return transitions.get(transitions.size() - 1);
    }
}
