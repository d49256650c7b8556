package me.vaultlock.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.vaultlock.adapter.inbound.web.dto.SessionEventDto;
import me.vaultlock.domain.model.SessionTransitionEvent;
import me.vaultlock.domain.service.SessionStateMachine;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;

/**
 * Multicasts session transitions to connected UI clients. Each subscriber
 * first receives the current state.
 */
@Component
@Slf4j
public class SessionEventStream {

    private final SessionStateMachine sessionStateMachine;
    private final Clock clock;
    private final Sinks.Many<SessionEventDto> sink = Sinks.many().multicast().directBestEffort();

    public SessionEventStream(SessionStateMachine sessionStateMachine, Clock clock) {
        this.sessionStateMachine = sessionStateMachine;
        this.clock = clock;
    }

    @EventListener
    public void onTransition(SessionTransitionEvent event) {
        SessionEventDto dto = SessionEventDto.builder()
                .previousState(event.previous().name())
                .state(event.current().name())
                .cause(event.cause().name())
                .detail(event.detail())
                .occurredAt(event.occurredAt())
                .build();
        Sinks.EmitResult result = sink.tryEmitNext(dto);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[SessionStream] Dropped event: {}", result);
        }
    }

    public Flux<SessionEventDto> stream() {
        Mono<SessionEventDto> current = Mono.fromSupplier(() -> SessionEventDto.builder()
                .state(sessionStateMachine.getState().name())
                .occurredAt(clock.instant())
                .build());
        return Flux.concat(current, sink.asFlux());
    }
}
