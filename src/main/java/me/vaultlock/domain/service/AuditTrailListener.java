package me.vaultlock.domain.service;

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
import me.vaultlock.domain.model.AuditRecord;
import me.vaultlock.domain.model.CredentialChangedEvent;
import me.vaultlock.domain.model.SessionTransitionEvent;
import me.vaultlock.port.outbound.AuditLogPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Forwards session transitions and credential changes to the append-only audit
 * log. Never carries secrets or hashes.
 */
@Component
@Slf4j
public class AuditTrailListener {

    static final String TYPE_TRANSITION = "SESSION_TRANSITION";
    static final String TYPE_CREDENTIAL = "CREDENTIAL_CHANGE";

    private final AuditLogPort auditLogPort;

    public AuditTrailListener(AuditLogPort auditLogPort) {
        this.auditLogPort = auditLogPort;
    }

    @EventListener
    public void onTransition(SessionTransitionEvent event) {
        auditLogPort.append(AuditRecord.builder()
                .timestamp(event.occurredAt())
                .type(TYPE_TRANSITION)
                .previousState(event.previous())
                .state(event.current())
                .cause(event.cause().name())
                .detail(event.detail())
                .build());
    }

    @EventListener
    public void onCredentialChanged(CredentialChangedEvent event) {
        auditLogPort.append(AuditRecord.builder()
                .timestamp(event.occurredAt())
                .type(TYPE_CREDENTIAL)
                .cause(event.kind().name())
                .build());
    }
}
