package me.vaultlock.adapter.outbound.audit;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.vaultlock.domain.model.AuditRecord;
import me.vaultlock.port.outbound.AuditLogPort;
import me.vaultlock.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

/**
 * Appends audit records as JSON lines to {@code audit/session-audit.jsonl}.
 *
 * <p>
 * Appends are asynchronous; a failed append is logged and does not affect the
 * lock state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlAuditLogAdapter implements AuditLogPort {

    static final String AUDIT_DIR = "audit";
    static final String AUDIT_FILE = "session-audit.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public void append(AuditRecord record) {
        String line;
        try {
            line = objectMapper.writeValueAsString(record) + "\n";
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Failed to serialize audit record {}: {}", record.getType(), e.getMessage());
            return;
        }
        storagePort.appendText(AUDIT_DIR, AUDIT_FILE, line)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("[Audit] Failed to append audit record: {}", error.getMessage());
                    }
                });
    }
}
