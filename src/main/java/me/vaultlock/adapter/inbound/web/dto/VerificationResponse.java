package me.vaultlock.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a password or recovery key check. Never contains secrets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResponse {
    private String outcome;
    private int remainingAttempts;
    private Instant lockoutUntil;
    private long retryAfterSeconds;
}
