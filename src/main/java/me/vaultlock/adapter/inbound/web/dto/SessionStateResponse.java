package me.vaultlock.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStateResponse {
    private String state;
    private boolean protectionEnabled;
    private boolean lockedOut;
    private Instant lockoutUntil;
    private Instant lastActivityAt;
}
