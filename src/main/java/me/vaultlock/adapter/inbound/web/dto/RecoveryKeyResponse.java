package me.vaultlock.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Carries a freshly issued recovery key. Returned exactly once per issuance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryKeyResponse {
    private String recoveryKey;
}
