package me.vaultlock.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettingsUpdateRequest {
    private Boolean autoLockEnabled;
    private Integer autoLockTimeoutSeconds;
    private Boolean osLockIntegrationEnabled;
}
