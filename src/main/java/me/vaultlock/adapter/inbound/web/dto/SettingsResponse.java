package me.vaultlock.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsResponse {
    private boolean protectionEnabled;
    private boolean autoLockEnabled;
    private int autoLockTimeoutSeconds;
    private boolean osLockIntegrationEnabled;
}
