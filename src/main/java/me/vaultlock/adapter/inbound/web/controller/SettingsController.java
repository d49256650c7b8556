package me.vaultlock.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.vaultlock.adapter.inbound.web.dto.SettingsResponse;
import me.vaultlock.adapter.inbound.web.dto.SettingsUpdateRequest;
import me.vaultlock.domain.model.AuthSettings;
import me.vaultlock.domain.service.LockSettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Auto-lock and OS integration preferences.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final LockSettingsService lockSettingsService;

    @GetMapping
    public Mono<ResponseEntity<SettingsResponse>> getSettings() {
        return Mono.just(ResponseEntity.ok(toResponse(lockSettingsService.getSettings())));
    }

    @PutMapping
    public Mono<ResponseEntity<SettingsResponse>> updateSettings(@RequestBody SettingsUpdateRequest request) {
        AuthSettings updated = lockSettingsService.update(request.getAutoLockEnabled(),
                request.getAutoLockTimeoutSeconds(), request.getOsLockIntegrationEnabled());
        return Mono.just(ResponseEntity.ok(toResponse(updated)));
    }

    private SettingsResponse toResponse(AuthSettings settings) {
        return SettingsResponse.builder()
                .protectionEnabled(settings.isProtectionEnabled())
                .autoLockEnabled(settings.isAutoLockEnabled())
                .autoLockTimeoutSeconds(settings.getAutoLockTimeoutSeconds())
                .osLockIntegrationEnabled(settings.isOsLockIntegrationEnabled())
                .build();
    }
}
