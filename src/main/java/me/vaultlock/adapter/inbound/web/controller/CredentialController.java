package me.vaultlock.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.vaultlock.adapter.inbound.web.VerificationResponses;
import me.vaultlock.adapter.inbound.web.dto.CredentialChangeResponse;
import me.vaultlock.adapter.inbound.web.dto.DisableProtectionRequest;
import me.vaultlock.adapter.inbound.web.dto.PasswordChangeRequest;
import me.vaultlock.adapter.inbound.web.dto.PasswordSetupRequest;
import me.vaultlock.adapter.inbound.web.dto.PasswordStrengthRequest;
import me.vaultlock.adapter.inbound.web.dto.PasswordStrengthResponse;
import me.vaultlock.adapter.inbound.web.dto.RecoveryKeyResponse;
import me.vaultlock.adapter.inbound.web.dto.RecoveryRedeemRequest;
import me.vaultlock.adapter.inbound.web.dto.RecoveryRedeemResponse;
import me.vaultlock.adapter.inbound.web.dto.RecoveryResetRequest;
import me.vaultlock.adapter.inbound.web.dto.VerificationResponse;
import me.vaultlock.domain.model.CredentialChangeResult;
import me.vaultlock.domain.model.IssuedRecoveryKey;
import me.vaultlock.domain.model.PasswordStrength;
import me.vaultlock.domain.model.RecoveryRedemption;
import me.vaultlock.domain.model.VerificationResult;
import me.vaultlock.domain.service.CredentialService;
import me.vaultlock.domain.service.PasswordPolicy;
import me.vaultlock.domain.service.RecoveryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Master password and recovery key management.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class CredentialController {

    private final CredentialService credentialService;
    private final RecoveryService recoveryService;
    private final PasswordPolicy passwordPolicy;

    @PostMapping("/api/credentials/setup")
    public Mono<ResponseEntity<RecoveryKeyResponse>> setup(@RequestBody PasswordSetupRequest request) {
        return Mono.fromCallable(() -> credentialService.setupPassword(request.getNewPassword()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(key -> ResponseEntity.ok(toRecoveryKeyResponse(key)));
    }

    @PostMapping("/api/credentials/password")
    public Mono<ResponseEntity<CredentialChangeResponse>> changePassword(
            @RequestBody PasswordChangeRequest request) {
        return Mono.fromCallable(() -> credentialService.changePassword(
                request.getCurrentPassword(), request.getNewPassword()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toChangeResponse);
    }

    @PostMapping("/api/credentials/disable")
    public Mono<ResponseEntity<VerificationResponse>> disable(@RequestBody DisableProtectionRequest request) {
        return Mono.fromCallable(() -> credentialService.disableProtection(request.getCurrentPassword()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(VerificationResponses::toResponse);
    }

    @PostMapping("/api/credentials/recovery/redeem")
    public Mono<ResponseEntity<RecoveryRedeemResponse>> redeem(@RequestBody RecoveryRedeemRequest request) {
        return Mono.fromCallable(() -> recoveryService.redeem(request.getRecoveryKey()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toRedeemResponse);
    }

    @PostMapping("/api/credentials/recovery/reset")
    public Mono<ResponseEntity<RecoveryKeyResponse>> reset(@RequestBody RecoveryResetRequest request) {
        return Mono.fromCallable(() -> recoveryService.completeReset(
                request.getResetTicket(), request.getNewPassword()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(key -> ResponseEntity.ok(toRecoveryKeyResponse(key)));
    }

    @PostMapping("/api/password-strength")
    public Mono<ResponseEntity<PasswordStrengthResponse>> strength(@RequestBody PasswordStrengthRequest request) {
        PasswordStrength strength = passwordPolicy.evaluate(request.getPassword());
        return Mono.just(ResponseEntity.ok(PasswordStrengthResponse.builder()
                .score(strength.score())
                .message(strength.message())
                .acceptable(strength.isAcceptable())
                .build()));
    }

    private ResponseEntity<CredentialChangeResponse> toChangeResponse(CredentialChangeResult result) {
        VerificationResult verification = result.verification();
        CredentialChangeResponse body = CredentialChangeResponse.builder()
                .verification(VerificationResponses.toDto(verification))
                .recoveryKey(result.isChanged() ? result.recoveryKey().plaintext() : null)
                .build();
        return VerificationResponses.builderFor(verification).body(body);
    }

    private ResponseEntity<RecoveryRedeemResponse> toRedeemResponse(RecoveryRedemption redemption) {
        RecoveryRedeemResponse.RecoveryRedeemResponseBuilder body = RecoveryRedeemResponse.builder()
                .verification(VerificationResponses.toDto(redemption.verification()));
        if (redemption.isRedeemed()) {
            body.resetTicket(redemption.ticket().id())
                    .resetTicketExpiresAt(redemption.ticket().expiresAt());
        }
        return VerificationResponses.builderFor(redemption.verification()).body(body.build());
    }

    private static RecoveryKeyResponse toRecoveryKeyResponse(IssuedRecoveryKey key) {
        return RecoveryKeyResponse.builder()
                .recoveryKey(key.plaintext())
                .build();
    }
}
