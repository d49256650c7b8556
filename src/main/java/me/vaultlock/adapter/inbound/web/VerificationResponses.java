package me.vaultlock.adapter.inbound.web;

import me.vaultlock.adapter.inbound.web.dto.VerificationResponse;
import me.vaultlock.domain.model.VerificationResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;

/**
 * Maps verification outcomes to HTTP statuses.
 */
public final class VerificationResponses {

    private VerificationResponses() {
    }

    public static VerificationResponse toDto(VerificationResult result) {
        return VerificationResponse.builder()
                .outcome(result.outcome().name())
                .remainingAttempts(result.remainingAttempts())
                .lockoutUntil(result.lockoutUntil())
                .retryAfterSeconds(retryAfterSeconds(result.retryAfter()))
                .build();
    }

    public static HttpStatus statusOf(VerificationResult result) {
        switch (result.outcome()) {
            case SUCCESS:
            case NO_CREDENTIAL_SET:
                return HttpStatus.OK;
            case INVALID_CREDENTIAL:
                return HttpStatus.UNAUTHORIZED;
            case LOCKED_OUT:
                return HttpStatus.TOO_MANY_REQUESTS;
            case CORRUPT_STORE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                throw new IllegalStateException("Unknown outcome: " + result.outcome());
        }
    }

    /**
     * Response builder with the status and, for lockouts, a
     * {@code Retry-After} header.
     */
    public static ResponseEntity.BodyBuilder builderFor(VerificationResult result) {
        HttpStatus status = statusOf(result);
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        long retryAfter = retryAfterSeconds(result.retryAfter());
        if (result.lockoutUntil() != null && retryAfter > 0) {
            builder.header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter));
        }
        return builder;
    }

    public static ResponseEntity<VerificationResponse> toResponse(VerificationResult result) {
        return builderFor(result).body(toDto(result));
    }

    static long retryAfterSeconds(Duration retryAfter) {
        if (retryAfter == null || retryAfter.isNegative() || retryAfter.isZero()) {
            return 0;
        }
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}
