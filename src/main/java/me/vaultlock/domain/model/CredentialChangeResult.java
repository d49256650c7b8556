package me.vaultlock.domain.model;

/**
 * Result of an operation that first verifies the current password and then
 * rotates credentials. {@code recoveryKey} is only present on success.
 */
public record CredentialChangeResult(VerificationResult verification, IssuedRecoveryKey recoveryKey) {

    public boolean isChanged() {
        return recoveryKey != null;
    }
}
