package com.hookrelay.common.signature;

import com.hookrelay.common.exception.WebhookAuthenticationException;
import com.hookrelay.common.exception.WebhookValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of {@link WebhookSignatureVerifier#verify}: either accepted, or rejected with a reason.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SignatureVerification {

    private static final SignatureVerification OK = new SignatureVerification(true, null, null);

    private final boolean valid;
    private final SignatureFailure failure;
    private final String reason;

    public static SignatureVerification ok() {
        return OK;
    }

    public static SignatureVerification rejected(SignatureFailure failure, String reason) {
        return new SignatureVerification(false, failure, reason);
    }

    /**
     * Throws the exception matching the rejection reason; no-op when valid.
     */
    public void orThrow() {
        if (valid) {
            return;
        }
        if (failure == SignatureFailure.UNAUTHENTICATED) {
            throw new WebhookAuthenticationException(reason);
        }
        throw new WebhookValidationException(reason);
    }

    @Override
    public String toString() {
        return valid ? "SignatureVerification[ok]" : "SignatureVerification[" + failure + ": " + reason + "]";
    }
}
