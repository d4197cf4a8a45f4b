package com.hookrelay.common.signature;

/**
 * Why an inbound request was rejected by the signature gate.
 */
public enum SignatureFailure {
    /** Missing or unparsable signature fields, or a stale timestamp. */
    VALIDATION_FAILED,
    /** Well-formed request whose digest does not match. */
    UNAUTHENTICATED
}
