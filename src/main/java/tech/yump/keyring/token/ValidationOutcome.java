package tech.yump.keyring.token;

/**
 * Result categories of a token validation.
 */
public enum ValidationOutcome {
    /** Signature verified by an eligible key and, when checked, the time claims hold. */
    ACCEPTED,
    /** No eligible key verifies the signature. */
    SIGNATURE_INVALID,
    /** Signature verified but the token is past its "exp". */
    EXPIRED,
    /** Signature verified but the token's "nbf" is in the future. */
    NOT_YET_VALID,
    /** Not a compact, signed JWT. */
    MALFORMED
}
