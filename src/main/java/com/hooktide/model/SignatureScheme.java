package com.hooktide.model;

/**
 * How a provider proves that a delivery came from it.
 * HMAC_SHA256 → digest of the raw body with a shared secret, sent in a header
 * TOKEN       → the shared secret itself echoed back in a header (no native signing)
 */
public enum SignatureScheme {
    HMAC_SHA256,
    TOKEN
}
