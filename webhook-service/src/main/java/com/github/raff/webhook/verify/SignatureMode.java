package com.github.raff.webhook.verify;

/** How a platform signs its webhook bodies. Bound from "hmac-sha256", "sha256" or "plain". */
public enum SignatureMode {
    /** Hex HMAC-SHA256 of the body keyed with the secret. */
    HMAC_SHA256,
    /** Hex SHA-256 of the secret and body concatenated; order set by {@link Sha256Order}. */
    SHA256,
    /** The header carries the shared secret itself. */
    PLAIN
}
