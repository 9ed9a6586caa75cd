package com.github.raff.webhook.verify;

/** Concatenation order for {@link SignatureMode#SHA256}. */
public enum Sha256Order {
    SECRET_FIRST,
    BODY_FIRST
}
