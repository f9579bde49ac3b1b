package com.hooktide.exception;

import com.hooktide.model.Stage;

/**
 * The delivery could not be proven to come from the provider.
 * Raised before the payload is even parsed.
 */
public class AuthException extends RouterException {

    public enum Reason {
        MISSING_SIGNATURE,
        INVALID_SIGNATURE,
        SECRET_NOT_CONFIGURED,
        PROVIDER_DISABLED
    }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(Stage.VALIDATE, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getErrorKind() {
        return reason.name();
    }
}
