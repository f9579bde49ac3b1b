package com.hooktide.exception;

import com.hooktide.model.Stage;

/**
 * The execution engine did not accept the request.
 * REJECTED    → engine answered but refused it (4xx)
 * UNREACHABLE → engine down, 5xx, or transport error
 */
public class DispatchException extends RouterException {

    public enum Kind {
        REJECTED,
        UNREACHABLE
    }

    private final Kind kind;

    public DispatchException(Kind kind, String message, Throwable cause) {
        super(Stage.DISPATCH, message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getErrorKind() {
        return kind.name();
    }
}
