package com.hooktide.exception;

import com.hooktide.model.Stage;

/** The registry knows the resource but has no target for the event's category. */
public class ResolutionException extends RouterException {

    public enum Kind {
        NO_TARGET_CONFIGURED
    }

    private final Kind kind;

    public ResolutionException(Kind kind, String message) {
        super(Stage.RESOLVE, message);
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
