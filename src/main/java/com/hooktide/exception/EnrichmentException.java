package com.hooktide.exception;

import com.hooktide.model.Stage;

/**
 * The registry lookup did not produce a record. Always fail-closed: the event
 * is rejected rather than dispatched with a guessed target.
 */
public class EnrichmentException extends RouterException {

    public enum Kind {
        TIMEOUT,
        NOT_FOUND,
        TRANSPORT_FAILURE
    }

    private final Kind kind;

    public EnrichmentException(Kind kind, String message) {
        super(Stage.ENRICH, message);
        this.kind = kind;
    }

    public EnrichmentException(Kind kind, String message, Throwable cause) {
        super(Stage.ENRICH, message, cause);
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
