package com.hooktide.exception;

import com.hooktide.model.Stage;

/**
 * Base class of every failure that terminates a webhook's chain run.
 * Carries the stage that failed and a short error kind for logs and responses.
 */
public abstract class RouterException extends RuntimeException {

    private final Stage stage;

    protected RouterException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected RouterException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }

    public abstract String getErrorKind();
}
