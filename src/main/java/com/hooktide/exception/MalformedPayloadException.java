package com.hooktide.exception;

import com.hooktide.model.Stage;

/**
 * Body is not a JSON object, or lacks a field every dispatch needs.
 * Parsing first happens during classification, hence the default stage.
 */
public class MalformedPayloadException extends RouterException {

    public MalformedPayloadException(String message) {
        super(Stage.CLASSIFY, message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(Stage.CLASSIFY, message, cause);
    }

    public MalformedPayloadException(Stage stage, String message) {
        super(stage, message);
    }

    @Override
    public String getErrorKind() {
        return "MALFORMED_PAYLOAD";
    }
}
