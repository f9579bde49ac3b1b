package com.hooktide.exception;

import com.hooktide.model.Stage;

/** The caller went away; the chain stopped before the given stage. */
public class ChainCancelledException extends RouterException {

    public ChainCancelledException(Stage stage, String reason) {
        super(stage, "Chain cancelled before " + stage + ": " + reason);
    }

    @Override
    public String getErrorKind() {
        return "CANCELLED";
    }
}
