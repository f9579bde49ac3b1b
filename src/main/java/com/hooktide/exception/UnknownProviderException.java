package com.hooktide.exception;

public class UnknownProviderException extends RuntimeException {

    public UnknownProviderException(String message) {
        super(message);
    }
}
