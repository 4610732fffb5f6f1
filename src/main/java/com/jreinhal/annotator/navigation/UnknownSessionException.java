package com.jreinhal.annotator.navigation;

public class UnknownSessionException extends RuntimeException {
    public UnknownSessionException(String message) {
        super(message);
    }
}
