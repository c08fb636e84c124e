package com.goormthonuniv.factcheck.auth;

public class BackgroundAuthException extends RuntimeException {
    public BackgroundAuthException(String message) {
        super(message);
    }
}
