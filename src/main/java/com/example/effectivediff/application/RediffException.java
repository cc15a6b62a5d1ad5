package com.example.effectivediff.application;

public class RediffException extends Exception {
    public RediffException(String message) {
        super(message);
    }

    public RediffException(String message, Throwable cause) {
        super(message, cause);
    }
}
