package com.example.effectivediff.infrastructure;

public class ArtifactSerializationException extends RuntimeException {
    public ArtifactSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
