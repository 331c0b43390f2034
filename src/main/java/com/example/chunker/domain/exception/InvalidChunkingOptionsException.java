package com.example.chunker.domain.exception;

/**
 * Raised when chunk size or overlap fall outside their allowed ranges.
 */
public class InvalidChunkingOptionsException extends DomainException {

    public InvalidChunkingOptionsException(String message) {
        super(message);
    }
}
