package com.example.chunker.domain.exception;

/**
 * Raised when a caller asks to process a {@code null} {@link java.nio.file.Path}.
 */
public class StatementPathRequiredException extends DomainException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public StatementPathRequiredException() {
        super("Statement path is required.");
    }
}
