package com.example.chunker.domain.exception;

/**
 * Raised when a statement path does not exist on disk.
 * Fatal for that file; batch runs record it as a per-item error.
 */
public class StatementNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public StatementNotFoundException(String path) {
        super("File not found: " + path);
    }
}
