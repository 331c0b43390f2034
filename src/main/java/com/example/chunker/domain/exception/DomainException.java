package com.example.chunker.domain.exception;

/**
 * Base type for all domain-level exceptions in the statement model.
 * Subclasses describe invalid requests (missing file, unsupported format, bad chunking options)
 * without leaking infrastructure dependencies.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule was broken
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which rule was broken
	 * @param cause   original exception that triggered the domain failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
