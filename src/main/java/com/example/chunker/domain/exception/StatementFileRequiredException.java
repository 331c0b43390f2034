package com.example.chunker.domain.exception;

/**
 * Raised when an upload request arrives without a statement file or with an empty one.
 */
public class StatementFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public StatementFileRequiredException() {
        super("Please choose a PDF, CSV or Excel statement to upload.");
    }
}
