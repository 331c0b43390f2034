package com.example.chunker.application.exception;

/**
 * Thrown when a batch request does not name any statement file.
 */
public class BatchRequestValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public BatchRequestValidationException(String message) {
        super(message);
    }
}
