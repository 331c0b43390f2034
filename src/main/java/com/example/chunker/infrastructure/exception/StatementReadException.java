package com.example.chunker.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while reading a statement from disk.
 */
public class StatementReadException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from the reading library.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox, POI, Commons CSV or IO exception
	 */
    public StatementReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
