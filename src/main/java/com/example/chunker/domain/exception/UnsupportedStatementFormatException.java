package com.example.chunker.domain.exception;

/**
 * Raised when a file extension is not one of the supported statement formats.
 */
public class UnsupportedStatementFormatException extends DomainException {

    private final String extension;

	/**
	 * Creates the exception and mentions the offending extension so the caller can react.
	 *
	 * @param extension lower-cased extension of the rejected file, possibly empty
	 */
    public UnsupportedStatementFormatException(String extension) {
        super("Unsupported: " + (extension == null || extension.isEmpty() ? "(no extension)" : extension)
                + ". Use .pdf, .csv, .xlsx, .xls");
        this.extension = extension == null ? "" : extension;
    }

    public String getExtension() {
        return extension;
    }
}
