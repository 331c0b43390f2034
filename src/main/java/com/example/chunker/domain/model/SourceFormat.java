package com.example.chunker.domain.model;

import com.example.chunker.domain.exception.UnsupportedStatementFormatException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Statement file formats the pipeline understands, keyed by file extension.
 */
public enum SourceFormat {
    PDF(".pdf"),
    CSV(".csv"),
    XLSX(".xlsx"),
    XLS(".xls");

    private final String extension;

    SourceFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * @return {@code true} for spreadsheet formats read through the workbook reader
     */
    public boolean isWorkbook() {
        return this == XLSX || this == XLS;
    }

	/**
	 * Resolves the format of a file from its extension, ignoring case.
	 *
	 * @param path statement file
	 * @return matching format
	 * @throws UnsupportedStatementFormatException when the extension is not supported
	 */
    public static SourceFormat fromPath(Path path) {
        return fromExtension(extensionOf(path));
    }

    /**
     * Resolves the format of a client-supplied file name, which need not be a valid local path.
     *
     * @param fileName file name, possibly with directory parts
     * @return matching format
     * @throws UnsupportedStatementFormatException when the extension is not supported
     */
    public static SourceFormat fromFileName(String fileName) {
        return fromExtension(extensionOf(fileName));
    }

    private static SourceFormat fromExtension(String extension) {
        for (SourceFormat format : values()) {
            if (format.extension.equals(extension)) {
                return format;
            }
        }
        throw new UnsupportedStatementFormatException(extension);
    }

	/**
	 * Extracts the lower-cased extension including the dot.
	 *
	 * @param path file path
	 * @return extension such as {@code ".pdf"} or an empty string
	 */
    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        return extensionOf(path.getFileName().toString());
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = fileName.substring(Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
