package com.example.chunker.infrastructure.pdf;

import com.example.chunker.domain.model.PdfDocumentInfo;
import com.example.chunker.infrastructure.exception.StatementReadException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;

/**
 * Reads document-level facts of a PDF statement: info dictionary, XMP creator tool, page count,
 * version and encryption flag.
 */
@Service
public class PdfBoxDocumentInfoReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentInfoReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * @param file PDF statement on disk
     * @return document info
     * @throws StatementReadException when the file cannot be opened
     */
    public PdfDocumentInfo read(Path file) {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            return read(document);
        } catch (IOException ex) {
            throw new StatementReadException("Failed to read PDF document info: " + file, ex);
        }
    }

    PdfDocumentInfo read(PDDocument document) {
        PDDocumentInformation info = document.getDocumentInformation();
        return new PdfDocumentInfo(
                info != null ? info.getTitle() : null,
                info != null ? info.getAuthor() : null,
                info != null ? info.getProducer() : null,
                readCreatorTool(document.getDocumentCatalog()),
                info != null ? formatCalendar(info.getCreationDate()) : null,
                document.getNumberOfPages(),
                String.valueOf(document.getDocument().getVersion()),
                document.isEncrypted()
        );
    }

    private String readCreatorTool(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return null;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            XMPBasicSchema basic = xmp.getXMPBasicSchema();
            return basic != null ? basic.getCreatorTool() : null;
        } catch (IOException | XmpParsingException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atZone(ZoneId.systemDefault()));
    }
}
