package com.example.chunker.domain.model;

import com.example.chunker.domain.exception.UnsupportedStatementFormatException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceFormatTest {

    @Test
    void resolvesFormatIgnoringCase() {
        assertThat(SourceFormat.fromPath(Path.of("statements", "April.PDF"))).isEqualTo(SourceFormat.PDF);
        assertThat(SourceFormat.fromPath(Path.of("april.xlsx"))).isEqualTo(SourceFormat.XLSX);
        assertThat(SourceFormat.XLS.isWorkbook()).isTrue();
        assertThat(SourceFormat.CSV.isWorkbook()).isFalse();
    }

    @Test
    void rejectsUnknownExtension() {
        assertThatThrownBy(() -> SourceFormat.fromPath(Path.of("notes.txt")))
                .isInstanceOf(UnsupportedStatementFormatException.class)
                .hasMessage("Unsupported: .txt. Use .pdf, .csv, .xlsx, .xls");
    }

    @Test
    void extensionOfFileWithoutDotIsEmpty() {
        assertThat(SourceFormat.extensionOf(Path.of("README"))).isEmpty();
    }

    @Test
    void fileNameResolutionIgnoresDirectoryPartsOfEitherSeparator() {
        assertThat(SourceFormat.fromFileName("exports/April.CSV")).isEqualTo(SourceFormat.CSV);
        assertThat(SourceFormat.fromFileName("C:\\exports.pdf\\april\u0000.xls")).isEqualTo(SourceFormat.XLS);
        assertThatThrownBy(() -> SourceFormat.fromFileName("exports.pdf/README"))
                .isInstanceOf(UnsupportedStatementFormatException.class);
    }
}
