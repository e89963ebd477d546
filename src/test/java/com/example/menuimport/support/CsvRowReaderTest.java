package com.example.menuimport.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.example.menuimport.model.CsvTable;
import com.example.menuimport.model.CsvUpload;
import com.example.menuimport.model.UploadEncoding;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;

class CsvRowReaderTest {

    private final CsvRowReader reader = new CsvRowReader(new CamelCsvParserFactory(), new UploadDecoder());

    @Test
    void parsesCommaSeparatedRowsKeyedByHeader() {
        CsvTable table = reader.parse("Category,Name,Price\n3.5,Blue Dream,$35.00\n7,Gelato,$60.00\n");

        assertThat(table.headers()).containsExactly("Category", "Name", "Price");
        assertThat(table.rows()).hasSize(2);
        assertThat(table.rows().get(0)).containsExactly(
                entry("Category", "3.5"), entry("Name", "Blue Dream"), entry("Price", "$35.00"));
    }

    @Test
    void detectsSemicolonTabAndPipeDelimiters() {
        assertThat(reader.parse("Shelf;Strain\nTop;Runtz").rows().get(0))
                .containsEntry("Strain", "Runtz");
        assertThat(reader.parse("Shelf\tStrain\nTop\tRuntz").rows().get(0))
                .containsEntry("Strain", "Runtz");
        assertThat(reader.parse("Shelf|Strain\nTop|Runtz").rows().get(0))
                .containsEntry("Strain", "Runtz");
    }

    @Test
    void delimiterTieKeepsComma() {
        assertThat(CsvRowReader.detectDelimiter("Name")).isEqualTo(',');
        assertThat(CsvRowReader.detectDelimiter("a;b,c")).isEqualTo(',');
        assertThat(CsvRowReader.detectDelimiter("a;b;c,d")).isEqualTo(';');
    }

    @Test
    void keepsQuotedDelimitersInsideCells() {
        CsvTable table = reader.parse("Category,Name,Notes\nTop,\"Gelato, #41\",\"Smooth, sweet\"\n");

        assertThat(table.rows().get(0))
                .containsEntry("Name", "Gelato, #41")
                .containsEntry("Notes", "Smooth, sweet");
    }

    @Test
    void namesBlankHeaders() {
        CsvTable table = reader.parse(",Name,\nTop,Runtz,x\n");

        assertThat(table.headers()).containsExactly("Category", "Name", "Column3");
        assertThat(table.rows().get(0)).containsEntry("Category", "Top").containsEntry("Column3", "x");
    }

    @Test
    void padsShortRowsAndSkipsBlankLines() {
        CsvTable table = reader.parse("Category,Name,Price\n\nTop,Runtz\n\n");

        assertThat(table.rows()).singleElement().satisfies(row -> assertThat(row)
                .containsEntry("Category", "Top")
                .containsEntry("Name", "Runtz")
                .containsEntry("Price", ""));
    }

    @Test
    void stripsByteOrderMarkAndCarriageReturns() {
        CsvTable table = reader.parse("\uFEFFCategory,Name\r\nTop,Runtz\r\nValue,Gelato\r\n");

        assertThat(table.headers()).containsExactly("Category", "Name");
        assertThat(table.rows()).extracting(row -> row.get("Name")).containsExactly("Runtz", "Gelato");
    }

    @Test
    void keepsRowsThatStartWithHash() {
        CsvTable table = reader.parse("Category,Name\n#1 Shelf,Runtz\n");

        assertThat(table.rows()).singleElement().satisfies(row -> assertThat(row)
                .containsEntry("Category", "#1 Shelf"));
    }

    @Test
    void emptyContentYieldsEmptyTable() {
        assertThat(reader.parse("")).isEqualTo(CsvTable.EMPTY);
        assertThat(reader.parse("\n  \n")).isEqualTo(CsvTable.EMPTY);
        assertThat(reader.parse(null)).isEqualTo(CsvTable.EMPTY);
    }

    @Test
    void headerOnlyFileHasNoRows() {
        CsvTable table = reader.parse("Category,Name\n");

        assertThat(table.headers()).containsExactly("Category", "Name");
        assertThat(table.rows()).isEmpty();
    }

    @Test
    void readsGzipUploads() throws IOException {
        byte[] compressed = gzip("Category,Name\nTop,Runtz\n");

        CsvUpload bySignature = reader.read(new ByteArrayInputStream(compressed), "menu.csv");
        CsvUpload bySuffix = reader.read(new ByteArrayInputStream(compressed), "menu.csv.gz");

        assertThat(bySignature.encoding()).isEqualTo(UploadEncoding.GZIP);
        assertThat(bySignature.table().rows()).singleElement().satisfies(row -> assertThat(row)
                .containsEntry("Name", "Runtz"));
        assertThat(bySuffix.table()).isEqualTo(bySignature.table());
    }

    @Test
    void readsPlainUploads() {
        InputStream upload = new ByteArrayInputStream("Shelf;Strain\nTop;Runtz\n".getBytes(StandardCharsets.UTF_8));

        CsvUpload decoded = reader.read(upload, "menu.csv");

        assertThat(decoded.filename()).isEqualTo("menu.csv");
        assertThat(decoded.encoding()).isEqualTo(UploadEncoding.PLAIN);
        assertThat(decoded.table().headers()).containsExactly("Shelf", "Strain");
        assertThat(decoded.table().rows()).hasSize(1);
    }

    @Test
    void keepsLongCellsIntact() {
        String notes = "x".repeat(5000);

        CsvTable table = reader.parse("Category,Product Name,Price,Notes\n3.5,Blue Dream,$35," + notes);

        assertThat(table.rows()).singleElement().satisfies(row -> assertThat(row.get("Notes")).hasSize(5000));
    }

    @Test
    void tooManyColumnsIsRejectedAsImportError() {
        String header = String.join(",", Collections.nCopies(600, "c"));

        assertThatThrownBy(() -> reader.parse(header + "\n" + header))
                .isInstanceOf(ImportProcessingException.class)
                .hasMessageStartingWith("Malformed CSV at line");
    }

    private static byte[] gzip(String content) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GzipCompressorOutputStream out = new GzipCompressorOutputStream(bytes)) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return bytes.toByteArray();
    }
}
