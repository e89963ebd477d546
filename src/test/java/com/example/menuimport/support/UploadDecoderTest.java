package com.example.menuimport.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.menuimport.model.UploadEncoding;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;

class UploadDecoderTest {

    private final UploadDecoder decoder = new UploadDecoder();

    @Test
    void passesPlainTextThrough() {
        UploadDecoder.Decoded decoded = decoder.decode(stream(utf8("Category,Name\nTop,Café Runtz\n")), "menu.csv");

        assertThat(decoded.encoding()).isEqualTo(UploadEncoding.PLAIN);
        assertThat(decoded.text()).isEqualTo("Category,Name\nTop,Café Runtz\n");
    }

    @Test
    void inflatesGzipRegardlessOfName() throws IOException {
        byte[] compressed = gzip(utf8("Category,Name\nTop,Runtz\n"));

        UploadDecoder.Decoded decoded = decoder.decode(stream(compressed), "export");

        assertThat(decoded.encoding()).isEqualTo(UploadEncoding.GZIP);
        assertThat(decoded.text()).isEqualTo("Category,Name\nTop,Runtz\n");
    }

    @Test
    void rejectsGzipNameWithoutGzipContent() {
        assertThatThrownBy(() -> decoder.decode(stream(utf8("Category,Name\n")), "menu.csv.gz"))
                .isInstanceOf(ImportProcessingException.class)
                .hasMessage("File menu.csv.gz is named .gz but is not gzip-compressed");
    }

    @Test
    void rejectsTruncatedGzip() throws IOException {
        byte[] compressed = gzip(utf8("Category,Name\nTop,Runtz\n".repeat(50)));
        byte[] truncated = new byte[compressed.length / 2];
        System.arraycopy(compressed, 0, truncated, 0, truncated.length);

        assertThatThrownBy(() -> decoder.decode(stream(truncated), "menu.csv.gz"))
                .isInstanceOf(ImportProcessingException.class)
                .hasMessage("File menu.csv.gz is not valid gzip data");
    }

    @Test
    void rejectsZipArchives() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.putNextEntry(new ZipEntry("menu.csv"));
            zip.write(utf8("Category,Name\n"));
            zip.closeEntry();
        }

        assertThatThrownBy(() -> decoder.decode(stream(bytes.toByteArray()), "menu.zip"))
                .isInstanceOf(ImportProcessingException.class)
                .hasMessageContaining("zip archive");
    }

    @Test
    void rejectsBinaryContentPlainOrCompressed() throws IOException {
        byte[] binary = { 'C', 'a', 't', 0, 1, 2, 3 };

        assertThatThrownBy(() -> decoder.decode(stream(binary), "menu.csv"))
                .isInstanceOf(ImportProcessingException.class)
                .hasMessage("File menu.csv is binary, not CSV text");
        assertThatThrownBy(() -> decoder.decode(stream(gzip(binary)), "menu.csv.gz"))
                .isInstanceOf(ImportProcessingException.class)
                .hasMessage("File menu.csv.gz is binary, not CSV text");
    }

    private static ByteArrayInputStream stream(byte[] content) {
        return new ByteArrayInputStream(content);
    }

    private static byte[] utf8(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] gzip(byte[] content) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GzipCompressorOutputStream out = new GzipCompressorOutputStream(bytes)) {
            out.write(content);
        }
        return bytes.toByteArray();
    }
}
