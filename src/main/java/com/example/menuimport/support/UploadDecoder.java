package com.example.menuimport.support;

import com.example.menuimport.model.UploadEncoding;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.springframework.stereotype.Component;

/**
 * Turns an uploaded file into CSV text. Gzip is recognised by its magic bytes; anything else must
 * already be text. Archives and other binary content are rejected before parsing.
 */
@Slf4j
@Component
public class UploadDecoder {

    private static final int SNIFF_LENGTH = 8 * 1024;
    private static final int BUFFER_SIZE = 32 * 1024;
    private static final String GZIP_SUFFIX = ".gz";
    private static final byte[] ZIP_SIGNATURE = { 'P', 'K', 0x03, 0x04 };

    public Decoded decode(InputStream upload, String filename) {
        try (BufferedInputStream buffered = new BufferedInputStream(upload, BUFFER_SIZE)) {
            buffered.mark(SNIFF_LENGTH);
            byte[] head = buffered.readNBytes(SNIFF_LENGTH);
            buffered.reset();

            if (GzipCompressorInputStream.matches(head, head.length)) {
                byte[] inflated = inflate(buffered, filename);
                requireText(inflated, filename);
                log.debug("Decompressed gzip upload file={} bytes={}", filename, inflated.length);
                return new Decoded(UploadEncoding.GZIP, new String(inflated, StandardCharsets.UTF_8));
            }
            if (hasGzipSuffix(filename)) {
                throw new ImportProcessingException(
                        "File %s is named .gz but is not gzip-compressed".formatted(filename));
            }

            requireText(head, filename);
            byte[] content = buffered.readAllBytes();
            return new Decoded(UploadEncoding.PLAIN, new String(content, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ImportProcessingException("Failed to read CSV file %s".formatted(filename), ex);
        }
    }

    private static byte[] inflate(InputStream compressed, String filename) {
        try (GzipCompressorInputStream gzip = new GzipCompressorInputStream(compressed, true)) {
            return gzip.readAllBytes();
        } catch (IOException ex) {
            throw new ImportProcessingException("File %s is not valid gzip data".formatted(filename), ex);
        }
    }

    private static void requireText(byte[] content, String filename) {
        if (startsWith(content, ZIP_SIGNATURE)) {
            throw new ImportProcessingException(
                    "File %s is a zip archive; upload the CSV itself or a .csv.gz file".formatted(filename));
        }
        int limit = Math.min(content.length, SNIFF_LENGTH);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                throw new ImportProcessingException("File %s is binary, not CSV text".formatted(filename));
            }
        }
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasGzipSuffix(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(GZIP_SUFFIX);
    }

    public record Decoded(UploadEncoding encoding, String text) {
    }
}
