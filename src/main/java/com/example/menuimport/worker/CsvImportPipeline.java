package com.example.menuimport.worker;

import com.example.menuimport.model.DestinationDescriptor;
import com.example.menuimport.model.ImportMode;
import com.example.menuimport.model.ImportRecord;
import com.example.menuimport.model.ImportRequest;
import com.example.menuimport.model.ImportResult;
import com.example.menuimport.model.ImportStats;
import com.example.menuimport.model.ProductRecord;
import com.example.menuimport.model.SkippedRow;
import com.example.menuimport.model.StrainRecord;
import com.example.menuimport.support.ImportProcessingException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Chunked execution loop for one run. Rows are processed synchronously inside a chunk; the
 * session is checked for cancellation only between chunks.
 */
@Slf4j
class CsvImportPipeline {

    /** Header row plus 1-based numbering. */
    private static final int ROW_INDEX_OFFSET = 2;

    private final int chunkSize;

    CsvImportPipeline(int chunkSize) {
        this.chunkSize = Math.max(1, chunkSize);
    }

    void run(ImportRequest request, ImportSession session, ImportMessageListener listener) {
        validate(request);
        List<Map<String, String>> rows = request.rows();
        int total = rows.size();

        FieldMapping mapping = FieldMapping.invert(request.columnMapping());
        DestinationResolver resolver = new DestinationResolver(
                request.mode(),
                request.existingDestinations(),
                request.allowCreateDestinations(),
                session.identifiers());
        RunAccumulator accumulator = new RunAccumulator(request.mode(), resolver);
        log.info("Starting import run mode={} rows={} existingDestinations={} allowCreate={}",
                request.mode().wireName(), total, request.existingDestinations().size(),
                request.allowCreateDestinations());

        for (int start = 0; start < total; start += chunkSize) {
            if (session.isCancelled()) {
                log.info("Import run cancelled before row {} of {}", start + 1, total);
                listener.onMessage(ImportMessage.cancelled());
                return;
            }

            int end = Math.min(start + chunkSize, total);
            for (int index = start; index < end; index++) {
                processRow(index, rows.get(index), request.mode(), mapping, resolver, session, accumulator);
            }

            log.debug("Processed chunk rows={}-{} records={} skipped={}",
                    start + 1, end, accumulator.totalProcessed, accumulator.skippedRows.size());
            listener.onMessage(ImportMessage.progress(end, total,
                    "Processing rows %d-%d...".formatted(start + 1, end)));

            if (end < total && session.yieldAndCheckCancelled()) {
                log.info("Import run cancelled after {} of {} rows", end, total);
                listener.onMessage(ImportMessage.cancelled());
                return;
            }
        }

        ImportResult result = accumulator.toResult();
        log.info("Completed import run processed={} skipped={} createdDestinations={}",
                result.stats().totalProcessed(), result.stats().totalSkipped(), result.createdShelves().size());
        listener.onMessage(ImportMessage.complete(result));
    }

    private static void validate(ImportRequest request) {
        if (request == null) {
            throw new ImportProcessingException("Import request is required");
        }
        if (request.mode() == null) {
            throw new ImportProcessingException("Import mode is required");
        }
    }

    private void processRow(int index,
            Map<String, String> row,
            ImportMode mode,
            FieldMapping mapping,
            DestinationResolver resolver,
            ImportSession session,
            RunAccumulator accumulator) {
        int rowIndex = index + ROW_INDEX_OFFSET;
        try {
            String label = mapping.value(row, FieldMapping.SHELF).trim();
            String itemName = mapping.value(row, FieldMapping.NAME).trim();

            if (label.isEmpty() || itemName.isEmpty()) {
                accumulator.skip(rowIndex, row, missingDataReason(label.isEmpty(), itemName.isEmpty()));
                return;
            }

            if (mode == ImportMode.PREPACKAGED) {
                accumulator.classify(DestinationResolver.isShake(itemName));
            }

            DestinationResolver.Resolution resolution = resolver.resolve(label, itemName);
            if (!resolution.isResolved()) {
                accumulator.skip(rowIndex, row, unresolvedReason(label, resolution.attemptedLabels()));
                return;
            }

            String id = session.identifiers().get();
            ImportRecord record = mode == ImportMode.BULK
                    ? toStrain(id, itemName, row, mapping)
                    : toProduct(id, itemName, row, mapping);
            accumulator.assign(resolution.destinationId(), record);
        } catch (RuntimeException ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.debug("Row {} failed: {}", rowIndex, message, ex);
            accumulator.skip(rowIndex, row, "Processing error: " + message);
        }
    }

    private static StrainRecord toStrain(String id, String name, Map<String, String> row, FieldMapping mapping) {
        return new StrainRecord(
                id,
                name,
                mapping.value(row, FieldMapping.GROWER),
                FieldNormalizers.extractNumeric(mapping.value(row, FieldMapping.THC)),
                FieldNormalizers.normalizeStrainType(mapping.value(row, FieldMapping.TYPE)),
                FieldNormalizers.parseBooleanField(mapping.value(row, FieldMapping.LAST_JAR),
                        FieldNormalizers.LAST_JAR_VALUES),
                FieldNormalizers.parseBooleanField(mapping.value(row, FieldMapping.SOLD_OUT),
                        FieldNormalizers.SOLD_OUT_VALUES),
                mapping.value(row, FieldMapping.ORIGINAL_SHELF));
    }

    private static ProductRecord toProduct(String id, String name, Map<String, String> row, FieldMapping mapping) {
        return new ProductRecord(
                id,
                name,
                mapping.value(row, FieldMapping.BRAND),
                FieldNormalizers.extractNumeric(mapping.value(row, FieldMapping.THC)),
                FieldNormalizers.extractNumeric(mapping.value(row, FieldMapping.TERPENES)),
                FieldNormalizers.normalizeStrainType(mapping.value(row, FieldMapping.TYPE)),
                FieldNormalizers.parsePrice(mapping.value(row, FieldMapping.PRICE)),
                mapping.value(row, FieldMapping.NET_WEIGHT),
                FieldNormalizers.parseBooleanField(mapping.value(row, FieldMapping.LOW_STOCK),
                        FieldNormalizers.LOW_STOCK_VALUES),
                FieldNormalizers.parseBooleanField(mapping.value(row, FieldMapping.SOLD_OUT),
                        FieldNormalizers.SOLD_OUT_VALUES),
                mapping.value(row, FieldMapping.NOTES));
    }

    private static String missingDataReason(boolean missingLabel, boolean missingName) {
        if (missingLabel && missingName) {
            return "Missing required data: shelf/category and item name";
        }
        return "Missing required data: " + (missingLabel ? "shelf/category" : "item name");
    }

    private static String unresolvedReason(String label, List<String> attempted) {
        String reason = "Unknown shelf/category \"%s\"".formatted(label);
        if (attempted.size() > 1) {
            reason += " (tried: " + String.join(", ", attempted) + ")";
        }
        return reason;
    }

    private static final class RunAccumulator {
        private final ImportMode mode;
        private final DestinationResolver resolver;
        private final Map<String, List<ImportRecord>> assignments = new LinkedHashMap<>();
        private final List<SkippedRow> skippedRows = new ArrayList<>();

        private int totalProcessed;
        private int shakeCount;
        private int flowerCount;

        private RunAccumulator(ImportMode mode, DestinationResolver resolver) {
            this.mode = mode;
            this.resolver = resolver;
        }

        void classify(boolean shake) {
            if (shake) {
                shakeCount++;
            } else {
                flowerCount++;
            }
        }

        void assign(String destinationId, ImportRecord record) {
            assignments.computeIfAbsent(destinationId, key -> new ArrayList<>()).add(record);
            totalProcessed++;
        }

        void skip(int rowIndex, Map<String, String> row, String reason) {
            Map<String, String> rowData = row == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(row));
            skippedRows.add(new SkippedRow(rowIndex, rowData, reason));
        }

        ImportResult toResult() {
            Map<String, List<ImportRecord>> frozen = new LinkedHashMap<>();
            assignments.forEach((id, records) -> frozen.put(id, List.copyOf(records)));
            boolean prepackaged = mode == ImportMode.PREPACKAGED;
            ImportStats stats = new ImportStats(
                    totalProcessed,
                    skippedRows.size(),
                    prepackaged ? shakeCount : null,
                    prepackaged ? flowerCount : null);
            List<DestinationDescriptor> created = List.copyOf(resolver.createdDestinations());
            return new ImportResult(
                    Collections.unmodifiableMap(frozen),
                    created,
                    List.copyOf(skippedRows),
                    stats);
        }
    }
}
