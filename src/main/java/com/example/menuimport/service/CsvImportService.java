package com.example.menuimport.service;

import com.example.menuimport.model.CsvPreviewResponse;
import com.example.menuimport.model.CsvTable;
import com.example.menuimport.model.CsvUpload;
import com.example.menuimport.model.DestinationDescriptor;
import com.example.menuimport.model.ImportJob;
import com.example.menuimport.model.ImportJobStatus;
import com.example.menuimport.model.ImportMode;
import com.example.menuimport.model.ImportProgress;
import com.example.menuimport.model.ImportRequest;
import com.example.menuimport.model.ImportResult;
import com.example.menuimport.model.JobStatusResponse;
import com.example.menuimport.model.UploadOptions;
import com.example.menuimport.support.CsvRowReader;
import com.example.menuimport.support.ImportCancelledException;
import com.example.menuimport.support.ImportProcessingException;
import com.example.menuimport.worker.CsvImportWorkerHost;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@Service
public class CsvImportService {

    private static final String API_SOURCE = "api";
    private static final String UNKNOWN_FILENAME = "upload.csv";

    private final MongoTemplate mongoTemplate;
    private final CsvImportWorkerHost workerHost;
    private final CsvRowReader rowReader;
    private final ColumnMappingSuggester mappingSuggester;
    private final ImportResultStore resultStore;

    private final AtomicReference<String> activeJobId = new AtomicReference<>();

    public CsvImportService(MongoTemplate mongoTemplate,
            CsvImportWorkerHost workerHost,
            CsvRowReader rowReader,
            ColumnMappingSuggester mappingSuggester,
            ImportResultStore resultStore) {
        this.mongoTemplate = mongoTemplate;
        this.workerHost = workerHost;
        this.rowReader = rowReader;
        this.mappingSuggester = mappingSuggester;
        this.resultStore = resultStore;
    }

    public ImportJob submit(ImportRequest request) {
        if (request == null || request.mode() == null) {
            throw new ImportProcessingException("Import mode is required");
        }
        return enqueue(request, API_SOURCE);
    }

    public ImportJob submitUpload(MultipartFile file, ImportMode mode, boolean allowCreateDestinations,
            UploadOptions options) {
        String filename = requireFile(file);
        CsvTable table = readUpload(file, filename).table();
        if (table.rows().isEmpty()) {
            throw new ImportProcessingException("CSV file %s contains no data rows".formatted(filename));
        }

        ImportMode effectiveMode = mode != null
                ? mode
                : mappingSuggester.detectMode(table.headers()).orElseThrow(() -> new ImportProcessingException(
                        "Could not detect the import mode from the CSV headers; pass mode explicitly"));

        Map<String, String> mapping = options != null && options.columnMapping() != null
                && !options.columnMapping().isEmpty()
                ? options.columnMapping()
                : mappingSuggester.suggest(table.headers(), effectiveMode);
        List<String> missing = mappingSuggester.missingRequiredFields(mapping, effectiveMode);
        if (!missing.isEmpty()) {
            throw new ImportProcessingException(
                    "Column mapping is missing required fields: " + String.join(", ", missing));
        }

        List<DestinationDescriptor> existing = options != null ? options.existingDestinations() : null;
        return enqueue(new ImportRequest(table.rows(), mapping, effectiveMode, existing, allowCreateDestinations),
                filename);
    }

    public CsvPreviewResponse preview(MultipartFile file) {
        String filename = requireFile(file);
        CsvUpload upload = readUpload(file, filename);
        CsvTable table = upload.table();
        Optional<ImportMode> detected = mappingSuggester.detectMode(table.headers());
        Map<String, String> suggested = detected
                .map(mode -> mappingSuggester.suggest(table.headers(), mode))
                .orElse(Map.of());
        List<String> missing = detected
                .map(mode -> mappingSuggester.missingRequiredFields(suggested, mode))
                .orElse(List.of());
        return new CsvPreviewResponse(filename, upload.encoding(), table.headers(), table.rows().size(),
                detected.orElse(null), suggested, missing);
    }

    public ImportJob findJob(String jobId) {
        return mongoTemplate.findById(jobId, ImportJob.class);
    }

    public JobStatusResponse status(String jobId) {
        ImportJob job = findJob(jobId);
        if (job == null) {
            return null;
        }
        ImportProgress live = jobId.equals(activeJobId.get()) ? workerHost.progress().orElse(null) : null;
        return JobStatusResponse.from(job, live);
    }

    public Optional<ImportResult> findResult(String jobId) {
        return resultStore.get(jobId);
    }

    public ImportJob cancel(String jobId) {
        ImportJob job = findJob(jobId);
        if (job == null) {
            return null;
        }
        if (!job.getStatus().isActive() || !jobId.equals(activeJobId.get())) {
            throw new ImportProcessingException("Import job %s is not running".formatted(jobId));
        }
        log.info("Cancellation requested for import job={}", jobId);
        workerHost.cancel();
        return job;
    }

    public boolean deleteJob(String jobId) {
        ImportJob job = findJob(jobId);
        if (job == null) {
            return false;
        }
        if (job.getStatus().isActive()) {
            throw new ImportProcessingException("Cannot delete an import job while it is running");
        }
        mongoTemplate.remove(job);
        resultStore.remove(jobId);
        return true;
    }

    /**
     * Rejection check, orphan sweep and run start happen as one step; a concurrent submission
     * never sees another submission's half-started job.
     */
    private synchronized ImportJob enqueue(ImportRequest request, String source) {
        if (jobInProgress()) {
            throw new ImportProcessingException("An import job is already running. Please wait for it to finish.");
        }

        ImportJob job = createPendingJob(request, source);
        mongoTemplate.save(job);

        job.setStatus(ImportJobStatus.RUNNING);
        job.setStartedAt(Instant.now());
        mongoTemplate.save(job);

        CompletableFuture<ImportResult> run;
        try {
            run = workerHost.start(request);
        } catch (ImportProcessingException ex) {
            markFailed(job, ex.getMessage());
            throw ex;
        }
        activeJobId.set(job.getId());
        log.info("Started import job={} mode={} rows={} source={}",
                job.getId(), request.mode().wireName(), request.rows().size(), source);

        String jobId = job.getId();
        run.whenComplete((result, failure) -> recordOutcome(jobId, result, failure));
        return job;
    }

    private void recordOutcome(String jobId, ImportResult result, Throwable failure) {
        try {
            ImportJob job = mongoTemplate.findById(jobId, ImportJob.class);
            if (job == null) {
                log.warn("Import job {} disappeared before its outcome was recorded", jobId);
                return;
            }
            job.setCompletedAt(Instant.now());
            if (failure == null) {
                resultStore.put(jobId, result);
                job.setStatus(ImportJobStatus.SUCCEEDED);
                job.setProcessedRows(job.getTotalRows());
                job.setProgressPercent(100);
                job.setImportedRecords(result.stats().totalProcessed());
                job.setSkippedRows(result.stats().totalSkipped());
                job.setCreatedDestinations(result.createdShelves().size());
                log.info("Import job={} succeeded imported={} skipped={} createdDestinations={}",
                        jobId, job.getImportedRecords(), job.getSkippedRows(), job.getCreatedDestinations());
            } else {
                Throwable cause = unwrap(failure);
                job.setStatus(cause instanceof ImportCancelledException
                        ? ImportJobStatus.CANCELLED
                        : ImportJobStatus.FAILED);
                job.setErrorMessage(cause.getMessage());
                log.warn("Import job={} finished with status={}: {}", jobId, job.getStatus(), cause.getMessage());
            }
            mongoTemplate.save(job);
        } catch (RuntimeException ex) {
            log.error("Failed to record outcome of import job {}: {}", jobId, ex.getMessage(), ex);
        } finally {
            activeJobId.compareAndSet(jobId, null);
        }
    }

    /**
     * A job is in progress until its outcome is recorded, not just while the host runs it. A job
     * document still marked active once both are idle belongs to a process that stopped mid-run;
     * it is closed out as failed instead of blocking new imports.
     */
    private boolean jobInProgress() {
        if (workerHost.isProcessing() || activeJobId.get() != null) {
            log.warn("Rejecting import request because another job is in progress");
            return true;
        }
        Query query = Query.query(Criteria.where("status").in(ImportJobStatus.PENDING, ImportJobStatus.RUNNING));
        List<ImportJob> orphaned = mongoTemplate.find(query, ImportJob.class);
        for (ImportJob job : orphaned) {
            log.warn("Closing orphaned import job={} left in status={}", job.getId(), job.getStatus());
            markFailed(job, "Interrupted before completion");
        }
        return false;
    }

    private void markFailed(ImportJob job, String message) {
        job.setStatus(ImportJobStatus.FAILED);
        job.setCompletedAt(Instant.now());
        job.setErrorMessage(message);
        mongoTemplate.save(job);
    }

    private ImportJob createPendingJob(ImportRequest request, String source) {
        ImportJob job = new ImportJob();
        job.setId(UUID.randomUUID().toString());
        job.setStatus(ImportJobStatus.PENDING);
        job.setMode(request.mode());
        job.setSource(source);
        job.setAllowCreateDestinations(request.allowCreateDestinations());
        job.setCreatedAt(Instant.now());
        job.setTotalRows(request.rows().size());
        return job;
    }

    private CsvUpload readUpload(MultipartFile file, String filename) {
        try (InputStream in = file.getInputStream()) {
            return rowReader.read(in, filename);
        } catch (IOException ex) {
            throw new ImportProcessingException("Failed to read uploaded file %s".formatted(filename), ex);
        }
    }

    private static String requireFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ImportProcessingException("A non-empty CSV file is required");
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || originalFilename.isBlank()) {
            return UNKNOWN_FILENAME;
        }
        return originalFilename.trim();
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
