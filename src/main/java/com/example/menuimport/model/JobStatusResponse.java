package com.example.menuimport.model;

import java.time.Instant;

public record JobStatusResponse(
        String jobId,
        ImportJobStatus status,
        ImportMode mode,
        String source,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        long totalRows,
        long processedRows,
        int progressPercent,
        String stage,
        long importedRecords,
        long skippedRows,
        long createdDestinations,
        String errorMessage) {

    public static JobStatusResponse from(ImportJob job) {
        return from(job, null);
    }

    public static JobStatusResponse from(ImportJob job, ImportProgress liveProgress) {
        long processed = liveProgress != null ? liveProgress.processed() : job.getProcessedRows();
        int percent = liveProgress != null ? liveProgress.percentage() : job.getProgressPercent();
        return new JobStatusResponse(
                job.getId(),
                job.getStatus(),
                job.getMode(),
                job.getSource(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getTotalRows(),
                processed,
                percent,
                liveProgress != null ? liveProgress.stage() : null,
                job.getImportedRecords(),
                job.getSkippedRows(),
                job.getCreatedDestinations(),
                job.getErrorMessage());
    }
}
