package com.example.menuimport.model;

public record JobCreatedResponse(
        String jobId,
        ImportJobStatus status,
        ImportMode mode,
        String source,
        long totalRows) {

    public static JobCreatedResponse from(ImportJob job) {
        return new JobCreatedResponse(
                job.getId(),
                job.getStatus(),
                job.getMode(),
                job.getSource(),
                job.getTotalRows());
    }
}
