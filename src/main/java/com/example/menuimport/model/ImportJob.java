package com.example.menuimport.model;

import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Getter
@Setter
@ToString
@NoArgsConstructor
@Document(collection = "import_jobs")
public class ImportJob {

    @Id
    private String id;
    private ImportJobStatus status;
    private ImportMode mode;
    private String source;
    private boolean allowCreateDestinations;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private long totalRows;
    private long processedRows;
    private long importedRecords;
    private long skippedRows;
    private long createdDestinations;
    private int progressPercent;
    private String errorMessage;
}
