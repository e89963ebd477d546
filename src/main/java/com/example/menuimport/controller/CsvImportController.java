package com.example.menuimport.controller;

import com.example.menuimport.model.CsvPreviewResponse;
import com.example.menuimport.model.ImportJob;
import com.example.menuimport.model.ImportMode;
import com.example.menuimport.model.ImportRequest;
import com.example.menuimport.model.ImportResult;
import com.example.menuimport.model.JobCreatedResponse;
import com.example.menuimport.model.JobStatusResponse;
import com.example.menuimport.model.UploadOptions;
import com.example.menuimport.service.CsvImportService;
import com.example.menuimport.support.ImportProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CsvImportController {

    private final CsvImportService csvImportService;

    @PostMapping(value = "/imports", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobCreatedResponse> submit(@RequestBody ImportRequest request) {
        ImportJob job = csvImportService.submit(request);
        log.info("Accepted import job={} rows={}", job.getId(), job.getTotalRows());
        return accepted(job);
    }

    @PostMapping(value = "/imports/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<JobCreatedResponse> upload(@RequestPart("file") MultipartFile file,
                                                     @RequestParam(value = "mode", required = false) String mode,
                                                     @RequestParam(value = "allowCreateDestinations",
                                                             defaultValue = "false") boolean allowCreateDestinations,
                                                     @RequestPart(value = "options", required = false)
                                                     UploadOptions options) {
        ImportJob job = csvImportService.submitUpload(file, ImportMode.fromWireName(mode), allowCreateDestinations,
                options);
        log.info("Accepted import job={} file={} rows={}", job.getId(), job.getSource(), job.getTotalRows());
        return accepted(job);
    }

    @PostMapping(value = "/imports/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CsvPreviewResponse> preview(@RequestPart("file") MultipartFile file) {
        return ResponseEntity.ok(csvImportService.preview(file));
    }

    @GetMapping("/imports/{jobId}")
    public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
        JobStatusResponse status = csvImportService.status(jobId);
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    @GetMapping("/imports/{jobId}/result")
    public ResponseEntity<ImportResult> getResult(@PathVariable String jobId) {
        return csvImportService.findResult(jobId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/imports/{jobId}/cancel")
    public ResponseEntity<JobStatusResponse> cancel(@PathVariable String jobId) {
        ImportJob job = csvImportService.cancel(jobId);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(JobStatusResponse.from(job));
    }

    @DeleteMapping("/imports/{jobId}")
    public ResponseEntity<Void> deleteJob(@PathVariable String jobId) {
        if (!csvImportService.deleteJob(jobId)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Deleted import job={}", jobId);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler({ ImportProcessingException.class, IllegalArgumentException.class })
    public ResponseEntity<String> handleRejectedImport(RuntimeException exception) {
        log.warn("Import request rejected: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(exception.getMessage());
    }

    private static ResponseEntity<JobCreatedResponse> accepted(ImportJob job) {
        return ResponseEntity.accepted()
            .location(ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/api/v1/imports/{jobId}")
                .buildAndExpand(job.getId())
                .toUri())
            .body(JobCreatedResponse.from(job));
    }
}
