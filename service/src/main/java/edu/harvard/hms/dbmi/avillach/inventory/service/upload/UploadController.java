package edu.harvard.hms.dbmi.avillach.inventory.service.upload;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadBatch;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.ValidationReport;
import edu.harvard.hms.dbmi.avillach.inventory.data.query.UploadSummary;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.batch.UploadBatchRepository;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline.IngestionPipeline;
import edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline.RawBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.NoSuchElementException;

@RestController
public class UploadController {

    private static final Logger log = LoggerFactory.getLogger(UploadController.class);

    private final IngestionPipeline ingestionPipeline;

    private final UploadBatchRepository uploadBatchRepository;

    @Autowired
    public UploadController(IngestionPipeline ingestionPipeline, UploadBatchRepository uploadBatchRepository) {
        this.ingestionPipeline = ingestionPipeline;
        this.uploadBatchRepository = uploadBatchRepository;
    }

    /**
     * Validates and merges an uploaded file. The format defaults to the file's extension.
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UploadSummary> upload(
        @RequestParam("file") MultipartFile file, @RequestParam("sourceSystem") String sourceSystem,
        @RequestParam(value = "format", required = false) String format,
        @RequestParam(value = "schemaVersion", required = false) Integer schemaVersion,
        @RequestParam(value = "dataset", required = false) String dataset,
        @RequestParam(value = "sheetName", required = false) String sheetName,
        @RequestParam(value = "submitter", required = false) String submitter
    ) throws IOException {
        UploadFormat uploadFormat = UploadFormat.fromName(format != null ? format : file.getOriginalFilename());
        log.info("Upload of {} ({}, {} bytes) from {}", file.getOriginalFilename(), uploadFormat, file.getSize(), sourceSystem);
        UploadBatch batch = ingestionPipeline.ingest(
            new RawBatch(uploadFormat, file.getBytes(), dataset, sheetName), schemaVersion, sourceSystem, submitter
        );
        return ResponseEntity.ok(summarize(batch));
    }

    @GetMapping(value = "/batches", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<UploadSummary> batches() {
        return uploadBatchRepository.findAll().stream().map(UploadController::summarize).toList();
    }

    @GetMapping(value = "/batches/{batchId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public UploadBatch batch(@PathVariable String batchId) {
        return find(batchId);
    }

    @GetMapping(value = "/batches/{batchId}/report", produces = MediaType.APPLICATION_JSON_VALUE)
    public ValidationReport report(@PathVariable String batchId) {
        return find(batchId).report();
    }

    private UploadBatch find(String batchId) {
        return uploadBatchRepository.find(batchId).orElseThrow(() -> new NoSuchElementException("Batch " + batchId + " does not exist"));
    }

    static UploadSummary summarize(UploadBatch batch) {
        ValidationReport report = batch.report();
        return new UploadSummary(
            batch.batchId(), batch.outcome().name(), report.getAcceptedCount(), report.getRejectedCount(), report.getAmbiguousCount(),
            batch.cancelled(), "/batches/" + batch.batchId() + "/report"
        );
    }
}
