package com.bank.billshock.controller;

import com.bank.billshock.io.CsvDatasetReader;
import com.bank.billshock.io.CsvDatasetWriter;
import com.bank.billshock.model.Dataset;
import com.bank.billshock.model.DetectionReport;
import com.bank.billshock.model.DetectionRequest;
import com.bank.billshock.model.DetectionResponse;
import com.bank.billshock.model.ErrorKind;
import com.bank.billshock.model.PipelineResult;
import com.bank.billshock.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Score transactions against the stored model and return bill shocks")
public class DetectionController {

    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final AnomalyDetectionService detectionService;
    private final CsvDatasetReader datasetReader;
    private final CsvDatasetWriter datasetWriter;

    public DetectionController(AnomalyDetectionService detectionService,
                               CsvDatasetReader datasetReader,
                               CsvDatasetWriter datasetWriter) {
        this.detectionService = detectionService;
        this.datasetReader = datasetReader;
        this.datasetWriter = datasetWriter;
    }

    @Operation(summary = "Detect bill shocks in JSON rows",
            description = "Scores every row's amount against the stored model. Only rows labelled Bill Shock are " +
                    "returned, in input order, with all submitted columns plus the Anomaly column.")
    @PostMapping
    public ResponseEntity<?> detect(@Valid @RequestBody DetectionRequest request) {
        return respond(detectionService.detectAnomalies(Dataset.fromRows(request.getRecords())));
    }

    @Operation(summary = "Detect bill shocks in an uploaded CSV file")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> detectUpload(
            @Parameter(description = "CSV file with a header row and an amount column")
            @RequestParam("file") MultipartFile file) {
        Dataset dataset;
        try (InputStream in = file.getInputStream()) {
            dataset = datasetReader.read(in);
        } catch (IOException e) {
            return unreadableUpload(file, e);
        }
        return respond(detectionService.detectAnomalies(dataset));
    }

    @Operation(summary = "Export bill shocks from an uploaded CSV file as CSV",
            description = "Same as /upload but returns the flagged rows as CSV with the Anomaly column appended.")
    @PostMapping(value = "/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> export(
            @Parameter(description = "CSV file with a header row and an amount column")
            @RequestParam("file") MultipartFile file) {
        Dataset dataset;
        try (InputStream in = file.getInputStream()) {
            dataset = datasetReader.read(in);
        } catch (IOException e) {
            return unreadableUpload(file, e);
        }

        PipelineResult<DetectionReport> result = detectionService.detectAnomalies(dataset);
        if (!result.isSuccess()) {
            return FailureResponses.of(result.getErrorKind(), result.getErrorMessage());
        }

        StringWriter csv = new StringWriter();
        try {
            datasetWriter.write(result.getValue().getAnomalies(), csv);
        } catch (IOException e) {
            log.error("Failed to write detection results as CSV", e);
            return FailureResponses.of(ErrorKind.UNEXPECTED, "Failed to write CSV: " + e.getMessage());
        }
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header("Content-Disposition", "attachment; filename=\"transactions_with_anomalies.csv\"")
                .body(csv.toString());
    }

    private ResponseEntity<?> respond(PipelineResult<DetectionReport> result) {
        if (!result.isSuccess()) {
            return FailureResponses.of(result.getErrorKind(), result.getErrorMessage());
        }
        return ResponseEntity.ok(DetectionResponse.from(result.getValue()));
    }

    private ResponseEntity<Map<String, Object>> unreadableUpload(MultipartFile file, IOException e) {
        log.warn("Could not read uploaded file {}: {}", file.getOriginalFilename(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ErrorKind.WRONG_FORMAT.name(),
                        "message", "Could not parse CSV file. Check file format!"));
    }
}
