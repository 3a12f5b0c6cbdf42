package com.assethealth.anomaly.controller;

import com.assethealth.anomaly.model.AnalysisResponse;
import com.assethealth.anomaly.model.AnalysisRun;
import com.assethealth.anomaly.model.RunParameters;
import com.assethealth.anomaly.service.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/analyses")
@Tag(name = "Analyses", description = "Upload time-series CSV files for abnormality scoring and retrieve stored runs")
public class AnalysisController {

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @Operation(summary = "Score an uploaded CSV",
            description = "Trains an Isolation Forest on the training window (default: the first 120 hours), scores every " +
                    "analysis-window row on a 0-100 scale and names its top 7 contributing features. " +
                    "Returns the summary, the validation report and every augmented row.")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalysisResponse> analyze(
            @Parameter(description = "CSV file with a timestamp column and numeric feature columns")
            @RequestParam(value = "file", required = false) MultipartFile file,
            @Parameter(description = "Expected anomaly proportion in (0, 0.5]", example = "0.1")
            @RequestParam(required = false) Double contamination,
            @Parameter(description = "Seed for the isolation forest", example = "42")
            @RequestParam(required = false) Long randomState,
            @Parameter(description = "Name of the timestamp column", example = "Time")
            @RequestParam(required = false) String timestampColumn,
            @Parameter(description = "Inclusive training window start", example = "2004-01-01T00:00:00")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime trainingStart,
            @Parameter(description = "Inclusive training window end", example = "2004-01-05T23:59:59")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime trainingEnd,
            @Parameter(description = "Inclusive analysis window start")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime analysisStart,
            @Parameter(description = "Inclusive analysis window end")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime analysisEnd)
            throws IOException {

        String problem = checkUpload(file);
        if (problem != null) {
            return ResponseEntity.badRequest().body(failure(problem));
        }

        RunParameters params = RunParameters.builder()
                .contamination(contamination)
                .randomState(randomState)
                .timestampColumn(timestampColumn)
                .trainingStart(trainingStart)
                .trainingEnd(trainingEnd)
                .analysisStart(analysisStart)
                .analysisEnd(analysisEnd)
                .build();

        AnalysisRun run;
        try (InputStream in = file.getInputStream()) {
            run = analysisService.analyze(file.getOriginalFilename(), in, params);
        }

        return ResponseEntity.ok(AnalysisResponse.builder()
                .success(true)
                .runId(run.getRunId())
                .filename(run.getFilename())
                .processingTime(run.getSummary().getProcessingTime())
                .summary(run.getSummary())
                .report(run.getReport())
                .data(analysisService.toRows(run.getResult()))
                .build());
    }

    @Operation(summary = "Score an uploaded CSV, summary only",
            description = "Same pipeline as the full analysis with default parameters, but the rows are left out of the " +
                    "response. Use the returned run id to download the augmented CSV.")
    @PostMapping(value = "/summary", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalysisResponse> analyzeSummary(
            @Parameter(description = "CSV file with a timestamp column and numeric feature columns")
            @RequestParam(value = "file", required = false) MultipartFile file) throws IOException {

        String problem = checkUpload(file);
        if (problem != null) {
            return ResponseEntity.badRequest().body(failure(problem));
        }

        AnalysisRun run;
        try (InputStream in = file.getInputStream()) {
            run = analysisService.analyze(file.getOriginalFilename(), in, RunParameters.defaults());
        }

        return ResponseEntity.ok(AnalysisResponse.builder()
                .success(true)
                .runId(run.getRunId())
                .filename(run.getFilename())
                .processingTime(run.getSummary().getProcessingTime())
                .summary(run.getSummary())
                .report(run.getReport())
                .message("Use /api/v1/analyses/" + run.getRunId() + "/download to get full results.")
                .build());
    }

    @Operation(summary = "Get a stored run",
            description = "Returns the summary and validation report of a previously completed run.")
    @GetMapping("/{runId}")
    public ResponseEntity<AnalysisRun> getRun(
            @Parameter(description = "Run identifier returned by an upload")
            @PathVariable String runId) {
        AnalysisRun run = analysisService.findRun(runId);
        if (run == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(run);
    }

    @Operation(summary = "Download the augmented CSV of a stored run",
            description = "Original columns followed by Abnormality_score and top_feature_1 to top_feature_7.")
    @GetMapping(value = "/{runId}/download", produces = "text/csv")
    public ResponseEntity<String> download(
            @Parameter(description = "Run identifier returned by an upload")
            @PathVariable String runId) {
        String csv = analysisService.findOutputCsv(runId);
        if (csv == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"anomaly_results_" + runId + ".csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    private static String checkUpload(MultipartFile file) {
        if (file == null) {
            return "No file provided";
        }
        if (file.isEmpty()) {
            return "Uploaded file is empty";
        }
        String name = file.getOriginalFilename();
        if (name == null || !name.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return "Only CSV files are supported";
        }
        return null;
    }

    private static AnalysisResponse failure(String message) {
        return AnalysisResponse.builder().success(false).message(message).build();
    }
}
