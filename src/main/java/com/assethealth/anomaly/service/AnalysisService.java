package com.assethealth.anomaly.service;

import com.assethealth.anomaly.config.MetricsConfig;
import com.assethealth.anomaly.csv.TimeSeriesCsvWriter;
import com.assethealth.anomaly.exception.PipelineException;
import com.assethealth.anomaly.model.AnalysisResult;
import com.assethealth.anomaly.model.AnalysisRun;
import com.assethealth.anomaly.model.AnalysisSummary;
import com.assethealth.anomaly.model.AnomalyRecord;
import com.assethealth.anomaly.model.PipelineWarning;
import com.assethealth.anomaly.model.RunParameters;
import com.assethealth.anomaly.repository.AnalysisRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs an uploaded file through the pipeline, summarises it and stores the outcome so it
 * can be fetched and downloaded later. Failed runs are never stored.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnomalyPipelineService pipelineService;
    private final AnalysisSummaryService summaryService;
    private final TimeSeriesCsvWriter csvWriter;
    private final AnalysisRunRepository runRepository;
    private final MetricsConfig metricsConfig;

    public AnalysisService(AnomalyPipelineService pipelineService,
                           AnalysisSummaryService summaryService,
                           TimeSeriesCsvWriter csvWriter,
                           AnalysisRunRepository runRepository,
                           MetricsConfig metricsConfig) {
        this.pipelineService = pipelineService;
        this.summaryService = summaryService;
        this.csvWriter = csvWriter;
        this.runRepository = runRepository;
        this.metricsConfig = metricsConfig;
    }

    public AnalysisRun analyze(String filename, InputStream csv, RunParameters params) {
        String runId = UUID.randomUUID().toString();
        long startNanos = System.nanoTime();
        log.info("Run {}: analysing {}", runId, filename);

        AnalysisResult result;
        try {
            result = pipelineService.run(csv, params);
        } catch (PipelineException e) {
            log.error("Run {}: failed at stage {}: {}", runId, e.getStage(), e.getMessage());
            metricsConfig.recordFailure(e.getStage());
            throw e;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        AnalysisSummary summary = summaryService.summarize(result, elapsed.toMillis() / 1000.0);

        AnalysisRun run = AnalysisRun.builder()
                .runId(runId)
                .filename(filename)
                .createdAt(System.currentTimeMillis())
                .summary(summary)
                .report(result.getReport())
                .result(result)
                .build();

        runRepository.save(run, csvWriter.writeToString(result));
        recordMetrics(result, elapsed);

        log.info("Run {}: {} rows in {}s, score range [{}, {}]", runId, summary.getTotalRows(),
                summary.getProcessingTime(), summary.getScoreMin(), summary.getScoreMax());
        return run;
    }

    public AnalysisRun findRun(String runId) {
        return runRepository.findById(runId);
    }

    public String findOutputCsv(String runId) {
        return runRepository.findOutputCsv(runId);
    }

    /**
     * Augmented rows keyed by column name in column order. The score is numeric, every
     * other cell keeps its text.
     */
    public List<Map<String, Object>> toRows(AnalysisResult result) {
        List<String> columns = result.getColumns();
        int scoreColumn = columns.indexOf(AnomalyRecord.SCORE_COLUMN);
        List<Map<String, Object>> rows = new ArrayList<>(result.rowCount());
        for (int r = 0; r < result.rowCount(); r++) {
            String[] cells = result.getRows().get(r);
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                row.put(columns.get(c), c == scoreColumn ? result.getRecords().get(r).getScore() : cells[c]);
            }
            rows.add(row);
        }
        return rows;
    }

    private void recordMetrics(AnalysisResult result, Duration elapsed) {
        metricsConfig.recordRun(result.getReport().isPassed(), result.rowCount(), elapsed);
        for (AnomalyRecord record : result.getRecords()) {
            metricsConfig.recordScore(record.getScore());
        }
        for (PipelineWarning warning : result.getReport().getWarnings()) {
            metricsConfig.recordWarning(warning.getType());
        }
    }
}
