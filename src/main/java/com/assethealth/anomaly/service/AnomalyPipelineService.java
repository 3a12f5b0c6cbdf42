package com.assethealth.anomaly.service;

import com.assethealth.anomaly.config.ScoringProperties;
import com.assethealth.anomaly.csv.TimeSeriesCsvReader;
import com.assethealth.anomaly.engine.AnomalyDetector;
import com.assethealth.anomaly.engine.DataProcessor;
import com.assethealth.anomaly.engine.ScoreTransformer;
import com.assethealth.anomaly.engine.isolationforest.IsolationForest;
import com.assethealth.anomaly.model.AnalysisResult;
import com.assethealth.anomaly.model.AnomalyRecord;
import com.assethealth.anomaly.model.PipelineStage;
import com.assethealth.anomaly.model.PipelineWarning;
import com.assethealth.anomaly.model.PreparedData;
import com.assethealth.anomaly.model.RawTable;
import com.assethealth.anomaly.model.RunParameters;
import com.assethealth.anomaly.model.TimeSeriesFrame;
import com.assethealth.anomaly.model.TimeWindow;
import com.assethealth.anomaly.model.TransformedScores;
import com.assethealth.anomaly.model.ValidationReport;
import com.assethealth.anomaly.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs one scoring job end to end.
 *
 * Stages run strictly in order:
 *   LOAD -> VALIDATE -> PREPROCESS -> SPLIT -> TRAIN -> SCORE -> ATTRIBUTE -> TRANSFORM
 *   -> VALIDATE_SUCCESS_CRITERIA -> EMIT
 *
 * A {@link com.assethealth.anomaly.exception.PipelineException} from any stage aborts the run
 * before anything is emitted.
 * Non-fatal conditions are collected as warnings in the {@link ValidationReport}.
 */
@Service
public class AnomalyPipelineService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPipelineService.class);

    private final ScoringProperties properties;
    private final TimeSeriesCsvReader csvReader;
    private final DataProcessor dataProcessor;
    private final AnomalyDetector anomalyDetector;
    private final ScoreTransformer scoreTransformer;

    public AnomalyPipelineService(ScoringProperties properties,
                                  TimeSeriesCsvReader csvReader,
                                  DataProcessor dataProcessor,
                                  AnomalyDetector anomalyDetector,
                                  ScoreTransformer scoreTransformer) {
        this.properties = properties;
        this.csvReader = csvReader;
        this.dataProcessor = dataProcessor;
        this.anomalyDetector = anomalyDetector;
        this.scoreTransformer = scoreTransformer;
    }

    public AnalysisResult run(InputStream csv, RunParameters params) {
        log.info("Starting anomaly detection run");
        RawTable table = csvReader.read(csv);
        return run(table, params);
    }

    public AnalysisResult run(RawTable table, RunParameters params) {
        double contamination = params.getContamination() != null
                ? params.getContamination() : properties.getContamination();
        long seed = params.getRandomState() != null ? params.getRandomState() : properties.getRandomState();
        String timestampColumn = params.getTimestampColumn() != null && !params.getTimestampColumn().isBlank()
                ? params.getTimestampColumn() : properties.getTimestampColumn();

        log.info("Stage {}", PipelineStage.VALIDATE);
        anomalyDetector.validateContamination(contamination);
        TimeSeriesFrame validated = dataProcessor.validate(table, timestampColumn);

        log.info("Stage {}", PipelineStage.PREPROCESS);
        TimeSeriesFrame frame = dataProcessor.fillMissing(validated);

        log.info("Stage {}", PipelineStage.SPLIT);
        PreparedData data = dataProcessor.prepare(frame,
                window(params.getTrainingStart(), params.getTrainingEnd()),
                window(params.getAnalysisStart(), params.getAnalysisEnd()));

        log.info("Stage {}", PipelineStage.TRAIN);
        IsolationForest forest = anomalyDetector.fit(data, seed);

        log.info("Stage {}", PipelineStage.SCORE);
        double[] trainingRaw = anomalyDetector.score(forest, data.getScaledTraining());
        double[] analysisRaw = anomalyDetector.score(forest, data.getScaledAnalysis());

        log.info("Stage {}", PipelineStage.ATTRIBUTE);
        double[][] contributions = anomalyDetector.attribute(forest, data.getScaledAnalysis(),
                analysisRaw, data.trainingMeans());

        log.info("Stage {}", PipelineStage.TRANSFORM);
        TransformedScores scores = scoreTransformer.transform(trainingRaw, analysisRaw, contributions,
                data.getModeledFeatures(), contamination);

        log.info("Stage {}", PipelineStage.VALIDATE_SUCCESS_CRITERIA);
        List<PipelineWarning> warnings = new ArrayList<>(frame.getWarnings());
        warnings.addAll(data.getWarnings());
        ValidationReport report = validateSuccessCriteria(data, scores, warnings, contamination, seed);

        log.info("Stage {}", PipelineStage.EMIT);
        AnalysisResult result = emit(data, scores, report);

        log.info("Anomaly detection completed: {} rows scored, {} warning(s), criteria {}",
                result.rowCount(), report.getWarnings().size(), report.isPassed() ? "passed" : "not met");
        return result;
    }

    ValidationReport validateSuccessCriteria(PreparedData data, TransformedScores scores,
                                             List<PipelineWarning> warnings,
                                             double contamination, long seed) {
        double[] training = scores.getTrainingScores();
        double mean = Arrays.stream(training).average().orElse(0.0);
        double max = Arrays.stream(training).max().orElse(0.0);
        log.info("Training period - Mean score: {}, Max score: {}", round(mean), round(max));

        boolean meanExceeded = mean >= properties.getTrainingMeanThreshold();
        boolean maxExceeded = max >= properties.getTrainingMaxThreshold();
        if (meanExceeded || maxExceeded) {
            String message = String.format(
                    "Training period scores exceed thresholds (mean %.2f, limit %.1f; max %.2f, limit %.1f); "
                            + "the training window may contain anomalies",
                    mean, properties.getTrainingMeanThreshold(), max, properties.getTrainingMaxThreshold());
            log.warn(message);
            warnings.add(PipelineWarning.of(WarningType.TRAINING_ANOMALY, message));
        }

        double threshold = scores.getExpectedAnomalyThreshold();
        int above = (int) Arrays.stream(scores.getAnalysisScores()).filter(s -> s > threshold).count();

        return ValidationReport.builder()
                .trainingMeanScore(round(mean))
                .trainingMaxScore(round(max))
                .meanThreshold(properties.getTrainingMeanThreshold())
                .maxThreshold(properties.getTrainingMaxThreshold())
                .passed(!meanExceeded && !maxExceeded)
                .warnings(List.copyOf(warnings))
                .modeledFeatures(data.getModeledFeatures())
                .droppedConstantFeatures(data.getDroppedFeatures())
                .trainingWindow(data.getTrainingWindow().toString())
                .analysisWindow(data.getAnalysisWindow().toString())
                .trainingHours(data.getTrainingDuration().toSeconds() / 3600.0)
                .trainingRowCount(data.getTrainingRows().length)
                .analysisRowCount(data.getAnalysisRows().length)
                .contamination(contamination)
                .randomState(seed)
                .expectedAnomalyThreshold(round(threshold))
                .rowsAboveExpectedThreshold(above)
                .build();
    }

    /**
     * Original columns (gaps filled) followed by the score and the seven top-feature columns,
     * one row per analysis-window row in input order.
     */
    AnalysisResult emit(PreparedData data, TransformedScores scores, ValidationReport report) {
        TimeSeriesFrame frame = data.getFrame();
        List<String> columns = new ArrayList<>(frame.getColumns());
        columns.add(AnomalyRecord.SCORE_COLUMN);
        for (int k = 1; k <= AnomalyRecord.TOP_FEATURE_COUNT; k++) {
            columns.add(AnomalyRecord.TOP_FEATURE_PREFIX + k);
        }

        int[] analysisRows = data.getAnalysisRows();
        int originalWidth = frame.getColumns().size();
        List<String[]> rows = new ArrayList<>(analysisRows.length);
        List<AnomalyRecord> records = new ArrayList<>(analysisRows.length);

        for (int i = 0; i < analysisRows.length; i++) {
            int rowIndex = analysisRows[i];
            double score = round(scores.getAnalysisScores()[i]);
            List<String> top = scores.getTopFeatures().get(i);

            String[] out = Arrays.copyOf(frame.cellsAt(rowIndex), columns.size());
            out[originalWidth] = Double.toString(score);
            for (int k = 0; k < AnomalyRecord.TOP_FEATURE_COUNT; k++) {
                out[originalWidth + 1 + k] = top.get(k);
            }
            rows.add(out);

            records.add(AnomalyRecord.builder()
                    .rowIndex(rowIndex)
                    .timestamp(frame.timestampAt(rowIndex))
                    .score(score)
                    .topFeatures(List.copyOf(top))
                    .build());
        }

        return AnalysisResult.builder()
                .columns(List.copyOf(columns))
                .rows(rows)
                .records(records)
                .report(report)
                .build();
    }

    private static TimeWindow window(LocalDateTime start, LocalDateTime end) {
        if (start == null && end == null) {
            return null;
        }
        return new TimeWindow(start, end);
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
