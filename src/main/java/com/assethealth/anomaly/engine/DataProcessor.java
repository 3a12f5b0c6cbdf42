package com.assethealth.anomaly.engine;

import com.assethealth.anomaly.config.ScoringProperties;
import com.assethealth.anomaly.exception.InsufficientDataException;
import com.assethealth.anomaly.exception.SchemaValidationException;
import com.assethealth.anomaly.model.FeatureScaler;
import com.assethealth.anomaly.model.PipelineStage;
import com.assethealth.anomaly.model.PipelineWarning;
import com.assethealth.anomaly.model.PreparedData;
import com.assethealth.anomaly.model.RawTable;
import com.assethealth.anomaly.model.TimeSeriesFrame;
import com.assethealth.anomaly.model.TimeWindow;
import com.assethealth.anomaly.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Validates, cleans, splits and scales an input table.
 *
 * Steps, each exposed separately so the orchestrator can attribute failures to a stage:
 *   validate     - timestamp column, chronological order, numeric feature columns, spacing
 *   fillMissing  - forward fill then backward fill per feature over the whole frame
 *   prepare      - training/analysis windows, constant-feature removal, scaling
 *
 * The scaler is fit on training rows only and applied unchanged to the analysis rows,
 * so analysis-only statistics never leak into what counts as normal.
 */
@Component
public class DataProcessor {

    private static final Logger log = LoggerFactory.getLogger(DataProcessor.class);

    private final ScoringProperties properties;

    public DataProcessor(ScoringProperties properties) {
        this.properties = properties;
    }

    public TimeSeriesFrame validate(RawTable table, String timestampColumn) {
        List<String> header = table.header();
        if (header == null || header.isEmpty()) {
            throw new SchemaValidationException(PipelineStage.VALIDATE, "Input has no header row");
        }
        int tsIndex = header.indexOf(timestampColumn);
        if (tsIndex < 0) {
            throw new SchemaValidationException(PipelineStage.VALIDATE,
                    String.format("Input must contain a '%s' column; found %s", timestampColumn, header));
        }
        if (table.rowCount() == 0) {
            throw new SchemaValidationException(PipelineStage.VALIDATE, "Input has no data rows");
        }

        List<LocalDateTime> timestamps = parseTimestamps(table, tsIndex, timestampColumn);

        List<PipelineWarning> warnings = new ArrayList<>();
        List<String> featureNames = new ArrayList<>();
        List<Integer> featureColumns = new ArrayList<>();
        List<double[]> featureValues = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (int col = 0; col < header.size(); col++) {
            if (col == tsIndex) continue;
            Optional<double[]> parsed = parseNumericColumn(table, col);
            if (parsed.isPresent()) {
                featureNames.add(header.get(col));
                featureColumns.add(col);
                featureValues.add(parsed.get());
            } else {
                skipped.add(header.get(col));
            }
        }

        if (!skipped.isEmpty()) {
            log.warn("Ignoring {} non-numeric column(s): {}", skipped.size(), skipped);
            warnings.add(PipelineWarning.of(WarningType.NON_NUMERIC_COLUMN,
                    String.format("Ignored %d non-numeric column(s): %s", skipped.size(), skipped), skipped));
        }
        if (featureNames.isEmpty()) {
            throw new SchemaValidationException(PipelineStage.VALIDATE, "Input has no numeric feature columns");
        }

        detectIrregularSpacing(timestamps).ifPresent(warnings::add);

        List<String[]> cells = new ArrayList<>(table.rowCount());
        for (String[] row : table.rows()) {
            cells.add(row.clone());
        }

        log.info("Validated input: {} rows, {} numeric features", timestamps.size(), featureNames.size());
        return new TimeSeriesFrame(header, timestampColumn, timestamps, featureNames,
                featureColumns.stream().mapToInt(Integer::intValue).toArray(),
                featureValues.toArray(new double[0][]), cells, warnings);
    }

    /**
     * Forward fill, then backward fill, each feature over the full frame. Filled cells take
     * the text of the cell they were filled from, so the output shows the value the model saw.
     */
    public TimeSeriesFrame fillMissing(TimeSeriesFrame frame) {
        int rows = frame.rowCount();
        int features = frame.featureCount();
        double[][] filled = new double[features][];
        List<String[]> cells = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            cells.add(frame.cellsAt(r).clone());
        }

        for (int f = 0; f < features; f++) {
            double[] values = frame.featureValues(f).clone();
            int col = frame.columnIndexOf(f);
            int missing = 0;

            int lastSeen = -1;
            for (int r = 0; r < rows; r++) {
                if (Double.isNaN(values[r])) {
                    missing++;
                    if (lastSeen >= 0) {
                        values[r] = values[lastSeen];
                        cells.get(r)[col] = cells.get(lastSeen)[col];
                    }
                } else {
                    lastSeen = r;
                }
            }
            int nextSeen = -1;
            for (int r = rows - 1; r >= 0; r--) {
                if (Double.isNaN(values[r])) {
                    values[r] = values[nextSeen];
                    cells.get(r)[col] = cells.get(nextSeen)[col];
                } else {
                    nextSeen = r;
                }
            }

            if (missing > 0) {
                log.info("Filled {} missing value(s) in {}", missing, frame.getFeatureNames().get(f));
            }
            filled[f] = values;
        }

        return new TimeSeriesFrame(frame.getColumns(), frame.getTimestampColumn(), frame.getTimestamps(),
                frame.getFeatureNames(), frame.featureColumnIndices(), filled, cells, frame.getWarnings());
    }

    /**
     * Split into windows, drop features that are constant over the training window, and
     * scale both windows with a scaler fit on training rows.
     *
     * A null window, or a null bound inside one, takes the default: training covers
     * {@code defaultTrainingHours} from its start (the first row by default), analysis covers
     * the whole frame.
     */
    public PreparedData prepare(TimeSeriesFrame frame, TimeWindow trainingWindow, TimeWindow analysisWindow) {
        TimeWindow training = resolveTrainingWindow(frame, trainingWindow);
        TimeWindow analysis = resolveAnalysisWindow(frame, analysisWindow);
        checkBounds("Training", training);
        checkBounds("Analysis", analysis);

        int[] trainingRows = rowsWithin(frame, training);
        int[] analysisRows = rowsWithin(frame, analysis);
        if (trainingRows.length == 0) {
            throw new InsufficientDataException(PipelineStage.SPLIT, "Training window " + training + " contains no rows");
        }
        if (analysisRows.length == 0) {
            throw new InsufficientDataException(PipelineStage.SPLIT, "Analysis window " + analysis + " contains no rows");
        }

        Duration covered = coveredDuration(frame, trainingRows);
        double trainingHours = covered.toSeconds() / 3600.0;
        if (trainingHours < properties.getMinTrainingHours()) {
            throw new InsufficientDataException(PipelineStage.SPLIT,
                    String.format("Insufficient training data: %.1f hours, minimum required: %d",
                            trainingHours, properties.getMinTrainingHours()));
        }
        log.info("Training window {}: {} rows ({} hours)", training, trainingRows.length, trainingHours);
        log.info("Analysis window {}: {} rows", analysis, analysisRows.length);

        List<PipelineWarning> warnings = new ArrayList<>();
        List<Integer> modeled = new ArrayList<>();
        List<String> modeledNames = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (int f = 0; f < frame.featureCount(); f++) {
            if (isConstant(frame.featureValues(f), trainingRows)) {
                dropped.add(frame.getFeatureNames().get(f));
            } else {
                modeled.add(f);
                modeledNames.add(frame.getFeatureNames().get(f));
            }
        }
        if (!dropped.isEmpty()) {
            log.warn("Removing {} constant feature(s): {}", dropped.size(), dropped);
            warnings.add(PipelineWarning.of(WarningType.DEGENERATE_FEATURE,
                    String.format("Dropped %d constant feature(s) from modeling: %s", dropped.size(), dropped),
                    dropped));
        }
        if (modeled.isEmpty()) {
            throw new SchemaValidationException(PipelineStage.PREPROCESS,
                    "No numeric feature varies over the training window");
        }

        double[][] trainingMatrix = matrix(frame, modeled, trainingRows);
        double[][] analysisMatrix = matrix(frame, modeled, analysisRows);
        FeatureScaler scaler = FeatureScaler.fit(trainingMatrix, modeledNames);

        return PreparedData.builder()
                .frame(frame)
                .trainingWindow(training)
                .analysisWindow(analysis)
                .trainingDuration(covered)
                .trainingRows(trainingRows)
                .analysisRows(analysisRows)
                .modeledFeatures(List.copyOf(modeledNames))
                .droppedFeatures(List.copyOf(dropped))
                .scaler(scaler)
                .scaledTraining(scaler.transform(trainingMatrix))
                .scaledAnalysis(scaler.transform(analysisMatrix))
                .warnings(warnings)
                .build();
    }

    private List<LocalDateTime> parseTimestamps(RawTable table, int tsIndex, String timestampColumn) {
        List<LocalDateTime> timestamps = new ArrayList<>(table.rowCount());
        LocalDateTime previous = null;
        for (int r = 0; r < table.rowCount(); r++) {
            String text = table.rows().get(r)[tsIndex];
            // +2: one for the header line, one for 1-based numbering
            int line = r + 2;
            LocalDateTime ts = TimestampParser.parse(text).orElseThrow(() ->
                    new SchemaValidationException(PipelineStage.VALIDATE,
                            String.format("Unparseable %s value '%s' on line %d", timestampColumn, text, line)));
            if (previous != null && !ts.isAfter(previous)) {
                throw new SchemaValidationException(PipelineStage.VALIDATE,
                        String.format("Timestamps must be strictly increasing: %s on line %d follows %s",
                                ts, line, previous));
            }
            timestamps.add(ts);
            previous = ts;
        }
        return timestamps;
    }

    /**
     * A column is numeric when it has at least one value and every non-empty cell parses.
     * Empty and non-finite cells become NaN, i.e. missing.
     */
    private Optional<double[]> parseNumericColumn(RawTable table, int col) {
        double[] values = new double[table.rowCount()];
        boolean seenValue = false;
        for (int r = 0; r < table.rowCount(); r++) {
            String cell = table.rows().get(r)[col];
            if (cell == null || cell.isBlank()) {
                values[r] = Double.NaN;
                continue;
            }
            double v;
            try {
                v = Double.parseDouble(cell.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            if (Double.isFinite(v)) {
                values[r] = v;
                seenValue = true;
            } else {
                values[r] = Double.NaN;
            }
        }
        return seenValue ? Optional.of(values) : Optional.empty();
    }

    private Optional<PipelineWarning> detectIrregularSpacing(List<LocalDateTime> timestamps) {
        TreeSet<Duration> deltas = new TreeSet<>();
        for (int i = 1; i < timestamps.size(); i++) {
            deltas.add(Duration.between(timestamps.get(i - 1), timestamps.get(i)));
        }
        if (deltas.size() <= 1) {
            return Optional.empty();
        }
        String message = String.format("Time intervals are not regular: %d distinct intervals between %s and %s",
                deltas.size(), deltas.first(), deltas.last());
        log.warn(message);
        return Optional.of(PipelineWarning.of(WarningType.IRREGULAR_SPACING, message));
    }

    private TimeWindow resolveTrainingWindow(TimeSeriesFrame frame, TimeWindow requested) {
        LocalDateTime start = requested != null && requested.start() != null
                ? requested.start() : frame.timestampAt(0);
        LocalDateTime end = requested != null && requested.end() != null
                ? requested.end()
                // inclusive end, one nanosecond short of start + N hours
                : start.plusHours(properties.getDefaultTrainingHours()).minusNanos(1);
        return new TimeWindow(start, end);
    }

    private TimeWindow resolveAnalysisWindow(TimeSeriesFrame frame, TimeWindow requested) {
        LocalDateTime start = requested != null && requested.start() != null
                ? requested.start() : frame.timestampAt(0);
        LocalDateTime end = requested != null && requested.end() != null
                ? requested.end() : frame.timestampAt(frame.rowCount() - 1);
        return new TimeWindow(start, end);
    }

    private void checkBounds(String name, TimeWindow window) {
        if (window.end().isBefore(window.start())) {
            throw new SchemaValidationException(PipelineStage.SPLIT, name + " window ends before it starts: " + window);
        }
    }

    private int[] rowsWithin(TimeSeriesFrame frame, TimeWindow window) {
        List<LocalDateTime> timestamps = frame.getTimestamps();
        int[] rows = new int[timestamps.size()];
        int count = 0;
        for (int r = 0; r < timestamps.size(); r++) {
            if (window.contains(timestamps.get(r))) rows[count++] = r;
        }
        return Arrays.copyOf(rows, count);
    }

    /**
     * Timestamp span of the training rows plus one typical sampling interval, so that
     * 72 hourly rows cover 72 hours regardless of gaps in between.
     */
    private Duration coveredDuration(TimeSeriesFrame frame, int[] trainingRows) {
        LocalDateTime first = frame.timestampAt(trainingRows[0]);
        LocalDateTime last = frame.timestampAt(trainingRows[trainingRows.length - 1]);
        return Duration.between(first, last).plus(medianInterval(frame.getTimestamps()));
    }

    private Duration medianInterval(List<LocalDateTime> timestamps) {
        if (timestamps.size() < 2) return Duration.ZERO;
        Duration[] deltas = new Duration[timestamps.size() - 1];
        for (int i = 1; i < timestamps.size(); i++) {
            deltas[i - 1] = Duration.between(timestamps.get(i - 1), timestamps.get(i));
        }
        Arrays.sort(deltas);
        return deltas[deltas.length / 2];
    }

    private boolean isConstant(double[] values, int[] rows) {
        double first = values[rows[0]];
        for (int r : rows) {
            if (values[r] != first) return false;
        }
        return true;
    }

    private double[][] matrix(TimeSeriesFrame frame, List<Integer> features, int[] rows) {
        double[][] out = new double[rows.length][features.size()];
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < features.size(); j++) {
                out[i][j] = frame.value(features.get(j), rows[i]);
            }
        }
        return out;
    }
}
