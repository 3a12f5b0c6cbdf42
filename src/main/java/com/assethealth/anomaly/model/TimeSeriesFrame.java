package com.assethealth.anomaly.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Validated view of an input table: parsed timestamps, numeric feature columns and the
 * original text cells of every column.
 *
 * Feature values are stored column-major ({@code values[feature][row]}); a missing cell
 * is {@link Double#NaN} until gaps are filled. Text cells keep the original column order
 * so the augmented output can reproduce them.
 */
public class TimeSeriesFrame {

    private final List<String> columns;
    private final String timestampColumn;
    private final List<LocalDateTime> timestamps;
    private final List<String> featureNames;
    private final int[] featureColumnIndices;
    private final double[][] values;
    private final List<String[]> cells;
    private final List<PipelineWarning> warnings;

    public TimeSeriesFrame(List<String> columns,
                           String timestampColumn,
                           List<LocalDateTime> timestamps,
                           List<String> featureNames,
                           int[] featureColumnIndices,
                           double[][] values,
                           List<String[]> cells,
                           List<PipelineWarning> warnings) {
        this.columns = List.copyOf(columns);
        this.timestampColumn = timestampColumn;
        this.timestamps = List.copyOf(timestamps);
        this.featureNames = List.copyOf(featureNames);
        this.featureColumnIndices = featureColumnIndices;
        this.values = values;
        this.cells = Collections.unmodifiableList(cells);
        this.warnings = List.copyOf(warnings);
    }

    public int rowCount() {
        return timestamps.size();
    }

    public int featureCount() {
        return featureNames.size();
    }

    public List<String> getColumns() { return columns; }
    public String getTimestampColumn() { return timestampColumn; }
    public List<LocalDateTime> getTimestamps() { return timestamps; }
    public LocalDateTime timestampAt(int row) { return timestamps.get(row); }
    public List<String> getFeatureNames() { return featureNames; }

    /** Position of the given feature inside the original header. */
    public int columnIndexOf(int feature) { return featureColumnIndices[feature]; }

    public double value(int feature, int row) { return values[feature][row]; }
    public double[] featureValues(int feature) { return values[feature]; }
    public String[] cellsAt(int row) { return cells.get(row); }
    public List<PipelineWarning> getWarnings() { return warnings; }

    public int[] featureColumnIndices() {
        return featureColumnIndices.clone();
    }
}
