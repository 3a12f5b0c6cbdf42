package com.assethealth.anomaly.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Output of a completed run: the augmented table (original columns followed by the score
 * and seven top-feature columns) and the validation report.
 */
@Getter
@Builder
public class AnalysisResult {

    private final List<String> columns;
    private final List<String[]> rows;
    private final List<AnomalyRecord> records;
    private final ValidationReport report;

    public int rowCount() {
        return rows.size();
    }
}
