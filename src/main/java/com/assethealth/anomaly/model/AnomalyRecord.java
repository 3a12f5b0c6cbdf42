package com.assethealth.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecord {

    public static final int TOP_FEATURE_COUNT = 7;
    public static final String SCORE_COLUMN = "Abnormality_score";
    public static final String TOP_FEATURE_PREFIX = "top_feature_";

    private int rowIndex;
    private LocalDateTime timestamp;

    // 0-100, two decimals
    private double score;

    // always TOP_FEATURE_COUNT entries, "" for unused slots
    private List<String> topFeatures;
}
