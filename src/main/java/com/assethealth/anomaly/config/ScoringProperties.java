package com.assethealth.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    // Name of the column holding the row timestamps.
    private String timestampColumn = "Time";

    // Training window must cover at least this many hours (span plus one sampling interval).
    private int minTrainingHours = 72;

    // Training window length used when the caller gives no bounds, counted from the first row.
    private int defaultTrainingHours = 120;

    // Isolation forest shape.
    private int numTrees = 100;
    private int sampleSize = 256;

    // Expected anomaly proportion, (0, 0.5]. Interpretation only, never a hard cut.
    private double contamination = 0.1;

    private long randomState = 42L;

    // A feature qualifies as a top feature only when its contribution is strictly above this.
    private double minContribution = 0.0;

    // Upper end of the 0-100 scale occupied by scores inside the training reference range.
    // 100 maps the percentile rank directly.
    private double referenceCeiling = 15.0;

    // Success criteria on normalised training-window scores.
    private double trainingMeanThreshold = 10.0;
    private double trainingMaxThreshold = 25.0;

    // Build trees and score rows on the common fork-join pool. Output is identical either way.
    private boolean parallel = true;
}
