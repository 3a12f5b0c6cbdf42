package com.assethealth.anomaly.model;

/**
 * Severity bands over the 0-100 abnormality scale, used for summary distributions.
 */
public enum ScoreBand {
    NORMAL,
    SLIGHT,
    MODERATE,
    SIGNIFICANT,
    SEVERE;

    public static ScoreBand fromScore(double score) {
        if (score > 90) return SEVERE;
        if (score > 60) return SIGNIFICANT;
        if (score > 30) return MODERATE;
        if (score > 10) return SLIGHT;
        return NORMAL;
    }
}
