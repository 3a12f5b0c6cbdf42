package com.assethealth.anomaly.model;

/**
 * Stages of one scoring run, in execution order. The run never moves backwards.
 */
public enum PipelineStage {
    LOAD,
    VALIDATE,
    PREPROCESS,
    SPLIT,
    TRAIN,
    SCORE,
    ATTRIBUTE,
    TRANSFORM,
    VALIDATE_SUCCESS_CRITERIA,
    EMIT
}
