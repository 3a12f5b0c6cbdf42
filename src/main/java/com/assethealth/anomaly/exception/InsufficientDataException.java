package com.assethealth.anomaly.exception;

import com.assethealth.anomaly.model.PipelineStage;

/**
 * A window does not hold enough data: training shorter than the configured minimum,
 * or a window that selects no rows.
 */
public class InsufficientDataException extends PipelineException {

    public InsufficientDataException(PipelineStage stage, String message) {
        super(stage, message);
    }
}
