package com.assethealth.anomaly.exception;

import com.assethealth.anomaly.model.PipelineStage;

/**
 * The input table or run parameters cannot be modeled: missing or unparseable timestamp
 * column, timestamps out of order, no usable numeric features, invalid parameters.
 */
public class SchemaValidationException extends PipelineException {

    public SchemaValidationException(PipelineStage stage, String message) {
        super(stage, message);
    }

    public SchemaValidationException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
