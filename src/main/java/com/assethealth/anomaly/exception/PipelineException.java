package com.assethealth.anomaly.exception;

import com.assethealth.anomaly.model.PipelineStage;

/**
 * Fatal condition that aborts a scoring run. Nothing is emitted or stored once thrown.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
