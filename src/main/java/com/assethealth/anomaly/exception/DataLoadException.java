package com.assethealth.anomaly.exception;

import com.assethealth.anomaly.model.PipelineStage;

public class DataLoadException extends PipelineException {

    public DataLoadException(String message, Throwable cause) {
        super(PipelineStage.LOAD, message, cause);
    }

    public DataLoadException(String message) {
        super(PipelineStage.LOAD, message);
    }
}
