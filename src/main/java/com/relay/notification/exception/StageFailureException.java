package com.relay.notification.exception;

import com.relay.notification.model.PipelineStage;

public class StageFailureException extends RuntimeException {

    private final PipelineStage stage;

    public StageFailureException(PipelineStage stage, Throwable cause) {
        super("Pipeline stage " + stage.code() + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
