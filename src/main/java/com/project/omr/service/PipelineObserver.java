package com.project.omr.service;

public interface PipelineObserver {

    void stageCompleted(PipelineStage stage, String detail);

    default void pipelineFailed(PipelineStage lastCompleted, Exception error) {
    }
}
