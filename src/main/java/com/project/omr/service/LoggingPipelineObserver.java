package com.project.omr.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingPipelineObserver implements PipelineObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineObserver.class);

    @Override
    public void stageCompleted(PipelineStage stage, String detail) {
        log.debug("[{}] {}", stage, detail);
    }

    @Override
    public void pipelineFailed(PipelineStage lastCompleted, Exception error) {
        log.warn("Pipeline stopped after {}: {}", lastCompleted == null ? "start" : lastCompleted, error.getMessage());
    }
}
