package com.project.omr.service;

public enum PipelineStage {
    LOADED,
    PREPROCESSED,
    CANDIDATES_FOUND,
    ROWS_CLUSTERED,
    CLASSIFIED,
    RESOLVED,
    EVALUATED
}
