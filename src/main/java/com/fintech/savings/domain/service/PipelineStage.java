package com.fintech.savings.domain.service;

public enum PipelineStage {
    VALIDATION,
    FILTER,
    RETURNS
}
