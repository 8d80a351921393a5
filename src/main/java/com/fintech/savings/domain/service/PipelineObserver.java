package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.ReturnsPreset;
import com.fintech.savings.domain.model.ValidationError;

import java.util.List;

/**
 * Diagnostic hook notified as the savings pipeline runs. Must not influence results.
 */
public interface PipelineObserver {

    PipelineObserver NO_OP = new PipelineObserver() {
    };

    default void transactionsEnriched(int count) {
    }

    default void transactionRejected(PipelineStage stage, List<ValidationError> errors) {
    }

    /** A valid transaction whose adjusted remnant was not positive. */
    default void transactionSkipped(PipelineStage stage) {
    }

    default void periodProjected(ReturnsPreset preset) {
    }
}
