package com.fintech.savings.domain.model;

import java.time.LocalDateTime;

/**
 * Inclusive closed interval {@code [start, end]}.
 */
public interface TimeWindow {

    LocalDateTime getStart();

    LocalDateTime getEnd();

    default boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(getStart()) && !timestamp.isAfter(getEnd());
    }
}
