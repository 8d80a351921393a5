package com.fintech.savings.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PerformanceSnapshot {

    String time;
    String memory;
    int threads;
}
