package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.PerformanceSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.ThreadMXBean;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Point-in-time process metrics: wall clock, JVM memory in use and live thread count.
 */
@Service
@RequiredArgsConstructor
public class PerformanceMetricsService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final double BYTES_PER_MB = 1024d * 1024d;

    private final Clock clock;

    public PerformanceSnapshot snapshot() {
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        ThreadMXBean threads = ManagementFactory.getThreadMXBean();

        long usedBytes = memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();

        return PerformanceSnapshot.builder()
                .time(LocalDateTime.now(clock).format(TIME_FORMAT))
                .memory(String.format(Locale.ROOT, "%.2f MB", usedBytes / BYTES_PER_MB))
                .threads(threads.getThreadCount())
                .build();
    }
}
