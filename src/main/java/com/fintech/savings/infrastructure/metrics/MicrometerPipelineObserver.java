package com.fintech.savings.infrastructure.metrics;

import com.fintech.savings.domain.model.ReturnsPreset;
import com.fintech.savings.domain.model.ValidationError;
import com.fintech.savings.domain.service.PipelineObserver;
import com.fintech.savings.domain.service.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Publishes pipeline progress as Micrometer counters.
 *
 * Metrics:
 * - savings.transactions.enriched
 * - savings.transactions.rejected{stage, reason} (one increment per error)
 * - savings.transactions.skipped{stage} (valid, but adjusted remnant not positive)
 * - savings.periods.projected{preset}
 */
@Component
@RequiredArgsConstructor
public class MicrometerPipelineObserver implements PipelineObserver {

    private final MeterRegistry meterRegistry;

    @Override
    public void transactionsEnriched(int count) {
        Counter.builder("savings.transactions.enriched")
                .register(meterRegistry)
                .increment(count);
    }

    @Override
    public void transactionRejected(PipelineStage stage, List<ValidationError> errors) {
        for (ValidationError error : errors) {
            Counter.builder("savings.transactions.rejected")
                    .tag("stage", tagValue(stage))
                    .tag("reason", tagValue(error))
                    .register(meterRegistry)
                    .increment();
        }
    }

    @Override
    public void transactionSkipped(PipelineStage stage) {
        Counter.builder("savings.transactions.skipped")
                .tag("stage", tagValue(stage))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void periodProjected(ReturnsPreset preset) {
        Counter.builder("savings.periods.projected")
                .tag("preset", tagValue(preset))
                .register(meterRegistry)
                .increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
