package uk.gegc.members.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.members.features.billing.application.ReconciliationMetricsService;

/**
 * Emits reconciliation counters using Micrometer.
 */
@Service
@RequiredArgsConstructor
public class ReconciliationMetricsServiceImpl implements ReconciliationMetricsService {

    static final String OPERATIONS = "members.reconciliation.operations";
    static final String BEST_EFFORT_FAILURES = "members.reconciliation.best_effort_failures";

    private final MeterRegistry meterRegistry;

    @Override
    public void recordOperation(String operation, boolean succeeded) {
        Counter.builder(OPERATIONS)
                .description("Member reconciliation operations by result")
                .tag("operation", operation)
                .tag("result", succeeded ? "success" : "failure")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordBestEffortFailure(String operation) {
        Counter.builder(BEST_EFFORT_FAILURES)
                .description("Items skipped by best-effort reconciliation loops")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }
}
