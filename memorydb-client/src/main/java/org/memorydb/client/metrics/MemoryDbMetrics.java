package org.memorydb.client.metrics;

import java.util.Locale;

import org.memorydb.client.ResultKind;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;

/**
 * Centralises Micrometer instrumentation for client operations.
 */
public final class MemoryDbMetrics {

    private static final String METRIC_PREFIX = "memorydb.client";
    public static final String TIMER_NAME = METRIC_PREFIX + ".operation.duration";
    public static final String COUNTER_NAME = METRIC_PREFIX + ".operation.outcome";
    private static final String TAG_OPERATION = "operation";
    private static final String TAG_OUTCOME = "outcome";

    private MemoryDbMetrics() {
    }

    /**
     * Starts a timer sample using the global Micrometer registry.
     */
    public static Timer.Sample startTimer() {
        return Timer.start(Metrics.globalRegistry);
    }

    /**
     * Stops the sample and increments the outcome counter for the given operation.
     */
    public static void record(String operation, Timer.Sample sample, ResultKind kind) {
        Outcome outcome = Outcome.of(kind);
        if (sample != null) {
            Timer timer = Timer.builder(TIMER_NAME)
                    .description("Latency of MemoryDB client operations.")
                    .tag(TAG_OPERATION, operation)
                    .tag(TAG_OUTCOME, outcome.tagValue)
                    .register(Metrics.globalRegistry);
            sample.stop(timer);
        }
        count(operation, outcome);
    }

    public static void count(String operation, Outcome outcome) {
        Counter counter = Counter.builder(COUNTER_NAME)
                .description("Outcome counter for MemoryDB client operations.")
                .tag(TAG_OPERATION, operation)
                .tag(TAG_OUTCOME, outcome.tagValue)
                .register(Metrics.globalRegistry);
        counter.increment();
    }

    public enum Outcome {
        SUCCESS,
        NOT_FOUND,
        FAILURE,
        TIMEOUT,
        ERROR;

        private final String tagValue;

        Outcome() {
            this.tagValue = name().toLowerCase(Locale.ROOT);
        }

        public String tagValue() {
            return tagValue;
        }

        public static Outcome of(ResultKind kind) {
            return switch (kind) {
                case SUCCESS -> SUCCESS;
                case NOT_FOUND -> NOT_FOUND;
                case TIMEOUT -> TIMEOUT;
                case INVALID_STATE -> FAILURE;
                case CONNECTION_ERROR, AUTH_ERROR, OTHER_ERROR -> ERROR;
            };
        }
    }
}
