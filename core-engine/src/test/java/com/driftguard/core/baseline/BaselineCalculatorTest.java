package com.driftguard.core.baseline;

import com.driftguard.core.config.BaselineSettings;
import com.driftguard.core.model.BaselineMetric;
import com.driftguard.core.model.BaselineRecord;
import com.driftguard.core.model.LlmEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineCalculator}.
 */
class BaselineCalculatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should use the whole days between lookback and today")
    void shouldComputeWindow() {
        BaselineCalculator calculator = new BaselineCalculator(BaselineStore.of(BaselineSnapshot.empty()),
                new BaselineSettings(), CLOCK);

        assertThat(calculator.windowStart()).isEqualTo(Instant.parse("2024-05-16T00:00:00Z"));
        assertThat(calculator.windowEnd()).isEqualTo(Instant.parse("2024-06-15T00:00:00Z"));
    }

    @Test
    @DisplayName("Should aggregate mean and sample deviation per model inside the window")
    void shouldAggregatePerModel() {
        BaselineStore store = BaselineStore.of(BaselineSnapshot.empty());
        BaselineCalculator calculator = new BaselineCalculator(store, new BaselineSettings(), CLOCK);
        List<LlmEvent> history = List.of(
                event("2024-05-16T00:00:00Z", "m1", 1.0, 100),
                event("2024-06-01T10:00:00Z", "m1", 2.0, 200),
                event("2024-06-14T23:59:59Z", "m1", 3.0, 300),
                event("2024-06-10T08:00:00Z", "m2", 5.0, 50),
                event("2024-05-15T23:59:59Z", "m1", 99.0, 9),
                event("2024-06-15T01:00:00Z", "m1", 99.0, 9),
                LlmEvent.builder().modelId("m1").responseTime(1.0).tokenCount(10).confidenceScore(0.9).build(),
                LlmEvent.builder().timestamp(Instant.parse("2024-06-01T00:00:00Z")).responseTime(-1).build());

        BaselineCalculationReport report = calculator.recompute(history);

        assertThat(report.getVersion()).isEqualTo(1L);
        assertThat(report.getRecordsRead()).isEqualTo(8L);
        assertThat(report.getRecordsUsed()).isEqualTo(4L);
        assertThat(report.getRecordsOutsideWindow()).isEqualTo(2L);
        assertThat(report.getRecordsSkipped()).isEqualTo(2L);
        assertThat(report.getModelCount()).isEqualTo(2);

        BaselineRecord m1 = store.current().find("m1").orElseThrow();
        assertThat(m1.getSampleCount()).isEqualTo(3L);
        assertThat(m1.mean(BaselineMetric.RESPONSE_TIME).getAsDouble()).isCloseTo(2.0, within(1e-9));
        assertThat(m1.stdDev(BaselineMetric.RESPONSE_TIME).getAsDouble()).isCloseTo(1.0, within(1e-9));
        assertThat(m1.mean(BaselineMetric.TOKEN_COUNT).getAsDouble()).isCloseTo(200.0, within(1e-9));
        assertThat(m1.mean(BaselineMetric.CONFIDENCE).getAsDouble()).isCloseTo(0.9, within(1e-9));
        assertThat(m1.getBaselineDate()).isEqualTo(CLOCK.instant());

        BaselineRecord m2 = store.current().find("m2").orElseThrow();
        assertThat(m2.getSampleCount()).isEqualTo(1L);
        assertThat(m2.stdDev(BaselineMetric.RESPONSE_TIME).getAsDouble()).isZero();
    }

    @Test
    @DisplayName("Should increment the version on every recomputation")
    void shouldIncrementVersion() {
        BaselineStore store = BaselineStore.of(BaselineSnapshot.empty());
        BaselineCalculator calculator = new BaselineCalculator(store, new BaselineSettings(), CLOCK);

        calculator.recompute(List.of(event("2024-06-01T00:00:00Z", "m1", 1.0, 10)));
        calculator.recompute(List.of());

        assertThat(store.current().getVersion()).isEqualTo(2L);
        assertThat(store.current().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should leave file and served snapshot untouched when history fails mid-way")
    void shouldBeAtomicOnFailure() throws Exception {
        Path file = dir.resolve("baseline.csv");
        BaselineStore store = BaselineStore.open(new CsvBaselineRepository(file));
        BaselineCalculator calculator = new BaselineCalculator(store, new BaselineSettings(), CLOCK);
        calculator.recompute(List.of(event("2024-06-01T00:00:00Z", "m1", 1.0, 10)));
        byte[] bytesBefore = Files.readAllBytes(file);
        BaselineSnapshot served = store.current();

        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger mismatches = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            started.countDown();
            while (!done.get()) {
                if (store.current() != served) {
                    mismatches.incrementAndGet();
                }
            }
        }, "baseline-reader");
        reader.start();
        started.await();

        try {
            assertThatThrownBy(() -> calculator.recompute(failingAfter(3)))
                    .isInstanceOf(BaselinePublishException.class)
                    .hasMessageContaining("keeping version 1");
        } finally {
            done.set(true);
            reader.join();
        }

        assertThat(mismatches.get()).isZero();
        assertThat(store.current()).isSameAs(served);
        assertThat(Files.readAllBytes(file)).isEqualTo(bytesBefore);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static LlmEvent event(String timestamp, String modelId, double responseTime, long tokens) {
        return LlmEvent.builder()
                .timestamp(Instant.parse(timestamp))
                .modelId(modelId)
                .responseTime(responseTime)
                .tokenCount(tokens)
                .confidenceScore(0.9)
                .build();
    }

    private static Iterable<LlmEvent> failingAfter(int count) {
        List<LlmEvent> good = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            good.add(event("2024-06-02T00:00:00Z", "m1", 5.0 + i, 50));
        }
        return () -> new Iterator<>() {
            private final Iterator<LlmEvent> delegate = good.iterator();

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public LlmEvent next() {
                if (delegate.hasNext()) {
                    return delegate.next();
                }
                throw new IllegalStateException("history source disconnected");
            }
        };
    }
}
