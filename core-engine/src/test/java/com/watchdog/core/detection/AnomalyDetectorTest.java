package com.watchdog.core.detection;

import com.watchdog.core.model.AnomalyResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    private static final String ID = "http:https://api.example.com";

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(true, 3.0, 20);
    }

    @Test
    @DisplayName("Should report insufficient samples until five have been recorded")
    void shouldRequireFiveSamples() {
        for (int i = 0; i < 4; i++) {
            detector.record(ID, 100);
            AnomalyResult result = detector.check(ID, 10_000);
            assertThat(result.isAnomaly()).isFalse();
            assertThat(result.getReason()).contains(AnomalyResult.REASON_INSUFFICIENT_SAMPLES);
        }

        detector.record(ID, 100);
        assertThat(detector.check(ID, 10_000).isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should flag a sample four times the median")
    void shouldFlagSlowSample() {
        for (int i = 0; i < 10; i++) {
            detector.record(ID, 100);
        }

        AnomalyResult result = detector.check(ID, 400);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getReason()).isEmpty();
        assertThat(result.getMedian()).isEqualTo(100.0);
        assertThat(result.getThreshold()).isEqualTo(300.0);
        assertThat(result.getDeviation()).isCloseTo(4.0, within(0.001));
        assertThat(result.getSamples()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should not flag a sample at exactly the threshold")
    void shouldNotFlagAtThreshold() {
        for (int i = 0; i < 10; i++) {
            detector.record(ID, 100);
        }

        assertThat(detector.check(ID, 300).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("A single outlier should not shift the baseline")
    void outlierShouldNotShiftBaseline() {
        for (int i = 0; i < 9; i++) {
            detector.record(ID, 100);
        }
        detector.record(ID, 5_000);

        assertThat(detector.check(ID, 350).isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should do nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        AnomalyDetector disabled = new AnomalyDetector(false, 3.0, 20);
        for (int i = 0; i < 10; i++) {
            disabled.record(ID, 100);
        }

        AnomalyResult result = disabled.check(ID, 10_000);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getReason()).contains(AnomalyResult.REASON_DISABLED);
        assertThat(disabled.getTrackedServices()).isEmpty();
    }

    @Test
    @DisplayName("Should reject invalid construction arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new AnomalyDetector(true, 0, 20))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnomalyDetector(true, 3.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep per-service history separate")
    void shouldIsolateServices() {
        for (int i = 0; i < 5; i++) {
            detector.record("a", 100);
            detector.record("b", 1_000);
        }

        assertThat(detector.check("a", 500).isAnomaly()).isTrue();
        assertThat(detector.check("b", 500).isAnomaly()).isFalse();
        assertThat(detector.getTrackedServices()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @DisplayName("Should restore history from an exported snapshot")
    void shouldRestoreSnapshot() {
        for (int i = 0; i < 10; i++) {
            detector.record(ID, 100);
        }

        AnomalyDetector restored = new AnomalyDetector(true, 3.0, 20);
        int count = restored.importSnapshot(detector.exportSnapshot());

        assertThat(count).isEqualTo(1);
        assertThat(restored.check(ID, 400).isAnomaly()).isTrue();
        assertThat(restored.getStats(ID)).hasValueSatisfying(stats -> {
            assertThat(stats.getSamples()).isEqualTo(10);
            assertThat(stats.getMedian()).isEqualTo(100.0);
        });
    }

    @Test
    @DisplayName("Should skip corrupt snapshot entries and keep the rest")
    void shouldSkipCorruptEntries() {
        Map<String, BufferSnapshot> snapshot = new LinkedHashMap<>();
        snapshot.put("good", new BufferSnapshot(5, List.of(1.0, 2.0, 3.0)));
        snapshot.put("bad-capacity", new BufferSnapshot(-1, List.of(1.0)));
        snapshot.put("no-values", new BufferSnapshot(5, null));
        snapshot.put("missing", null);

        int count = detector.importSnapshot(snapshot);

        assertThat(count).isEqualTo(1);
        assertThat(detector.getTrackedServices()).containsExactly("good");
    }

    @Test
    @DisplayName("Should drop history for a cleared service")
    void shouldClearHistory() {
        detector.record(ID, 100);
        detector.clearHistory(ID);

        assertThat(detector.getStats(ID)).isEmpty();
        assertThat(detector.getSummary()).containsEntry("trackedServices", 0);
    }
}
