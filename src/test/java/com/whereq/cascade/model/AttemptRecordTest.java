package com.whereq.cascade.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class AttemptRecordTest {

    @Test
    @DisplayName("Should write a tab-separated line with NA for unknown peak memory")
    void testToLine() {
        // Given
        AttemptRecord record = AttemptRecord.builder()
            .jobId("GSM3559136")
            .tier(Tier.TIER2_SEQUENTIAL_MAX)
            .threads(16)
            .outcome(AttemptOutcome.FAILURE)
            .recordedAt(Instant.parse("2024-05-01T10:15:30Z"))
            .build();

        // When
        String line = record.toLine();

        // Then
        assertThat(line).isEqualTo("GSM3559136\ttier2\t16\tfailure\tNA\t2024-05-01T10:15:30Z");
        assertThat(AttemptRecord.parse(line)).isEqualTo(record);
    }

    @Test
    @DisplayName("Should treat only last-tier successes as degraded")
    void testDegradedSuccess() {
        AttemptRecord tier1 = AttemptRecord.builder().jobId("a").tier(Tier.TIER1_PARALLEL)
            .outcome(AttemptOutcome.SUCCESS).recordedAt(Instant.now()).build();
        AttemptRecord tier3 = AttemptRecord.builder().jobId("a").tier(Tier.TIER3_MINIMAL_FOOTPRINT)
            .outcome(AttemptOutcome.SUCCESS).recordedAt(Instant.now()).build();

        assertThat(tier1.isDegradedSuccess()).isFalse();
        assertThat(tier3.isDegradedSuccess()).isTrue();
        assertThat(tier3.isTerminalFailure()).isFalse();
    }

    @Test
    @DisplayName("Should treat only last-tier failures as terminal")
    void testTerminalFailure() {
        AttemptRecord tier2 = AttemptRecord.builder().jobId("a").tier(Tier.TIER2_SEQUENTIAL_MAX)
            .outcome(AttemptOutcome.FAILURE).recordedAt(Instant.now()).build();
        AttemptRecord tier3 = AttemptRecord.builder().jobId("a").tier(Tier.TIER3_MINIMAL_FOOTPRINT)
            .outcome(AttemptOutcome.FAILURE).recordedAt(Instant.now()).build();

        assertThat(tier2.isTerminalFailure()).isFalse();
        assertThat(tier3.isTerminalFailure()).isTrue();
    }

    @Test
    @DisplayName("Should reject lines with a wrong field count")
    void testMalformedLine() {
        assertThatThrownBy(() -> AttemptRecord.parse("GSM1\ttier1"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
