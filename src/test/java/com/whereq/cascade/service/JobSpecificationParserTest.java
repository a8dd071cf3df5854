package com.whereq.cascade.service;

import com.whereq.cascade.exception.InvalidJobSpecificationException;
import com.whereq.cascade.model.BatchUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JobSpecificationParserTest {

    @TempDir
    Path tempDir;

    private final JobSpecificationParser parser = new JobSpecificationParser();

    @Test
    @DisplayName("Should parse units with explicit items and skip the header")
    void testParseExplicitItems() {
        // Given
        List<String> lines = List.of(
            "Output_Directory\tAccession\tSamples",
            "GSE100\tGSE100\tGSM1,GSM2",
            "GSE200\tSRP200\tGSM9");

        // When
        List<BatchUnit> units = parser.parse(lines);

        // Then
        assertThat(units).extracting(BatchUnit::getName).containsExactly("GSE100", "GSE200");
        assertThat(units.get(0).getItems()).containsExactly("GSM1", "GSM2");
        assertThat(units.get(0).isAllItems()).isFalse();
        assertThat(units.get(1).getSourceAccession()).isEqualTo("SRP200");
    }

    @Test
    @DisplayName("Should merge records of the same unit in order of appearance")
    void testMergeRecords() {
        // Given
        List<String> lines = List.of(
            "GSE100\tGSE100\tGSM1, GSM2",
            "GSE300\tGSE300\tGSM7",
            "GSE100\tGSE999\tGSM2,GSM3\t/secure/prj.ngc");

        // When
        List<BatchUnit> units = parser.parse(lines);

        // Then
        assertThat(units).hasSize(2);
        BatchUnit merged = units.get(0);
        assertThat(merged.getItems()).containsExactly("GSM1", "GSM2", "GSM3");
        assertThat(merged.getSourceAccession()).isEqualTo("GSE100");
        assertThat(merged.getAuthFile()).isEqualTo(Path.of("/secure/prj.ngc"));
    }

    @Test
    @DisplayName("Should let 'all' absorb any explicit selection")
    void testAllAbsorbsItems() {
        // When
        List<BatchUnit> units = parser.parse(List.of(
            "GSE100\tGSE100\tGSM1",
            "GSE100\tGSE100\tALL"));

        // Then
        assertThat(units).singleElement().satisfies(unit -> {
            assertThat(unit.isAllItems()).isTrue();
            assertThat(unit.getItems()).isEmpty();
            assertThat(unit.selects("GSM42")).isTrue();
        });
    }

    @Test
    @DisplayName("Should skip comments, blank lines and incomplete records")
    void testSkipsNoise() {
        // When
        List<BatchUnit> units = parser.parse(List.of(
            "# studies for the May batch",
            "",
            "GSE100\tGSE100",
            "\tGSE100\tGSM1",
            "GSE500\tGSE500\tall"));

        // Then
        assertThat(units).extracting(BatchUnit::getName).containsExactly("GSE500");
    }

    @Test
    @DisplayName("Should read a specification file")
    void testParseFile() throws IOException {
        // Given
        Path file = tempDir.resolve("jobs.tsv");
        Files.writeString(file, "GSE100\tGSE100\tGSM1,GSM2\n");

        // When
        List<BatchUnit> units = parser.parse(file);

        // Then
        assertThat(units).singleElement().extracting(BatchUnit::getName).isEqualTo("GSE100");
    }

    @Test
    @DisplayName("Should reject a missing or empty specification file")
    void testInvalidFile() throws IOException {
        Path empty = tempDir.resolve("empty.tsv");
        Files.writeString(empty, "# nothing here\n");

        assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.tsv")))
            .isInstanceOf(InvalidJobSpecificationException.class)
            .hasMessageContaining("not found");
        assertThatThrownBy(() -> parser.parse(empty))
            .isInstanceOf(InvalidJobSpecificationException.class)
            .hasMessageContaining("No usable records");
    }
}
