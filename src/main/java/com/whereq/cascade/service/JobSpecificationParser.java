package com.whereq.cascade.service;

import com.whereq.cascade.exception.InvalidJobSpecificationException;
import com.whereq.cascade.model.BatchUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parse the tab-separated job specification.
 * <p>
 * Each record is {@code outputUnit TAB sourceAccession TAB itemSelector [TAB authFile]}. The selector is
 * {@code all} or a comma-separated list of item ids. Records of the same unit are merged in order of
 * first appearance.
 */
@Slf4j
@Component
public class JobSpecificationParser {

    private static final String HEADER_FIRST_FIELD = "Output_Directory";

    public List<BatchUnit> parse(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new InvalidJobSpecificationException("Job specification not found: " + file);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidJobSpecificationException("Cannot read job specification " + file, e);
        }

        List<BatchUnit> units = parse(lines);
        if (units.isEmpty()) {
            throw new InvalidJobSpecificationException("No usable records in " + file);
        }
        log.info("Job specification {}: {} unit(s)", file, units.size());
        return units;
    }

    List<BatchUnit> parse(List<String> lines) {
        Map<String, UnitAccumulator> units = new LinkedHashMap<>();

        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank() || line.trim().startsWith("#")) {
                continue;
            }

            String[] fields = line.split("\t", -1);
            String unit = field(fields, 0);
            String accession = field(fields, 1);
            String selector = field(fields, 2);
            String auth = field(fields, 3);

            if (HEADER_FIRST_FIELD.equalsIgnoreCase(unit)) {
                continue;
            }
            if (unit.isEmpty() || selector.isEmpty()) {
                log.warn("Line {}: missing output unit or item selector, skipped", lineNumber);
                continue;
            }

            units.computeIfAbsent(unit, UnitAccumulator::new).add(accession, selector, auth);
        }

        return units.values().stream().map(UnitAccumulator::toUnit).toList();
    }

    private static String field(String[] fields, int index) {
        return index < fields.length ? fields[index].trim() : "";
    }

    private static class UnitAccumulator {
        private final String name;
        private String accession;
        private String auth;
        private boolean all;
        private final Set<String> items = new LinkedHashSet<>();

        UnitAccumulator(String name) {
            this.name = name;
        }

        void add(String recordAccession, String selector, String recordAuth) {
            if (accession == null && !recordAccession.isEmpty()) {
                accession = recordAccession;
            } else if (accession != null && !recordAccession.isEmpty() && !accession.equals(recordAccession)) {
                log.warn("Unit {} lists accessions {} and {}, keeping {}", name, accession, recordAccession, accession);
            }
            if (!recordAuth.isEmpty()) {
                auth = recordAuth;
            }

            if (BatchUnit.ALL_ITEMS.equalsIgnoreCase(selector)) {
                all = true;
                return;
            }
            for (String item : selector.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
        }

        BatchUnit toUnit() {
            return BatchUnit.builder()
                .name(name)
                .sourceAccession(accession)
                .allItems(all)
                .items(all ? List.of() : new ArrayList<>(items))
                .authFile(auth != null ? Path.of(auth) : null)
                .build();
        }
    }
}
