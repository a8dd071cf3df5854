package com.whereq.cascade.progress;

import com.whereq.cascade.exception.InfrastructureException;
import com.whereq.cascade.model.AttemptOutcome;
import com.whereq.cascade.model.AttemptRecord;
import com.whereq.cascade.model.FinalStatus;
import com.whereq.cascade.model.Tier;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Plain-text progress files, one record per line, kept next to the unit's data.
 * <p>
 * {@code <stage>_attempts.tsv} is the canonical audit trail; the list files
 * ({@code <stage>_succeeded.txt}, {@code <stage>_tier1_failed.txt}, ...) are derived views that can be
 * fed back as an allow-list. A fresh run rewrites every file, a resumed run reloads them.
 * Skips are never reloaded: they reflect the output on disk at the start of each run.
 */
@Slf4j
public class FileProgressStore implements ProgressStore {

    static final String PENDING = "pending";
    static final String SUCCEEDED = "succeeded";
    static final String SUCCEEDED_DEGRADED = "succeeded_degraded";
    static final String SKIPPED = "skipped";
    static final String ATTEMPTS = "attempts";

    private final Path directory;
    private final String stage;

    private final Set<String> pending = new LinkedHashSet<>();
    private final Set<String> skipped = new LinkedHashSet<>();
    private final List<AttemptRecord> attempts = new ArrayList<>();
    private final Map<String, AttemptRecord> latest = new LinkedHashMap<>();
    private final Map<String, Set<String>> listed = new LinkedHashMap<>();

    private FileProgressStore(Path directory, String stage) {
        this.directory = directory;
        this.stage = stage;
    }

    /**
     * Open the store of one unit and stage
     *
     * @param directory unit directory holding the progress files
     * @param stage stage name used as file prefix
     * @param resume load existing files instead of rewriting them
     * @return the opened store
     */
    public static FileProgressStore open(Path directory, String stage, boolean resume) {
        FileProgressStore store = new FileProgressStore(directory, stage);
        try {
            Files.createDirectories(directory);
            if (resume) {
                store.load();
            } else {
                store.reset();
            }
        } catch (IOException e) {
            throw new InfrastructureException("Cannot open progress files in " + directory, e);
        }
        return store;
    }

    @Override
    public synchronized void markPending(Collection<String> jobIds) {
        for (String jobId : jobIds) {
            if (pending.add(jobId)) {
                appendToList(PENDING, jobId);
            }
        }
    }

    @Override
    public synchronized void markSkipped(String jobId) {
        if (skipped.add(jobId)) {
            appendToList(SKIPPED, jobId);
        }
    }

    @Override
    public synchronized void append(AttemptRecord record) {
        attempts.add(record);
        latest.put(record.getJobId(), record);
        appendLine(file(ATTEMPTS), record.toLine());

        if (record.isDegradedSuccess()) {
            appendToList(SUCCEEDED_DEGRADED, record.getJobId());
        } else if (record.isSuccess()) {
            appendToList(SUCCEEDED, record.getJobId());
        } else if (record.getOutcome() == AttemptOutcome.FAILURE) {
            appendToList(failedList(record.getTier()), record.getJobId());
        }
    }

    @Override
    public synchronized void reopen(String jobId) {
        AttemptRecord previous = latest.remove(jobId);
        skipped.remove(jobId);
        if (previous != null) {
            log.debug("Job {} reopened, its {} attempt in {} no longer counts", jobId, previous.getOutcome(),
                previous.getTier().label());
        }
    }

    @Override
    public synchronized boolean isResolved(String jobId) {
        return skipped.contains(jobId) || finalStatus(jobId) != null;
    }

    @Override
    public synchronized Set<String> pendingSet(Collection<String> allJobs) {
        return allJobs.stream()
            .filter(jobId -> !isResolved(jobId))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public synchronized FinalStatus finalStatus(String jobId) {
        AttemptRecord record = latest.get(jobId);
        // Completed output on disk outranks an older failure record
        if (record == null || (skipped.contains(jobId) && !record.isSuccess())) {
            return skipped.contains(jobId) ? FinalStatus.SUCCEEDED : null;
        }
        if (record.isDegradedSuccess()) {
            return FinalStatus.SUCCEEDED_DEGRADED;
        }
        if (record.isSuccess()) {
            return FinalStatus.SUCCEEDED;
        }
        if (record.isTerminalFailure()) {
            return FinalStatus.FAILED;
        }
        return null;
    }

    @Override
    public synchronized boolean isSkipped(String jobId) {
        return skipped.contains(jobId);
    }

    @Override
    public synchronized List<AttemptRecord> attempts() {
        return List.copyOf(attempts);
    }

    @Override
    public synchronized List<AttemptRecord> attempts(String jobId) {
        return attempts.stream()
            .filter(record -> record.getJobId().equals(jobId))
            .toList();
    }

    @Override
    public synchronized List<String> failedAt(Tier tier) {
        return latest.values().stream()
            .filter(record -> record.getTier() == tier)
            .filter(record -> record.getOutcome() == AttemptOutcome.FAILURE)
            .map(AttemptRecord::getJobId)
            .toList();
    }

    @Override
    public Path location() {
        return directory;
    }

    /**
     * Progress file of one category
     */
    public Path file(String category) {
        String extension = ATTEMPTS.equals(category) ? ".tsv" : ".txt";
        return directory.resolve(stage + "_" + category + extension);
    }

    static String failedList(Tier tier) {
        return tier.label() + "_failed";
    }

    private static List<String> categories() {
        List<String> categories = new ArrayList<>(List.of(PENDING, SUCCEEDED, SUCCEEDED_DEGRADED, SKIPPED));
        for (Tier tier : Tier.values()) {
            categories.add(failedList(tier));
        }
        return categories;
    }

    private void reset() throws IOException {
        for (String category : categories()) {
            Files.writeString(file(category), "", StandardCharsets.UTF_8);
            listed.put(category, new LinkedHashSet<>());
        }
        Files.writeString(file(ATTEMPTS), AttemptRecord.HEADER + System.lineSeparator(), StandardCharsets.UTF_8);
        log.debug("Progress files for {} reset in {}", stage, directory);
    }

    private void load() throws IOException {
        for (String category : categories()) {
            Path file = file(category);
            Set<String> ids = new LinkedHashSet<>();
            if (Files.exists(file)) {
                Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .forEach(ids::add);
            } else {
                Files.writeString(file, "", StandardCharsets.UTF_8);
            }
            listed.put(category, ids);
        }
        pending.addAll(listed.get(PENDING));
        Files.writeString(file(SKIPPED), "", StandardCharsets.UTF_8);
        listed.put(SKIPPED, new LinkedHashSet<>());

        Path attemptsFile = file(ATTEMPTS);
        if (Files.exists(attemptsFile)) {
            for (String line : Files.readAllLines(attemptsFile, StandardCharsets.UTF_8)) {
                if (line.isBlank() || line.equals(AttemptRecord.HEADER)) {
                    continue;
                }
                try {
                    AttemptRecord record = AttemptRecord.parse(line);
                    attempts.add(record);
                    latest.put(record.getJobId(), record);
                } catch (RuntimeException e) {
                    log.warn("Ignoring malformed line in {}: {}", attemptsFile, line);
                }
            }
        } else {
            Files.writeString(attemptsFile, AttemptRecord.HEADER + System.lineSeparator(), StandardCharsets.UTF_8);
        }

        log.info("Resumed {} progress in {}: {} attempt(s)", stage, directory, attempts.size());
    }

    private void appendToList(String category, String jobId) {
        if (listed.computeIfAbsent(category, c -> new LinkedHashSet<>()).add(jobId)) {
            appendLine(file(category), jobId);
        }
    }

    private void appendLine(Path file, String line) {
        try {
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new InfrastructureException("Cannot write progress file " + file, e);
        }
    }
}
