package com.whereq.cascade.executor;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Peak resident memory of a process through GNU time. Without the wrapper the peak is unknown.
 */
@Slf4j
public class PeakMemoryMeter {

    private static final Pattern MAX_RSS = Pattern.compile("Maximum resident set size \\(kbytes\\):\\s*(\\d+)");

    private final Path wrapper;
    private final boolean available;

    public PeakMemoryMeter(String wrapper) {
        this.wrapper = wrapper == null || wrapper.isBlank() ? null : Path.of(wrapper);
        this.available = this.wrapper != null && Files.isExecutable(this.wrapper);
        if (!available) {
            log.info("Peak memory wrapper {} not available, peak memory will not be recorded", wrapper);
        }
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * Prefix the command with the wrapper writing its report to the given file
     */
    public List<String> wrap(List<String> command, Path report) {
        if (!available) {
            return command;
        }
        List<String> wrapped = new ArrayList<>();
        wrapped.add(wrapper.toString());
        wrapped.add("-v");
        wrapped.add("-o");
        wrapped.add(report.toString());
        wrapped.addAll(command);
        return wrapped;
    }

    /**
     * @return peak resident memory in MiB, or null when the report is missing or unparseable
     */
    public Long readPeakMiB(Path report) {
        if (!available || !Files.isRegularFile(report)) {
            return null;
        }
        try {
            Matcher matcher = MAX_RSS.matcher(Files.readString(report));
            if (matcher.find()) {
                return Long.parseLong(matcher.group(1)) / 1024;
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Cannot read peak memory from {}: {}", report, e.getMessage());
        }
        return null;
    }
}
