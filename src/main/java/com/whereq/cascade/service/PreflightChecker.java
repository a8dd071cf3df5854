package com.whereq.cascade.service;

import com.whereq.cascade.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks run once before any job starts
 */
@Slf4j
@Component
public class PreflightChecker {

    private final String searchPath;

    public PreflightChecker() {
        this(System.getenv("PATH"));
    }

    PreflightChecker(String searchPath) {
        this.searchPath = searchPath;
    }

    /**
     * Fail when any executable cannot be found
     *
     * @param executables names looked up on the PATH, or absolute paths
     * @throws InfrastructureException listing every missing executable
     */
    public void requireExecutables(List<String> executables) {
        List<String> missing = new ArrayList<>();
        for (String executable : executables) {
            Path found = findExecutable(executable);
            if (found == null) {
                missing.add(executable);
            } else {
                log.debug("Found {} at {}", executable, found);
            }
        }
        if (!missing.isEmpty()) {
            throw new InfrastructureException("Missing required executable(s): " + String.join(", ", missing));
        }
    }

    Path findExecutable(String executable) {
        if (executable.contains(File.separator)) {
            Path path = Path.of(executable);
            return Files.isExecutable(path) ? path : null;
        }
        if (searchPath == null) {
            return null;
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Warn when the free space under a directory looks too small. Never fails.
     *
     * @return true when enough space appears to be free or it cannot be determined
     */
    public boolean checkDiskSpace(Path directory, long requiredMiB) {
        Path existing = directory;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null || requiredMiB <= 0) {
            return true;
        }
        try {
            long freeMiB = Files.getFileStore(existing).getUsableSpace() / (1024 * 1024);
            if (freeMiB < requiredMiB) {
                log.warn("Low disk space under {}: {} MiB free, about {} MiB needed", directory, freeMiB, requiredMiB);
                return false;
            }
            log.debug("Disk space under {}: {} MiB free, about {} MiB needed", directory, freeMiB, requiredMiB);
        } catch (IOException e) {
            log.warn("Cannot determine free space under {}: {}", directory, e.getMessage());
        }
        return true;
    }
}
