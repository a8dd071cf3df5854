package com.whereq.cascade.stage;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * One external process started within a job attempt
 */
@Value
@Builder
public class ToolInvocation {
    /**
     * Short step name used in logs, e.g. "prefetch SRR1234567"
     */
    String name;

    /**
     * Executable followed by its arguments
     */
    @Singular
    List<String> commands;

    /**
     * What the invocation works on, e.g. a file name; used in failure lists. Null to use the name.
     */
    String subject;

    /**
     * Working directory, null for the scheduler's own
     */
    Path workingDirectory;

    public String subjectOrName() {
        return subject != null ? subject : name;
    }

    public String commandLine() {
        return String.join(" ", commands);
    }
}
