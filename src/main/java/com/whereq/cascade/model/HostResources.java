package com.whereq.cascade.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Undivided host totals as observed once per invocation
 */
@Value
@AllArgsConstructor
public class HostResources {
    int totalCpus;
    long totalMemoryMiB;
    long availableMemoryMiB;

    /**
     * True when introspection failed and the conservative defaults were used
     */
    boolean fallback;
}
