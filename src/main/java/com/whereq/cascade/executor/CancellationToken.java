package com.whereq.cascade.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator abort shared by one invocation. Cancelling destroys every registered process tree.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Process> processes = ConcurrentHashMap.newKeySet();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Cancel once; later calls are ignored
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.warn("Cancellation requested, stopping {} running process(es)", processes.size());
        processes.forEach(CancellationToken::destroyTree);
    }

    /**
     * Track a started process. A process registered after cancellation is destroyed at once.
     */
    public void register(Process process) {
        processes.add(process);
        if (isCancelled()) {
            destroyTree(process);
        }
    }

    public void unregister(Process process) {
        processes.remove(process);
    }

    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
