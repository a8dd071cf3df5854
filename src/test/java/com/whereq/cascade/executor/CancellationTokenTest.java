package com.whereq.cascade.executor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CancellationTokenTest {

    private static Process sleeper() throws IOException {
        return new ProcessBuilder("/bin/sh", "-c", "sleep 30").start();
    }

    @Test
    @DisplayName("Should destroy registered processes on cancel")
    void testCancelDestroysProcesses() throws Exception {
        // Given
        CancellationToken token = new CancellationToken();
        Process process = sleeper();
        token.register(process);

        // When
        token.cancel();

        // Then
        assertThat(process.waitFor(5, TimeUnit.SECONDS)).isTrue();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should destroy a process registered after cancellation at once")
    void testRegisterAfterCancel() throws Exception {
        // Given
        CancellationToken token = new CancellationToken();
        token.cancel();
        Process process = sleeper();

        // When
        token.register(process);

        // Then
        assertThat(process.waitFor(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should leave unregistered processes alone")
    void testUnregister() throws Exception {
        // Given
        CancellationToken token = new CancellationToken();
        Process process = sleeper();
        token.register(process);
        token.unregister(process);

        try {
            // When
            token.cancel();

            // Then
            assertThat(process.isAlive()).isTrue();
        } finally {
            process.destroyForcibly();
        }
    }
}
