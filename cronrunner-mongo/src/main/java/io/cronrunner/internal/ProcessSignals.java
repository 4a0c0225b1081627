package io.cronrunner.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Graceful-then-forceful termination of a process and its descendants.
 */
final class ProcessSignals {
    private static final Logger log = LoggerFactory.getLogger(ProcessSignals.class);

    private ProcessSignals() {
    }

    /**
     * Request graceful termination, wait up to {@code grace}, then kill forcibly.
     *
     * @return true if the process has exited afterwards
     * @throws IllegalStateException if the OS refuses the termination request
     */
    static boolean terminate(ProcessHandle handle, Duration grace) throws InterruptedException {
        if (!handle.isAlive()) {
            return true;
        }

        List<ProcessHandle> descendants = handle.descendants().collect(Collectors.toList());
        boolean requested = handle.destroy();
        descendants.forEach(ProcessHandle::destroy);
        if (!requested && handle.isAlive()) {
            throw new IllegalStateException("termination not permitted for pid " + handle.pid());
        }

        if (awaitExit(handle, grace)) {
            descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
            return true;
        }

        log.warn("process survived graceful termination, killing pid={} grace={}", handle.pid(), grace);
        handle.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
        return awaitExit(handle, grace);
    }

    /**
     * Kill a process and its descendants without waiting.
     */
    static void kill(ProcessHandle handle) {
        List<ProcessHandle> descendants = handle.descendants().collect(Collectors.toList());
        handle.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
    }

    private static boolean awaitExit(ProcessHandle handle, Duration timeout) throws InterruptedException {
        try {
            handle.onExit().get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException | ExecutionException e) {
            return !handle.isAlive();
        }
    }
}
