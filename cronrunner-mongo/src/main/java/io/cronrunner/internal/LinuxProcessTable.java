package io.cronrunner.internal;

import io.cronrunner.ProcessTable;
import io.cronrunner.core.ProcessInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ProcessTable} backed by {@link ProcessHandle} and {@code /proc/<pid>/environ}.
 *
 * <p>Environments of processes owned by other users are unreadable and come back empty, so such
 * processes are never attributed to a job.
 */
public class LinuxProcessTable implements ProcessTable {
    private static final Logger log = LoggerFactory.getLogger(LinuxProcessTable.class);

    private final Path procRoot;

    public LinuxProcessTable() {
        this(Path.of("/proc"));
    }

    public LinuxProcessTable(Path procRoot) {
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot must not be null");
    }

    @Override
    public List<ProcessInfo> list() {
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .map(h -> new ProcessInfo(
                        h.pid(),
                        h.info().command().orElse(null),
                        h.info().arguments().map(Arrays::asList).orElse(List.of()),
                        readEnvironment(h.pid())))
                .toList();
    }

    @Override
    public boolean terminate(long pid, Duration grace) {
        ProcessHandle handle = ProcessHandle.of(pid)
                .orElseThrow(() -> new IllegalStateException("process " + pid + " no longer exists"));
        try {
            return ProcessSignals.terminate(handle, grace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while terminating process " + pid, e);
        }
    }

    Map<String, String> readEnvironment(long pid) {
        Path environ = procRoot.resolve(Long.toString(pid)).resolve("environ");
        byte[] raw;
        try {
            raw = Files.readAllBytes(environ);
        } catch (IOException | SecurityException e) {
            log.trace("environment of pid={} not readable msg={}", pid, e.getMessage());
            return Map.of();
        }

        Map<String, String> env = new HashMap<>();
        for (String pair : new String(raw, StandardCharsets.UTF_8).split("\0")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                env.put(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return env;
    }
}
