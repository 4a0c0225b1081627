package io.cronrunner;

import io.cronrunner.core.ProcessInfo;

import java.time.Duration;
import java.util.List;

/**
 * Read and signal OS processes. Used as the recovery path of termination for processes this
 * instance has no handle for.
 */
public interface ProcessTable {

    List<ProcessInfo> list();

    /**
     * Send a graceful termination signal, wait up to {@code grace}, then kill forcibly.
     *
     * @return true if the process is gone afterwards
     * @throws IllegalStateException if the process does not exist or cannot be signalled
     */
    boolean terminate(long pid, Duration grace);
}
