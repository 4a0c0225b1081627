package io.cronrunner.core;

import java.time.Duration;

public class ExecutionTimeoutException extends CronRunnerException {

    public ExecutionTimeoutException(Duration timeout) {
        super("Execution timed out after " + timeout.toSeconds() + "s");
    }
}
