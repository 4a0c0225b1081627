package io.cronrunner.core;

/**
 * Base type for scheduler and execution failures.
 */
public class CronRunnerException extends RuntimeException {

    public CronRunnerException(String message) {
        super(message);
    }

    public CronRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
