package io.cronrunner.core;

public class SpawnFailureException extends CronRunnerException {

    public SpawnFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
