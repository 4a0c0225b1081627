package io.cronrunner.core;

/**
 * Script exited with a nonzero code. Carries the captured stderr as the failure detail.
 */
public class NonZeroExitException extends CronRunnerException {

    private final int exitCode;
    private final String stderr;

    public NonZeroExitException(int exitCode, String stderr) {
        super((stderr == null || stderr.isBlank()) ? "Process exited with code " + exitCode : stderr);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }
}
