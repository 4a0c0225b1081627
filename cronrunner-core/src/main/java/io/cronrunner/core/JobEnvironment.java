package io.cronrunner.core;

/**
 * Environment variables set on every spawned job process. They are the only channel that links a
 * live OS process back to its job when no in-process handle exists.
 */
public final class JobEnvironment {

    /** JSON serialization of the job's configuration map. */
    public static final String JOB_CONFIG = "JOB_CONFIG";
    public static final String JOB_ID = "JOB_ID";
    public static final String JOB_NAME = "JOB_NAME";

    private JobEnvironment() {
    }
}
