package io.cronrunner.core;

public class JobNotFoundException extends CronRunnerException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
