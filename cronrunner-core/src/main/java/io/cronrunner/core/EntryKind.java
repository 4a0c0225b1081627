package io.cronrunner.core;

public enum EntryKind {
    /** Cron-driven entry, id {@code job_<jobId>}. */
    RECURRING("job_"),
    /** Fire-once entry created by a manual run request, id {@code manual_<jobId>_<timestamp>}. */
    ONE_SHOT("manual_");

    private final String idPrefix;

    EntryKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public static String recurringId(String jobId) {
        return RECURRING.idPrefix + jobId;
    }
}
