package io.cronrunner.core;

public class ScheduleParseException extends CronRunnerException {

    private final String expression;

    public ScheduleParseException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
