package io.cronrunner.core;

public class ScriptNotFoundException extends CronRunnerException {

    public ScriptNotFoundException(String scriptPath) {
        super("Script not found: " + scriptPath);
    }
}
