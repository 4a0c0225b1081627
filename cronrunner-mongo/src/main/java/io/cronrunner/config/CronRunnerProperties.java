package io.cronrunner.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduling, script execution and termination.
 */
@ConfigurationProperties(prefix = "cronrunner")
public class CronRunnerProperties {
    private boolean enabled = true;
    private String interpreter = "python3"; // blank runs the script directly
    private Duration executionTimeout = Duration.ofHours(1);
    private Duration terminationGracePeriod = Duration.ofSeconds(5);
    private Duration misfireGraceTime = Duration.ofSeconds(1);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean loadOnStartup = true;
    private boolean processScanEnabled = true;
    private String scriptPathMarker = "/jobs/";
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getInterpreter() {
        return interpreter;
    }

    public void setInterpreter(String interpreter) {
        this.interpreter = interpreter;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
    }

    public Duration getTerminationGracePeriod() {
        return terminationGracePeriod;
    }

    public void setTerminationGracePeriod(Duration terminationGracePeriod) {
        this.terminationGracePeriod = terminationGracePeriod;
    }

    public Duration getMisfireGraceTime() {
        return misfireGraceTime;
    }

    public void setMisfireGraceTime(Duration misfireGraceTime) {
        this.misfireGraceTime = misfireGraceTime;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isLoadOnStartup() {
        return loadOnStartup;
    }

    public void setLoadOnStartup(boolean loadOnStartup) {
        this.loadOnStartup = loadOnStartup;
    }

    public boolean isProcessScanEnabled() {
        return processScanEnabled;
    }

    public void setProcessScanEnabled(boolean processScanEnabled) {
        this.processScanEnabled = processScanEnabled;
    }

    public String getScriptPathMarker() {
        return scriptPathMarker;
    }

    public void setScriptPathMarker(String scriptPathMarker) {
        this.scriptPathMarker = scriptPathMarker;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
