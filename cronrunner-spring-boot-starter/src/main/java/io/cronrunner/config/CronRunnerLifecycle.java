package io.cronrunner.config;

import io.cronrunner.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle. Persisted jobs are loaded
 * once the scheduler is running, before the application reports ready.
 */
public class CronRunnerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private final CronRunnerProperties props;
    private volatile boolean running = false;

    public CronRunnerLifecycle(JobScheduler scheduler, CronRunnerProperties props) {
        this.scheduler = scheduler;
        this.props = props;
    }

    @Override
    public void start() {
        scheduler.start();
        if (props.isLoadOnStartup()) {
            scheduler.loadAll();
        }
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
