package io.cronrunner.internal;

import io.cronrunner.config.CronRunnerProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

final class TestSupport {

    private TestSupport() {
    }

    static CronRunnerProperties shellProps() {
        CronRunnerProperties props = new CronRunnerProperties();
        props.setInterpreter("sh");
        props.setExecutionTimeout(Duration.ofSeconds(20));
        props.setTerminationGracePeriod(Duration.ofSeconds(1));
        props.setShutdownTimeout(Duration.ofSeconds(2));
        props.setProcessScanEnabled(false);
        return props;
    }

    static Path script(Path dir, String name, String body) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, body + "\n");
        return file;
    }

    static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
