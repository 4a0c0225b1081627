package io.cronrunner.internal;

import io.cronrunner.core.ProcessInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinuxProcessTableTest {

    @TempDir
    Path procRoot;

    @Test
    void environmentShouldBeParsedFromNulSeparatedPairs() throws Exception {
        Path pidDir = Files.createDirectories(procRoot.resolve("4242"));
        Files.write(pidDir.resolve("environ"),
                "JOB_ID=7\0JOB_CONFIG={\"a\":\"b=c\"}\0PATH=/usr/bin\0BROKEN\0".getBytes(StandardCharsets.UTF_8));

        Map<String, String> env = new LinuxProcessTable(procRoot).readEnvironment(4242);

        assertThat(env)
                .containsEntry("JOB_ID", "7")
                .containsEntry("JOB_CONFIG", "{\"a\":\"b=c\"}")
                .containsEntry("PATH", "/usr/bin")
                .doesNotContainKey("BROKEN");
    }

    @Test
    void unreadableEnvironmentShouldBeEmpty() {
        assertThat(new LinuxProcessTable(procRoot).readEnvironment(99999)).isEmpty();
    }

    @Test
    void listShouldIncludeThisProcess() {
        long self = ProcessHandle.current().pid();

        assertThat(new LinuxProcessTable(procRoot).list()).extracting(ProcessInfo::pid).contains(self);
    }

    @Test
    void terminatingMissingProcessShouldThrow() {
        assertThatThrownBy(() -> new LinuxProcessTable().terminate(Long.MAX_VALUE, Duration.ofMillis(10)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no longer exists");
    }
}
