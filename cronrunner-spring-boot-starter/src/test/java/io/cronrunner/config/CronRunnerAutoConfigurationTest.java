package io.cronrunner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronrunner.ExecutionEngine;
import io.cronrunner.JobScheduler;
import io.cronrunner.RunLedger;
import io.cronrunner.TerminationCoordinator;
import io.cronrunner.internal.SchedulerDiagnostics;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class CronRunnerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CronRunnerConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "cronrunner.interpreter=python3",
                    "cronrunner.execution-timeout=30m",
                    "cronrunner.termination-grace-period=2s"
            );

    @Test
    void shouldAutoConfigureRunnerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(JobScheduler.class);
            assertThat(context).hasSingleBean(ExecutionEngine.class);
            assertThat(context).hasSingleBean(RunLedger.class);
            assertThat(context).hasSingleBean(TerminationCoordinator.class);
            assertThat(context).hasSingleBean(SchedulerDiagnostics.class);
            assertThat(context).hasSingleBean(CronRunnerLifecycle.class);
            assertThat(context).hasSingleBean(CronRunnerProperties.class);
            assertThat(context.getBean(JobScheduler.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBindDurationsFromProperties() {
        contextRunner.run(context -> {
            CronRunnerProperties props = context.getBean(CronRunnerProperties.class);
            assertThat(props.getExecutionTimeout()).isEqualTo(Duration.ofMinutes(30));
            assertThat(props.getTerminationGracePeriod()).isEqualTo(Duration.ofSeconds(2));
            assertThat(props.getMisfireGraceTime()).isEqualTo(Duration.ofSeconds(1));
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("cronrunner.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(JobScheduler.class));
    }

    @Test
    void startupShouldSkipLoadingWhenLoadOnStartupDisabled() {
        contextRunner.withPropertyValues("cronrunner.load-on-startup=false")
                .run(context -> {
                    assertThat(context.getBean(CronRunnerLifecycle.class).isRunning()).isTrue();
                    verifyNoInteractions(context.getBean(MongoTemplate.class));
                });
    }
}
