package io.cronrunner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronrunner.ExecutionEngine;
import io.cronrunner.JobScheduler;
import io.cronrunner.JobStore;
import io.cronrunner.ProcessTable;
import io.cronrunner.RunLedger;
import io.cronrunner.TerminationCoordinator;
import io.cronrunner.internal.DefaultTerminationCoordinator;
import io.cronrunner.internal.InProcessJobScheduler;
import io.cronrunner.internal.LinuxProcessTable;
import io.cronrunner.internal.ProcessExecutionEngine;
import io.cronrunner.internal.ProcessRegistry;
import io.cronrunner.internal.SchedulerDiagnostics;
import io.cronrunner.internal.mongo.MongoJobStore;
import io.cronrunner.internal.mongo.MongoRunLedger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the job runner components.
 */
@AutoConfiguration
@ConditionalOnClass({JobScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(CronRunnerProperties.class)
@ConditionalOnProperty(prefix = "cronrunner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronRunnerConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunLedger runLedger(MongoTemplate mongoTemplate) {
        return new MongoRunLedger(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronRunnerMongoIndexConfig cronRunnerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CronRunnerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessRegistry processRegistry() {
        return new ProcessRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessTable processTable() {
        return new LinuxProcessTable();
    }

    // The engine reads the scheduler's entries after each run, so it is resolved lazily here.
    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(CronRunnerProperties props, JobStore jobStore, ObjectProvider<ExecutionEngine> engine) {
        return new InProcessJobScheduler(props, jobStore, engine::getObject);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionEngine executionEngine(CronRunnerProperties props,
                                           JobStore jobStore,
                                           RunLedger ledger,
                                           JobScheduler scheduler,
                                           ProcessRegistry registry,
                                           ObjectMapper objectMapper) {
        return new ProcessExecutionEngine(props, jobStore, ledger, scheduler, registry, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public TerminationCoordinator terminationCoordinator(CronRunnerProperties props,
                                                         JobScheduler scheduler,
                                                         RunLedger ledger,
                                                         ProcessRegistry registry,
                                                         ProcessTable processTable) {
        return new DefaultTerminationCoordinator(props, scheduler, ledger, registry, processTable);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerDiagnostics schedulerDiagnostics(JobScheduler scheduler, JobStore jobStore, RunLedger ledger) {
        return new SchedulerDiagnostics(scheduler, jobStore, ledger);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronRunnerLifecycle cronRunnerLifecycle(JobScheduler scheduler, CronRunnerProperties props) {
        return new CronRunnerLifecycle(scheduler, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronrunner", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronRunnerIndexesInitializer(CronRunnerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
