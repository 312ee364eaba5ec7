package io.jobclock.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobclock.JobHandler;
import io.jobclock.JobManager;
import io.jobclock.JobScheduler;
import io.jobclock.JobStore;
import io.jobclock.core.JobHandlerRegistry;
import io.jobclock.internal.DefaultJobManager;
import io.jobclock.internal.JobRunner;
import io.jobclock.internal.TimerJobScheduler;
import io.jobclock.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for jobclock components.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
})
@ConditionalOnClass({JobScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(JobClockProperties.class)
@ConditionalOnProperty(prefix = "jobclock", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobClockConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock jobClockClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore mongoJobStore(MongoTemplate mongoTemplate, JobClockProperties props) {
        return new MongoJobStore(mongoTemplate, props.getStoreUpdateAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobClockMongoIndexConfig jobClockMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new JobClockMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(JobStore jobStore,
                               JobHandlerRegistry registry,
                               ObjectProvider<ObjectMapper> objectMapper,
                               Clock clock) {
        return new JobRunner(jobStore, registry, objectMapper.getIfAvailable(ObjectMapper::new), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobClockProperties props,
                                     JobStore jobStore,
                                     JobHandlerRegistry registry,
                                     JobRunner runner,
                                     Clock clock) {
        return new TimerJobScheduler(props, jobStore, registry, runner, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobManager jobManager(JobStore jobStore, JobScheduler scheduler, Clock clock) {
        return new DefaultJobManager(jobStore, scheduler, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobClockLifecycle jobClockLifecycle(JobScheduler scheduler, JobClockProperties props) {
        return new JobClockLifecycle(scheduler, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobclock", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton jobClockIndexesInitializer(JobClockMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
