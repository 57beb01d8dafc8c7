package io.otto4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.otto4j.OttoScheduler;
import io.otto4j.execution.TaskExecutionEngine;
import io.otto4j.heartbeat.HeartbeatTask;
import io.otto4j.heartbeat.HeartbeatTasks;
import io.otto4j.internal.DefaultOttoScheduler;
import io.otto4j.internal.mongo.MongoJobStore;
import io.otto4j.internal.mongo.MongoNotificationPolicyStore;
import io.otto4j.internal.mongo.MongoOutboundMessageStore;
import io.otto4j.internal.mongo.MongoSessionBindingStore;
import io.otto4j.kernel.SchedulerKernel;
import io.otto4j.outbound.OutboundEnqueuer;
import io.otto4j.outbound.OutboundQueueProcessor;
import io.otto4j.outbound.OutboundQueueWorker;
import io.otto4j.spi.JobStore;
import io.otto4j.spi.NotificationPolicyStore;
import io.otto4j.spi.OutboundMessageStore;
import io.otto4j.spi.SessionBindingStore;
import io.otto4j.spi.SessionGateway;
import io.otto4j.spi.TransportSender;
import io.otto4j.taskconfig.TaskConfigLoader;
import io.otto4j.watchdog.FailureWatchdog;
import io.otto4j.watchdog.WatchdogTasks;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for otto4j components.
 *
 * <p>Stores, the enqueuer, the watchdog and the heartbeat are always available. The execution engine, kernel and
 * {@link OttoScheduler} need a {@link SessionGateway} bean; outbound delivery needs a
 * {@link TransportSender} bean.
 */
@AutoConfiguration
@ConditionalOnClass({OttoScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(OttoProperties.class)
@ConditionalOnProperty(prefix = "otto", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OttoConfig {
    @Bean
    @ConditionalOnMissingBean
    public Clock ottoClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(OutboundMessageStore.class)
    protected MongoOutboundMessageStore mongoOutboundMessageStore(MongoTemplate mongoTemplate) {
        return new MongoOutboundMessageStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(SessionBindingStore.class)
    protected MongoSessionBindingStore mongoSessionBindingStore(MongoTemplate mongoTemplate) {
        return new MongoSessionBindingStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(NotificationPolicyStore.class)
    protected MongoNotificationPolicyStore mongoNotificationPolicyStore(MongoTemplate mongoTemplate) {
        return new MongoNotificationPolicyStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected OttoMongoIndexConfig ottoMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new OttoMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboundEnqueuer outboundEnqueuer(OutboundMessageStore outboundStore) {
        return new OutboundEnqueuer(outboundStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskConfigLoader taskConfigLoader(OttoProperties props) {
        return new TaskConfigLoader(props.homePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureWatchdog failureWatchdog(OttoProperties props, JobStore jobStore, OutboundEnqueuer enqueuer) {
        return new FailureWatchdog(jobStore, enqueuer, props.getWatchdog().toSettings().chatId());
    }

    @Bean
    @ConditionalOnMissingBean
    public HeartbeatTask heartbeatTask(OttoProperties props,
                                       JobStore jobStore,
                                       OutboundEnqueuer enqueuer,
                                       NotificationPolicyStore policyStore) {
        return new HeartbeatTask(jobStore, enqueuer, policyStore, props.heartbeatChatId());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SessionGateway.class)
    public TaskExecutionEngine taskExecutionEngine(JobStore jobStore,
                                                   SessionGateway sessionGateway,
                                                   SessionBindingStore sessionBindings,
                                                   TaskConfigLoader taskConfigLoader,
                                                   FailureWatchdog watchdog,
                                                   HeartbeatTask heartbeat,
                                                   ObjectMapper objectMapper,
                                                   Clock clock) {
        return new TaskExecutionEngine(jobStore, sessionGateway, sessionBindings, taskConfigLoader,
                watchdog, heartbeat, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SessionGateway.class)
    public SchedulerKernel schedulerKernel(OttoProperties props,
                                           JobStore jobStore,
                                           TaskExecutionEngine engine,
                                           Clock clock) {
        return new SchedulerKernel(jobStore, engine, props.getScheduler().toSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TransportSender.class)
    @ConditionalOnProperty(prefix = "otto.outbound", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OutboundQueueProcessor outboundQueueProcessor(OttoProperties props,
                                                         OutboundMessageStore outboundStore,
                                                         TransportSender sender,
                                                         NotificationPolicyStore policyStore,
                                                         JobStore jobStore) {
        return new OutboundQueueProcessor(outboundStore, sender, policyStore, props.getOutbound().toRetryPolicy(),
                props.getOutbound().isQuietPeriodDigest() ? jobStore : null);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TransportSender.class)
    @ConditionalOnProperty(prefix = "otto.outbound", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OutboundQueueWorker outboundQueueWorker(OttoProperties props,
                                                   OutboundQueueProcessor processor,
                                                   Clock clock) {
        return new OutboundQueueWorker(processor, props.getOutbound().getDrainInterval(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SessionGateway.class)
    public OttoScheduler ottoScheduler(JobStore jobStore,
                                       SchedulerKernel kernel,
                                       ObjectProvider<OutboundQueueWorker> outboundWorker,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        return new DefaultOttoScheduler(jobStore, kernel, outboundWorker.getIfAvailable(), objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public OttoLifecycle ottoLifecycle(ObjectProvider<OttoScheduler> scheduler,
                                       ObjectProvider<OutboundQueueWorker> outboundWorker) {
        return new OttoLifecycle(scheduler.getIfAvailable(), outboundWorker.getIfAvailable());
    }

    @Bean
    @ConditionalOnBean(SessionGateway.class)
    @ConditionalOnProperty(prefix = "otto.watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SmartInitializingSingleton ottoWatchdogInstaller(OttoProperties props,
                                                            JobStore jobStore,
                                                            ObjectMapper objectMapper,
                                                            Clock clock) {
        return () -> WatchdogTasks.ensureWatchdogTask(
                jobStore, props.getWatchdog().toSettings(), objectMapper, clock.instant());
    }

    @Bean
    @ConditionalOnBean(SessionGateway.class)
    @ConditionalOnProperty(prefix = "otto.heartbeat", name = "enabled", havingValue = "true")
    public SmartInitializingSingleton ottoHeartbeatInstaller(OttoProperties props,
                                                             JobStore jobStore,
                                                             ObjectMapper objectMapper,
                                                             Clock clock) {
        return () -> HeartbeatTasks.ensureHeartbeatTask(jobStore, props.getHeartbeat().getCadenceMinutes(),
                props.heartbeatChatId(), objectMapper, clock.instant());
    }

    @Bean
    @ConditionalOnProperty(prefix = "otto", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton ottoIndexesInitializer(OttoMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
