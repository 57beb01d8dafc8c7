package io.otto4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.otto4j.OttoScheduler;
import io.otto4j.execution.TaskExecutionEngine;
import io.otto4j.heartbeat.HeartbeatTask;
import io.otto4j.heartbeat.HeartbeatTasks;
import io.otto4j.internal.mongo.JobDocument;
import io.otto4j.kernel.SchedulerKernel;
import io.otto4j.outbound.OutboundEnqueuer;
import io.otto4j.outbound.OutboundQueueWorker;
import io.otto4j.spi.JobStore;
import io.otto4j.spi.MediaAttachment;
import io.otto4j.spi.PromptOptions;
import io.otto4j.spi.SessionGateway;
import io.otto4j.spi.TransportSender;
import io.otto4j.watchdog.FailureWatchdog;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class OttoAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OttoConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "otto.enabled=true",
                    "otto.home=target/otto-test-home",
                    "otto.scheduler.tick-interval=5s",
                    "otto.scheduler.lock-lease=30s",
                    "otto.watchdog.enabled=false"
            );

    @Test
    void shouldAutoConfigureStoresWithoutCollaborators() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(OttoProperties.class);
            assertThat(context).hasSingleBean(JobStore.class);
            assertThat(context).hasSingleBean(OutboundEnqueuer.class);
            assertThat(context).hasSingleBean(FailureWatchdog.class);
            assertThat(context).hasSingleBean(OttoLifecycle.class);
            assertThat(context).doesNotHaveBean(TaskExecutionEngine.class);
            assertThat(context).doesNotHaveBean(OttoScheduler.class);
            assertThat(context).doesNotHaveBean(OutboundQueueWorker.class);
        });
    }

    @Test
    void shouldAutoConfigureSchedulerAndWorkerWithCollaborators() {
        contextRunner
                .withBean(SessionGateway.class, DemoSessionGateway::new)
                .withBean(TransportSender.class, DemoTransportSender::new)
                .withPropertyValues("otto.outbound.drain-interval=500ms")
                .run(context -> {
                    assertThat(context).hasSingleBean(TaskExecutionEngine.class);
                    assertThat(context).hasSingleBean(SchedulerKernel.class);
                    assertThat(context).hasSingleBean(OttoScheduler.class);
                    assertThat(context).hasSingleBean(OutboundQueueWorker.class);
                    assertThat(context.getBean(OttoProperties.class).getOutbound().getDrainInterval())
                            .isEqualTo(Duration.ofMillis(500));
                    assertThat(context.getBean(OttoLifecycle.class).isRunning()).isTrue();
                });
    }

    @Test
    void heartbeatInstallerShouldBeOptIn() {
        contextRunner
                .withBean(SessionGateway.class, DemoSessionGateway::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(HeartbeatTask.class);
                    assertThat(context).doesNotHaveBean("ottoHeartbeatInstaller");
                });
    }

    @Test
    void enabledHeartbeatShouldInstallRecurringJob() {
        contextRunner
                .withBean(SessionGateway.class, DemoSessionGateway::new)
                .withPropertyValues("otto.heartbeat.enabled=true", "otto.heartbeat.cadence-minutes=5",
                        "otto.watchdog.default-chat-id=42")
                .run(context -> {
                    assertThat(context).hasBean("ottoHeartbeatInstaller");
                    assertThat(context.getBean(OttoProperties.class).heartbeatChatId()).isEqualTo(42L);

                    ArgumentCaptor<Object> inserted = ArgumentCaptor.forClass(Object.class);
                    verify(context.getBean(MongoTemplate.class), atLeastOnce()).insert(inserted.capture());
                    assertThat(inserted.getAllValues())
                            .filteredOn(JobDocument.class::isInstance)
                            .map(doc -> ((JobDocument) doc).getType())
                            .containsExactly(HeartbeatTasks.HEARTBEAT_TASK_TYPE);
                });
    }

    @Test
    void outboundDisabledShouldSkipWorker() {
        contextRunner
                .withBean(TransportSender.class, DemoTransportSender::new)
                .withPropertyValues("otto.outbound.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(OutboundQueueWorker.class));
    }

    @Test
    void disabledShouldBackOff() {
        contextRunner
                .withPropertyValues("otto.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(OttoConfig.class);
                    assertThat(context).doesNotHaveBean(JobStore.class);
                });
    }

    @Test
    void invalidSchedulerSettingsShouldFailStartup() {
        contextRunner
                .withBean(SessionGateway.class, DemoSessionGateway::new)
                .withPropertyValues("otto.scheduler.batch-size=0")
                .run(context -> assertThat(context).hasFailed());
    }

    static class DemoSessionGateway implements SessionGateway {
        @Override
        public String ensureSession(String existingSessionId) {
            return existingSessionId != null ? existingSessionId : "session-1";
        }

        @Override
        public String promptSession(String sessionId, String text, PromptOptions options) {
            return "{\"status\":\"success\",\"summary\":\"ok\",\"notify\":false}";
        }
    }

    static class DemoTransportSender implements TransportSender {
        @Override
        public void sendMessage(long chatId, String text) {
            // no-op for context bootstrap test
        }

        @Override
        public void sendDocument(long chatId, MediaAttachment document) {
            // no-op for context bootstrap test
        }

        @Override
        public void sendPhoto(long chatId, MediaAttachment photo) {
            // no-op for context bootstrap test
        }
    }
}
