package io.suite4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.suite4j.Discovery;
import io.suite4j.ReportSink;
import io.suite4j.Scheduler;
import io.suite4j.core.ClassReport;
import io.suite4j.core.DiscoveryFailure;
import io.suite4j.core.DiscoveryResult;
import io.suite4j.core.RunEndReason;
import io.suite4j.core.RunSummary;
import io.suite4j.internal.mongo.ClassResultDocument;
import io.suite4j.internal.mongo.MongoReportSink;
import io.suite4j.internal.mongo.MongoResultStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SuiteAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SuiteConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "suite4j.run-id=test-run",
                    "suite4j.max-failures=3",
                    "suite4j.runner-timeout=30s",
                    "suite4j.shutdown-grace=0s"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Scheduler.class);
            assertThat(context).hasSingleBean(SchedulerLifecycle.class);
            assertThat(context).hasSingleBean(SchedulerProperties.class);
            assertThat(context).hasSingleBean(MongoResultStore.class);
            assertThat(context).hasSingleBean(MongoReportSink.class);

            SchedulerProperties props = context.getBean(SchedulerProperties.class);
            assertThat(props.getMaxFailures()).isEqualTo(3);
            assertThat(props.getMaxTimeouts()).isEqualTo(2);
            assertThat(props.getRunnerTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(context.getBean(Scheduler.class).runId()).isEqualTo("test-run");
            assertThat(context.getBean(SchedulerLifecycle.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("suite4j.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Scheduler.class);
                    assertThat(context).doesNotHaveBean(MongoReportSink.class);
                });
    }

    @Test
    void shouldSkipMongoSinkWhenSwitchedOff() {
        contextRunner
                .withPropertyValues("suite4j.report.mongo.enabled=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(Scheduler.class);
                    assertThat(context).doesNotHaveBean(MongoReportSink.class);
                    assertThat(context).doesNotHaveBean(MongoResultStore.class);
                });
    }

    @Test
    void shouldSkipMongoSinkWithoutMongoTemplate() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SuiteConfig.class))
                .withPropertyValues("suite4j.shutdown-grace=0s")
                .run(context -> {
                    assertThat(context).hasSingleBean(Scheduler.class);
                    assertThat(context).doesNotHaveBean(MongoReportSink.class);
                });
    }

    @Test
    void shouldBindSchedulerPropertiesWithoutMongo() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SuiteConfig.class))
                .withPropertyValues(
                        "suite4j.run-id=plain-run",
                        "suite4j.max-failures=5",
                        "suite4j.max-timeouts=4",
                        "suite4j.runner-timeout=45s",
                        "suite4j.shutdown-grace=0s"
                )
                .run(context -> {
                    assertThat(context).doesNotHaveBean(MongoReportSink.class);

                    SchedulerProperties props = context.getBean(SchedulerProperties.class);
                    assertThat(props.getMaxFailures()).isEqualTo(5);
                    assertThat(props.getMaxTimeouts()).isEqualTo(4);
                    assertThat(props.getRunnerTimeout()).isEqualTo(Duration.ofSeconds(45));
                    assertThat(context.getBean(Scheduler.class).runId()).isEqualTo("plain-run");
                });
    }

    @Test
    void shouldBindSchedulerPropertiesWhenMongoSinkIsSwitchedOff() {
        contextRunner
                .withPropertyValues("suite4j.report.mongo.enabled=false", "suite4j.max-timeouts=7")
                .run(context -> {
                    SchedulerProperties props = context.getBean(SchedulerProperties.class);
                    assertThat(props.getMaxFailures()).isEqualTo(3);
                    assertThat(props.getMaxTimeouts()).isEqualTo(7);
                    assertThat(context.getBean(Scheduler.class).runId()).isEqualTo("test-run");
                });
    }

    @Test
    void shouldFeedDiscoveryIntoTheRunOnStartup() {
        RecordingSink sink = new RecordingSink();
        contextRunner
                .withPropertyValues("suite4j.report.mongo.enabled=false")
                .withBean(ReportSink.class, () -> sink)
                .withBean(Discovery.class, () -> () -> DiscoveryResult.of(List.of()))
                .run(context -> {
                    RunSummary summary = context.getBean(Scheduler.class).termination().get(2, TimeUnit.SECONDS);
                    assertThat(summary.reason()).isEqualTo(RunEndReason.EXHAUSTED);
                    assertThat(summary.runId()).isEqualTo("test-run");
                    assertThat(sink.runs).containsExactly(summary);
                });
    }

    @Test
    void shouldTurnDiscoveryExceptionIntoDiscoveryFailure() {
        RecordingSink sink = new RecordingSink();
        contextRunner
                .withPropertyValues("suite4j.report.mongo.enabled=false")
                .withBean(ReportSink.class, () -> sink)
                .withBean(Discovery.class, () -> () -> {
                    throw new ClassNotFoundException("pkg.Missing");
                })
                .run(context -> {
                    RunSummary summary = context.getBean(Scheduler.class).termination().get(2, TimeUnit.SECONDS);
                    assertThat(summary.reason()).isEqualTo(RunEndReason.DISCOVERY_FAILED);
                    assertThat(sink.discoveryFailures).hasSize(1);
                    assertThat(sink.discoveryFailures.get(0).message()).contains("pkg.Missing");
                });
    }

    @Test
    void shouldEnsureIndexesWhenRequested() {
        IndexOperations indexOps = mock(IndexOperations.class);
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        when(mongoTemplate.indexOps(ClassResultDocument.class)).thenReturn(indexOps);

        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SuiteConfig.class))
                .withBean(MongoTemplate.class, () -> mongoTemplate)
                .withPropertyValues(
                        "suite4j.shutdown-grace=0s",
                        "suite4j.report.mongo.ensure-indexes-on-startup=true"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    verify(indexOps, times(2)).ensureIndex(any(Index.class));
                });
    }

    static class RecordingSink implements ReportSink {
        final List<ClassReport> classes = new CopyOnWriteArrayList<>();
        final List<DiscoveryFailure> discoveryFailures = new CopyOnWriteArrayList<>();
        final List<RunSummary> runs = new CopyOnWriteArrayList<>();

        @Override
        public void classFinished(ClassReport report) {
            classes.add(report);
        }

        @Override
        public void discoveryFailed(String runId, DiscoveryFailure failure) {
            discoveryFailures.add(failure);
        }

        @Override
        public void runFinished(RunSummary summary) {
            runs.add(summary);
        }
    }
}
