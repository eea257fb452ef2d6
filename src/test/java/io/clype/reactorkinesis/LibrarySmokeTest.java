package io.clype.reactorkinesis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import io.clype.reactorkinesis.config.KinesisWriterAutoConfiguration;
import io.clype.reactorkinesis.config.KinesisWriterMetricsAutoConfiguration;
import io.clype.reactorkinesis.config.KinesisWriterProperties;
import io.clype.reactorkinesis.metrics.KinesisWriterMetrics;
import io.clype.reactorkinesis.model.BatchLimits;
import io.clype.reactorkinesis.model.RecordOutcome;
import io.clype.reactorkinesis.service.KinesisBatchWriter;
import io.clype.reactorkinesis.service.QueueDrainer;
import io.clype.reactorkinesis.transport.KinesisStreamTransport;
import io.clype.reactorkinesis.transport.StreamTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;

import static org.assertj.core.api.Assertions.assertThat;

class LibrarySmokeTest {

    private static final String STREAM_ARN = "arn:aws:kinesis:us-east-1:123456789012:stream/example";

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(KinesisWriterAutoConfiguration.class))
            .withPropertyValues("kinesis.writer.region=us-east-1");

    private static StreamTransport acceptingTransport() {
        return (stream, records) -> {
            List<RecordOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < records.size(); i++) {
                outcomes.add(RecordOutcome.accepted("shardId-000000000000", String.valueOf(i)));
            }
            return outcomes;
        };
    }

    @Test
    void testAutoConfigurationWithoutProperties() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(KinesisBatchWriter.class);
            assertThat(context).doesNotHaveBean(KinesisAsyncClient.class);
        });
    }

    @Test
    void testAutoConfigurationWithProperties() {
        contextRunner
                .withPropertyValues("kinesis.writer.stream=" + STREAM_ARN)
                .run(context -> {
                    assertThat(context).hasSingleBean(KinesisBatchWriter.class);
                    assertThat(context).hasSingleBean(KinesisAsyncClient.class);
                    assertThat(context).hasSingleBean(QueueDrainer.class);
                    assertThat(context.getBean(StreamTransport.class)).isInstanceOf(KinesisStreamTransport.class);

                    KinesisBatchWriter writer = context.getBean(KinesisBatchWriter.class);
                    assertThat(writer.getStream().isArn()).isTrue();
                    assertThat(writer.getStream().name()).isEqualTo("example");
                    assertThat(writer.getLimits()).isEqualTo(BatchLimits.KINESIS);

                    KinesisWriterProperties properties = context.getBean(KinesisWriterProperties.class);
                    assertThat(properties.isLogBatches()).isFalse(); // Default
                    assertThat(properties.getMaxConnections()).isEqualTo(50); // Default
                });
    }

    @Test
    void testCustomProperties() {
        contextRunner
                .withPropertyValues(
                        "kinesis.writer.stream=example",
                        "kinesis.writer.log-batches=true",
                        "kinesis.writer.max-connections=10",
                        "kinesis.writer.drain.pause=250ms",
                        "kinesis.writer.drain.max-flushes=20")
                .run(context -> {
                    assertThat(context).hasSingleBean(KinesisBatchWriter.class);

                    KinesisWriterProperties properties = context.getBean(KinesisWriterProperties.class);
                    assertThat(properties.isLogBatches()).isTrue();
                    assertThat(properties.getMaxConnections()).isEqualTo(10);
                    assertThat(properties.getDrain().getPause()).isEqualTo(Duration.ofMillis(250));
                    assertThat(properties.getDrain().getMaxFlushes()).isEqualTo(20);
                });
    }

    @Test
    void testDefaultDrainProperties() {
        contextRunner
                .withPropertyValues("kinesis.writer.stream=example")
                .run(context -> {
                    KinesisWriterProperties properties = context.getBean(KinesisWriterProperties.class);
                    assertThat(properties.getDrain().getPause()).isEqualTo(Duration.ofMillis(100));
                    assertThat(properties.getDrain().getMaxFlushes()).isEqualTo(1000);
                    // Same defaults as a drainer built without explicit pacing
                    assertThat(properties.getDrain().getPause()).isEqualTo(QueueDrainer.DEFAULT_PAUSE);
                    assertThat(properties.getDrain().getMaxFlushes()).isEqualTo(QueueDrainer.DEFAULT_MAX_FLUSHES);
                    // Default metrics enabled
                    assertThat(properties.getMetrics().isEnabled()).isTrue();
                });
    }

    @Test
    void testCustomTransportReplacesKinesisClient() {
        contextRunner
                .withBean(StreamTransport.class, LibrarySmokeTest::acceptingTransport)
                .withPropertyValues("kinesis.writer.stream=example")
                .run(context -> {
                    assertThat(context).hasSingleBean(KinesisBatchWriter.class);
                    assertThat(context).doesNotHaveBean(KinesisStreamTransport.class);

                    KinesisBatchWriter writer = context.getBean(KinesisBatchWriter.class);
                    writer.enqueue("message", "key");
                    assertThat(writer.flush()).isFalse();
                    assertThat(writer.getLastBatch().successCount()).isEqualTo(1);
                });
    }

    @Test
    void testMetricsAutoConfigurationWithMeterRegistry() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(KinesisWriterMetricsAutoConfiguration.class))
                .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .withBean(StreamTransport.class, LibrarySmokeTest::acceptingTransport)
                .withPropertyValues("kinesis.writer.stream=" + STREAM_ARN)
                .run(context -> {
                    assertThat(context).hasSingleBean(KinesisWriterMetrics.class);

                    context.getBean(KinesisBatchWriter.class).enqueue("message");
                    SimpleMeterRegistry registry = context.getBean(SimpleMeterRegistry.class);
                    assertThat(registry.counter("kinesis.writer.records.enqueued", "stream", "example").count())
                            .isEqualTo(1.0);
                });
    }

    @Test
    void testMetricsDisabledWhenPropertyFalse() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(KinesisWriterMetricsAutoConfiguration.class))
                .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues(
                        "kinesis.writer.stream=" + STREAM_ARN,
                        "kinesis.writer.metrics.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(KinesisWriterMetrics.class);
                    assertThat(context).hasSingleBean(KinesisBatchWriter.class);
                });
    }

    @Test
    void testMetricsNotCreatedWithoutMeterRegistry() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(KinesisWriterMetricsAutoConfiguration.class))
                .withPropertyValues("kinesis.writer.stream=" + STREAM_ARN)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(KinesisWriterMetrics.class);
                });
    }
}
