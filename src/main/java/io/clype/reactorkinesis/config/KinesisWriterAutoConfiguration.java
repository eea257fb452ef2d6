package io.clype.reactorkinesis.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.reactorkinesis.metrics.KinesisWriterMetrics;
import io.clype.reactorkinesis.model.BatchLimits;
import io.clype.reactorkinesis.model.StreamIdentifier;
import io.clype.reactorkinesis.service.KinesisBatchWriter;
import io.clype.reactorkinesis.service.QueueDrainer;
import io.clype.reactorkinesis.transport.KinesisStreamTransport;
import io.clype.reactorkinesis.transport.StreamTransport;

import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.crt.AwsCrtAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;

/**
 * Spring Boot auto-configuration for the Kinesis batch writer.
 *
 * <p>This configuration is automatically enabled when the {@code kinesis.writer.stream}
 * property is set in your application configuration.</p>
 *
 * <p><b>Bean Customization:</b> All beans created by this configuration use
 * {@code @ConditionalOnMissingBean}, allowing you to provide your own implementations
 * by defining beans of the same type in your application configuration. Supplying a
 * {@link StreamTransport} bean replaces the Kinesis client entirely.</p>
 *
 * <p><b>AWS Credentials:</b> The Kinesis client uses the default AWS credential provider chain.</p>
 *
 * <p><b>Thread Safety:</b> The {@link KinesisBatchWriter} bean is a singleton but is not
 * thread-safe; callers sharing it must serialize access.</p>
 *
 * @see KinesisWriterProperties
 * @see KinesisBatchWriter
 */
@AutoConfiguration
@EnableConfigurationProperties(KinesisWriterProperties.class)
@ConditionalOnProperty(prefix = "kinesis.writer", name = "stream")
public class KinesisWriterAutoConfiguration {

    private final KinesisWriterProperties properties;

    /**
     * Creates the auto-configuration with the given properties.
     *
     * @param properties the writer configuration properties
     */
    public KinesisWriterAutoConfiguration(KinesisWriterProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an AWS CRT-based async HTTP client.
     *
     * @return the configured async HTTP client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SdkAsyncHttpClient awsCrtHttpClient() {
        return AwsCrtAsyncHttpClient.builder()
                .maxConcurrency(properties.getMaxConnections())
                .connectionTimeout(Duration.ofSeconds(10))
                .connectionMaxIdleTime(Duration.ofSeconds(60))
                .build();
    }

    /**
     * Creates the AWS Kinesis async client.
     *
     * <p>If a region is specified in properties, it will be used. Otherwise, the client
     * uses the default AWS region provider chain (environment, system properties, profile).</p>
     *
     * @param httpClient the async HTTP client to use for API calls
     * @return the configured Kinesis async client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public KinesisAsyncClient kinesisAsyncClient(SdkAsyncHttpClient httpClient) {
        var builder = KinesisAsyncClient.builder()
                .httpClient(httpClient);

        if (properties.getRegion() != null && !properties.getRegion().isEmpty()) {
            builder.region(Region.of(properties.getRegion()));
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(KinesisAsyncClient.class)
    public StreamTransport kinesisStreamTransport(KinesisAsyncClient kinesisClient) {
        return new KinesisStreamTransport(kinesisClient);
    }

    /**
     * Creates the batch writer bean.
     *
     * @param transport the transport used to submit batches
     * @param metrics   optional metrics collector (may be null if metrics are disabled)
     * @return the configured writer
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(StreamTransport.class)
    public KinesisBatchWriter kinesisBatchWriter(
            StreamTransport transport,
            @Autowired(required = false) KinesisWriterMetrics metrics) {
        return new KinesisBatchWriter(
                transport,
                StreamIdentifier.of(properties.getStream()),
                BatchLimits.KINESIS,
                properties.isLogBatches(),
                Clock.systemUTC(),
                metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(KinesisBatchWriter.class)
    public QueueDrainer queueDrainer(KinesisBatchWriter writer) {
        var drain = properties.getDrain();
        return new QueueDrainer(writer, drain.getPause(), drain.getMaxFlushes());
    }
}
