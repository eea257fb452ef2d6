package io.clype.reactorkinesis.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import io.clype.reactorkinesis.metrics.KinesisWriterMetrics;
import io.clype.reactorkinesis.model.StreamIdentifier;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Auto-configuration for Kinesis writer metrics.
 *
 * <p>This configuration is automatically enabled when:</p>
 * <ul>
 *   <li>Micrometer is on the classpath</li>
 *   <li>A {@link MeterRegistry} bean exists</li>
 *   <li>The {@code kinesis.writer.metrics.enabled} property is true (default)</li>
 * </ul>
 *
 * @see KinesisWriterMetrics
 */
@AutoConfiguration(after = KinesisWriterAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "kinesis.writer.metrics", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class KinesisWriterMetricsAutoConfiguration {

    /**
     * Creates the writer metrics bean.
     *
     * @param registry   the Micrometer meter registry
     * @param properties the writer configuration properties
     * @return the configured metrics instance
     */
    @Bean
    @ConditionalOnMissingBean
    public KinesisWriterMetrics kinesisWriterMetrics(
            MeterRegistry registry,
            KinesisWriterProperties properties) {
        String stream = properties.getStream();
        return new KinesisWriterMetrics(registry,
                stream != null && !stream.isBlank() ? StreamIdentifier.of(stream) : null);
    }
}
