package io.clype.reactorkinesis.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.clype.reactorkinesis.service.QueueDrainer;

/**
 * Configuration properties for the Kinesis batch writer.
 *
 * <p>These properties are bound to the {@code kinesis.writer} prefix in your
 * application configuration.</p>
 *
 * <p><b>Example Configuration (application.yml):</b></p>
 * <pre>{@code
 * kinesis:
 *   writer:
 *     stream: arn:aws:kinesis:us-east-1:123456789012:stream/example
 *     region: us-east-1
 *     log-batches: false
 *     max-connections: 50
 *     metrics:
 *       enabled: true
 *     drain:
 *       pause: 100ms
 *       max-flushes: 1000
 * }</pre>
 *
 * <p>Batch ceilings are not configurable: they are the limits Kinesis enforces on
 * {@code PutRecords}.</p>
 *
 * @see KinesisWriterAutoConfiguration
 */
@ConfigurationProperties(prefix = "kinesis.writer")
public class KinesisWriterProperties {

    public static final int DEFAULT_MAX_CONNECTIONS = 50;
    public static final Duration DEFAULT_DRAIN_PAUSE = QueueDrainer.DEFAULT_PAUSE;
    public static final int DEFAULT_DRAIN_MAX_FLUSHES = QueueDrainer.DEFAULT_MAX_FLUSHES;

    private String stream;
    private String region;
    private boolean logBatches = false;
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;
    private MetricsConfig metrics = new MetricsConfig();
    private DrainConfig drain = new DrainConfig();

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public boolean isLogBatches() { return logBatches; }
    public void setLogBatches(boolean logBatches) { this.logBatches = logBatches; }

    public int getMaxConnections() { return maxConnections; }
    public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public DrainConfig getDrain() { return drain; }
    public void setDrain(DrainConfig drain) { this.drain = drain; }

    /** Metrics configuration. */
    public static class MetricsConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /** Pacing for {@link QueueDrainer}. */
    public static class DrainConfig {
        private Duration pause = DEFAULT_DRAIN_PAUSE;
        private int maxFlushes = DEFAULT_DRAIN_MAX_FLUSHES;

        public Duration getPause() { return pause; }
        public void setPause(Duration pause) { this.pause = pause; }

        public int getMaxFlushes() { return maxFlushes; }
        public void setMaxFlushes(int maxFlushes) { this.maxFlushes = maxFlushes; }
    }
}
