package io.clype.reactorkinesis.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.reactorkinesis.model.StreamIdentifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class KinesisWriterMetricsTest {

    private SimpleMeterRegistry registry;
    private KinesisWriterMetrics metrics;
    private static final StreamIdentifier STREAM =
            StreamIdentifier.of("arn:aws:kinesis:us-east-1:123456789012:stream/example");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new KinesisWriterMetrics(registry, STREAM);
    }

    @Test
    void shouldRecordCompletedBatch() {
        metrics.recordBatch(10, 0, 5_000_000L); // 5ms in nanos

        assertEquals(1.0, registry.counter("kinesis.writer.batches.completed", "stream", "example").count());
        assertEquals(0.0, registry.counter("kinesis.writer.batches.partial", "stream", "example").count());
        assertEquals(10.0, registry.counter("kinesis.writer.records.accepted", "stream", "example").count());
    }

    @Test
    void shouldRecordPartialBatch() {
        metrics.recordBatch(7, 3, 5_000_000L);

        assertEquals(0.0, registry.counter("kinesis.writer.batches.completed", "stream", "example").count());
        assertEquals(1.0, registry.counter("kinesis.writer.batches.partial", "stream", "example").count());
        assertEquals(7.0, registry.counter("kinesis.writer.records.accepted", "stream", "example").count());
        assertEquals(3.0, registry.counter("kinesis.writer.records.rejected", "stream", "example").count());
    }

    @Test
    void shouldRecordBatchFailure() {
        metrics.recordBatchFailure();

        assertEquals(1.0, registry.counter("kinesis.writer.batches.failed", "stream", "example").count());
        // A failed call reports no per-record results
        assertEquals(0.0, registry.counter("kinesis.writer.records.rejected", "stream", "example").count());
    }

    @Test
    void shouldCountEnqueuedRecords() {
        metrics.recordEnqueued();
        metrics.recordEnqueued();

        assertEquals(2.0, registry.counter("kinesis.writer.records.enqueued", "stream", "example").count());
    }

    @Test
    void shouldTrackQueueDepth() {
        assertEquals(0.0, registry.get("kinesis.writer.queue.depth").gauge().value());

        metrics.updateQueueDepth(42);
        assertEquals(42.0, registry.get("kinesis.writer.queue.depth").gauge().value());

        metrics.updateQueueDepth(0);
        assertEquals(0.0, registry.get("kinesis.writer.queue.depth").gauge().value());
    }

    @Test
    void shouldRecordLatency() {
        metrics.recordBatch(10, 0, 5_000_000L); // 5ms
        metrics.recordBatch(10, 0, 10_000_000L); // 10ms

        var timer = registry.timer("kinesis.writer.submit.latency", "stream", "example");
        assertEquals(2, timer.count());
        assertEquals(0.015, timer.totalTime(java.util.concurrent.TimeUnit.SECONDS), 0.001);
    }

    @Test
    void shouldRecordBatchSize() {
        metrics.recordBatch(10, 0, 5_000_000L);
        metrics.recordBatch(3, 2, 3_000_000L);
        metrics.recordBatch(8, 0, 4_000_000L);

        var summary = registry.summary("kinesis.writer.batch.size", "stream", "example");
        assertEquals(3, summary.count());
        assertEquals(23.0, summary.totalAmount());
    }

    @Test
    void shouldTagWithPlainStreamName() {
        var plain = new KinesisWriterMetrics(registry, StreamIdentifier.of("orders"));
        plain.recordEnqueued();

        assertEquals(1.0, registry.counter("kinesis.writer.records.enqueued", "stream", "orders").count());
    }

    @Test
    void shouldHandleNullStream() {
        var metricsWithoutStream = new KinesisWriterMetrics(registry, null);
        metricsWithoutStream.recordBatch(5, 0, 1_000_000L);

        // Should use "unknown" as stream name
        assertEquals(1.0, registry.counter("kinesis.writer.batches.completed", "stream", "unknown").count());
    }
}
