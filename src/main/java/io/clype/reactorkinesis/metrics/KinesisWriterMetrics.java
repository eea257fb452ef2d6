package io.clype.reactorkinesis.metrics;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.clype.reactorkinesis.model.StreamIdentifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Collects and exposes metrics for a Kinesis batch writer.
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code kinesis.writer.records.enqueued} - Counter of records admitted to the queue</li>
 *   <li>{@code kinesis.writer.records.accepted} - Counter of records the service stored</li>
 *   <li>{@code kinesis.writer.records.rejected} - Counter of records rejected and requeued</li>
 *   <li>{@code kinesis.writer.batches.completed} - Counter of batches with every record accepted</li>
 *   <li>{@code kinesis.writer.batches.partial} - Counter of batches with at least one rejection</li>
 *   <li>{@code kinesis.writer.batches.failed} - Counter of batch calls that threw</li>
 *   <li>{@code kinesis.writer.submit.latency} - Timer measuring batch call latency (p50, p95, p99)</li>
 *   <li>{@code kinesis.writer.batch.size} - Summary of records per batch</li>
 *   <li>{@code kinesis.writer.queue.depth} - Gauge of records waiting in the queue</li>
 * </ul>
 *
 * <p>All metrics are tagged with the stream name for multi-stream environments.</p>
 */
public class KinesisWriterMetrics {

    private static final String METRIC_PREFIX = "kinesis.writer";
    private static final double[] SUBMIT_LATENCY_PERCENTILES = {0.5, 0.95, 0.99};

    private final Counter recordsEnqueued;
    private final Counter recordsAccepted;
    private final Counter recordsRejected;
    private final Counter batchesCompleted;
    private final Counter batchesPartial;
    private final Counter batchesFailed;
    private final Timer submitLatency;
    private final DistributionSummary batchSize;
    private final AtomicInteger queueDepth;

    /**
     * Creates a new KinesisWriterMetrics instance.
     *
     * @param registry the Micrometer registry to register metrics with
     * @param stream   the destination stream (used for tagging metrics)
     */
    public KinesisWriterMetrics(MeterRegistry registry, StreamIdentifier stream) {
        Tags tags = Tags.of("stream", stream != null ? stream.name() : "unknown");

        this.recordsEnqueued = Counter.builder(METRIC_PREFIX + ".records.enqueued")
                .description("Number of records admitted to the writer queue")
                .tags(tags)
                .register(registry);

        this.recordsAccepted = Counter.builder(METRIC_PREFIX + ".records.accepted")
                .description("Number of records accepted by Kinesis")
                .tags(tags)
                .register(registry);

        this.recordsRejected = Counter.builder(METRIC_PREFIX + ".records.rejected")
                .description("Number of records rejected by Kinesis and requeued")
                .tags(tags)
                .register(registry);

        this.batchesCompleted = Counter.builder(METRIC_PREFIX + ".batches.completed")
                .description("Number of batches in which every record was accepted")
                .tags(tags)
                .register(registry);

        this.batchesPartial = Counter.builder(METRIC_PREFIX + ".batches.partial")
                .description("Number of batches in which at least one record was rejected")
                .tags(tags)
                .register(registry);

        this.batchesFailed = Counter.builder(METRIC_PREFIX + ".batches.failed")
                .description("Number of batch calls that failed as a whole")
                .tags(tags)
                .register(registry);

        this.submitLatency = Timer.builder(METRIC_PREFIX + ".submit.latency")
                .description("Time taken by a PutRecords call")
                .tags(tags)
                .publishPercentiles(SUBMIT_LATENCY_PERCENTILES)
                .register(registry);

        this.batchSize = DistributionSummary.builder(METRIC_PREFIX + ".batch.size")
                .description("Number of records per batch")
                .tags(tags)
                .register(registry);

        this.queueDepth = new AtomicInteger(0);
        Gauge.builder(METRIC_PREFIX + ".queue.depth", queueDepth, AtomicInteger::get)
                .description("Number of records waiting in the writer queue")
                .tags(tags)
                .register(registry);
    }

    /**
     * Records a record admitted to the queue.
     */
    public void recordEnqueued() {
        recordsEnqueued.increment();
    }

    /**
     * Records the result of a completed batch call.
     *
     * @param acceptedCount records accepted by the service
     * @param rejectedCount records rejected and requeued
     * @param latencyNanos  call duration in nanoseconds
     */
    public void recordBatch(int acceptedCount, int rejectedCount, long latencyNanos) {
        recordsAccepted.increment(acceptedCount);
        recordsRejected.increment(rejectedCount);
        if (rejectedCount == 0) {
            batchesCompleted.increment();
        } else {
            batchesPartial.increment();
        }
        submitLatency.record(latencyNanos, TimeUnit.NANOSECONDS);
        batchSize.record(acceptedCount + rejectedCount);
    }

    /**
     * Records a batch call that threw instead of returning per-record results.
     */
    public void recordBatchFailure() {
        batchesFailed.increment();
    }

    /**
     * Updates the queue depth gauge.
     *
     * @param depth current number of queued records
     */
    public void updateQueueDepth(int depth) {
        queueDepth.set(depth);
    }
}
