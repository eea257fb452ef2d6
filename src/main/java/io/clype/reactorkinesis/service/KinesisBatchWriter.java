package io.clype.reactorkinesis.service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorkinesis.metrics.KinesisWriterMetrics;
import io.clype.reactorkinesis.model.BatchLimits;
import io.clype.reactorkinesis.model.BatchStatistics;
import io.clype.reactorkinesis.model.MessagePayload;
import io.clype.reactorkinesis.model.PendingRecord;
import io.clype.reactorkinesis.model.RecordOutcome;
import io.clype.reactorkinesis.model.RecordTooLargeException;
import io.clype.reactorkinesis.model.StreamIdentifier;
import io.clype.reactorkinesis.model.WriterStatus;
import io.clype.reactorkinesis.transport.StreamTransport;
import io.clype.reactorkinesis.transport.StreamTransportException;

/**
 * Batching writer for a Kinesis data stream.
 *
 * <p>Messages are added with {@code enqueue} and sent with {@link #flush()}. Each flush submits
 * one batch, taken from the head of the queue and bounded by the {@link BatchLimits} record
 * count and byte ceilings. Records the service rejects (typically because a shard is throttled)
 * are put back at the head of the queue, in their original order, so the next flush retries them
 * before anything enqueued later.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * KinesisBatchWriter writer = new KinesisBatchWriter(transport, StreamIdentifier.of("example"));
 * writer.enqueue("message 1", "argle");
 * writer.enqueueJson(Map.of("foo", 123));
 *
 * while (writer.flush()) {
 *     Thread.sleep(100);
 * }
 * }</pre>
 *
 * <p><b>Error Handling:</b></p>
 * <ul>
 *   <li>A record larger than the service accepts is refused by {@code enqueue} with
 *       {@link RecordTooLargeException} and never queued.</li>
 *   <li>Per-record rejections are absorbed and retried on the next flush; {@code flush()}
 *       returns {@code true} while anything remains queued.</li>
 *   <li>If the batch call itself throws, the exception propagates unchanged and the records
 *       of that batch are no longer queued. Callers that need at-least-once delivery across
 *       connectivity failures must handle that themselves.</li>
 * </ul>
 *
 * <p>There is no timer, retry limit or backoff here: the caller decides how often to flush.
 * {@link QueueDrainer} provides a paced flush loop on top of this class.</p>
 *
 * <p><b>Thread Safety:</b> This class is <em>not</em> thread-safe. Calls to {@code enqueue} and
 * {@code flush} must come from one thread at a time.</p>
 */
public class KinesisBatchWriter {

    private static final Logger log = LoggerFactory.getLogger(KinesisBatchWriter.class);

    /** Pattern for sanitizing log output - removes all control characters. */
    private static final Pattern LOG_SANITIZE_PATTERN = Pattern.compile("[\\p{Cntrl}\\p{Cc}]");

    private final StreamTransport transport;
    private final StreamIdentifier stream;
    private final BatchLimits limits;
    private final boolean logBatches;
    private final Supplier<String> defaultPartitionKey;
    private final PayloadSerializer serializer;
    private final KinesisWriterMetrics metrics;

    private final Deque<PendingRecord> queue = new ArrayDeque<>();
    private long queuedBytes;
    private BatchStatistics lastBatch = BatchStatistics.EMPTY;

    /**
     * Creates a writer with Kinesis limits, no batch logging and no metrics.
     *
     * @param transport the transport used to submit batches
     * @param stream    the destination stream
     */
    public KinesisBatchWriter(StreamTransport transport, StreamIdentifier stream) {
        this(transport, stream, BatchLimits.KINESIS, false, Clock.systemUTC(), null);
    }

    /**
     * Creates a writer with Kinesis limits and no metrics.
     *
     * @param transport  the transport used to submit batches
     * @param stream     the destination stream
     * @param logBatches if true, each flush logs its batch size and results at DEBUG
     */
    public KinesisBatchWriter(StreamTransport transport, StreamIdentifier stream, boolean logBatches) {
        this(transport, stream, BatchLimits.KINESIS, logBatches, Clock.systemUTC(), null);
    }

    /**
     * Creates a writer with full configuration options.
     *
     * @param transport  the transport used to submit batches
     * @param stream     the destination stream
     * @param limits     batch and record ceilings, normally {@link BatchLimits#KINESIS}
     * @param logBatches if true, each flush logs its batch size and results at DEBUG
     * @param clock      time source for default partition keys
     * @param metrics    optional metrics collector (may be null)
     * @throws NullPointerException if transport, stream, limits or clock is null
     */
    public KinesisBatchWriter(
            StreamTransport transport,
            StreamIdentifier stream,
            BatchLimits limits,
            boolean logBatches,
            Clock clock,
            KinesisWriterMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.stream = Objects.requireNonNull(stream, "stream cannot be null");
        this.limits = Objects.requireNonNull(limits, "limits cannot be null");
        this.defaultPartitionKey = PartitionKeys.epochSeconds(clock);
        this.logBatches = logBatches;
        this.serializer = new PayloadSerializer();
        this.metrics = metrics;

        log.debug("Created writer for stream {} with {}", stream.name(), limits);
    }

    // ==========================================================================
    // Enqueue
    // ==========================================================================

    /**
     * Adds raw bytes to the queue with a time-based partition key.
     *
     * @throws RecordTooLargeException if the record exceeds the single-record ceiling
     */
    public void enqueue(byte[] message) {
        enqueue(MessagePayload.of(message), null);
    }

    /**
     * Adds raw bytes to the queue.
     *
     * @param partitionKey routing key; null or empty selects a time-based key
     * @throws RecordTooLargeException if the key or record exceeds its ceiling
     */
    public void enqueue(byte[] message, String partitionKey) {
        enqueue(MessagePayload.of(message), partitionKey);
    }

    /**
     * Adds text, encoded as UTF-8, to the queue with a time-based partition key.
     *
     * @throws RecordTooLargeException if the record exceeds the single-record ceiling
     */
    public void enqueue(String message) {
        enqueue(MessagePayload.of(message), null);
    }

    /**
     * Adds text, encoded as UTF-8, to the queue.
     *
     * @param partitionKey routing key; null or empty selects a time-based key
     * @throws RecordTooLargeException if the key or record exceeds its ceiling
     */
    public void enqueue(String message, String partitionKey) {
        enqueue(MessagePayload.of(message), partitionKey);
    }

    /**
     * Adds a value, written as JSON, to the queue with a time-based partition key.
     *
     * @throws RecordTooLargeException if the record exceeds the single-record ceiling
     * @throws io.clype.reactorkinesis.model.PayloadSerializationException if the value cannot be written as JSON
     */
    public void enqueueJson(Object message) {
        enqueue(MessagePayload.structured(message), null);
    }

    /**
     * Adds a value, written as JSON, to the queue.
     *
     * @param partitionKey routing key; null or empty selects a time-based key
     * @throws RecordTooLargeException if the key or record exceeds its ceiling
     * @throws io.clype.reactorkinesis.model.PayloadSerializationException if the value cannot be written as JSON
     */
    public void enqueueJson(Object message, String partitionKey) {
        enqueue(MessagePayload.structured(message), partitionKey);
    }

    /**
     * Serializes a payload and appends it to the tail of the queue.
     *
     * <p>Never blocks and never contacts the stream. The default partition key, if needed,
     * is taken now rather than when the record is sent.</p>
     *
     * @param payload      the message
     * @param partitionKey routing key; null or empty selects a time-based key
     * @throws NullPointerException    if payload is null
     * @throws RecordTooLargeException if the key or record exceeds its ceiling
     */
    public void enqueue(MessagePayload payload, String partitionKey) {
        Objects.requireNonNull(payload, "payload cannot be null");

        byte[] data = serializer.serialize(payload);
        String key = (partitionKey == null || partitionKey.isEmpty())
                ? defaultPartitionKey.get()
                : partitionKey;
        limits.validate(data, key);

        PendingRecord record = new PendingRecord(data, key);
        queue.addLast(record);
        queuedBytes += limits.encodedSize(record);

        if (metrics != null) {
            metrics.recordEnqueued();
            metrics.updateQueueDepth(queue.size());
        }
    }

    // ==========================================================================
    // Flush
    // ==========================================================================

    /**
     * Sends one batch from the head of the queue.
     *
     * <p>Rejected records are reinserted at the head of the queue in their original relative
     * order. To send everything, call repeatedly, with a short pause between calls, until this
     * returns {@code false}.</p>
     *
     * @return true if records remain queued (unsent or rejected), false if the queue is empty
     * @throws RuntimeException whatever the transport throws when the batch call fails as a
     *                          whole; the records of that batch are not requeued
     */
    public boolean flush() {
        if (queue.isEmpty()) {
            return false;
        }

        List<PendingRecord> batch = takeBatch();
        if (logBatches) {
            log.debug("sending {} messages to stream {}", batch.size(), stream.name());
        }

        long startTime = System.nanoTime();
        List<RecordOutcome> outcomes = submit(batch);
        long latencyNanos = System.nanoTime() - startTime;

        processOutcomes(batch, outcomes);

        if (logBatches) {
            log.debug("sent {} messages to stream {}; {} successful; errors = {}",
                    lastBatch.batchSize(), stream.name(), lastBatch.successCount(),
                    lastBatch.failureMessages().stream()
                            .map(KinesisBatchWriter::sanitizeForLog)
                            .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        if (metrics != null) {
            metrics.recordBatch(lastBatch.successCount(), lastBatch.failureCount(), latencyNanos);
            metrics.updateQueueDepth(queue.size());
        }

        return !queue.isEmpty();
    }

    /**
     * Removes the longest prefix of the queue that fits the batch ceilings. At least one
     * record is always taken; enqueue guarantees any single record fits.
     */
    private List<PendingRecord> takeBatch() {
        List<PendingRecord> batch = new ArrayList<>(Math.min(queue.size(), limits.maxRecordsPerBatch()));
        long batchBytes = 0;

        while (!queue.isEmpty() && batch.size() < limits.maxRecordsPerBatch()) {
            PendingRecord next = queue.peekFirst();
            int recordBytes = limits.encodedSize(next);
            if (!batch.isEmpty() && batchBytes + recordBytes > limits.maxBytesPerBatch()) {
                break;
            }
            queue.pollFirst();
            batch.add(next);
            batchBytes += recordBytes;
        }

        queuedBytes -= batchBytes;
        return batch;
    }

    private List<RecordOutcome> submit(List<PendingRecord> batch) {
        try {
            List<RecordOutcome> outcomes = transport.submitBatch(stream, batch);
            if (outcomes == null || outcomes.size() != batch.size()) {
                throw new StreamTransportException(String.format(
                        "Transport returned %s outcomes for %d records",
                        outcomes == null ? "no" : String.valueOf(outcomes.size()), batch.size()));
            }
            return outcomes;
        } catch (RuntimeException e) {
            // TODO: offer an opt-in requeue of the in-flight batch once callers can tell
            // a rejected call from one the service may have partially applied
            log.warn("Batch of {} records to stream {} failed; the records are no longer queued: {}",
                    batch.size(), stream.name(), sanitizeForLog(e.getMessage()));
            if (metrics != null) {
                metrics.recordBatchFailure();
                metrics.updateQueueDepth(queue.size());
            }
            throw e;
        }
    }

    private void processOutcomes(List<PendingRecord> batch, List<RecordOutcome> outcomes) {
        List<PendingRecord> rejected = new ArrayList<>();
        Set<String> failureMessages = new LinkedHashSet<>();

        for (int i = 0; i < batch.size(); i++) {
            RecordOutcome outcome = outcomes.get(i);
            if (!outcome.accepted()) {
                rejected.add(batch.get(i));
                failureMessages.add(describeFailure(outcome));
            }
        }

        // Walk backwards so the first rejected record ends up at the head
        for (ListIterator<PendingRecord> it = rejected.listIterator(rejected.size()); it.hasPrevious(); ) {
            PendingRecord record = it.previous();
            queue.addFirst(record);
            queuedBytes += limits.encodedSize(record);
        }

        lastBatch = new BatchStatistics(batch.size(), batch.size() - rejected.size(), failureMessages);
    }

    private static String describeFailure(RecordOutcome outcome) {
        if (outcome.errorMessage() != null) {
            return outcome.errorMessage();
        }
        return outcome.errorCode() != null ? outcome.errorCode() : "unknown error";
    }

    // ==========================================================================
    // Introspection
    // ==========================================================================

    /**
     * Returns the results of the most recent flush that reached the service.
     */
    public BatchStatistics getLastBatch() {
        return lastBatch;
    }

    public WriterStatus getStatus() {
        return new WriterStatus(queue.size(), queuedBytes);
    }

    public int getQueueSize() {
        return queue.size();
    }

    /**
     * Returns a snapshot of the queued records, head first. The records carry copies of the
     * queued data, so changing them does not affect what is sent.
     */
    public List<PendingRecord> getQueuedRecords() {
        return queue.stream()
                .map(record -> new PendingRecord(record.data().clone(), record.partitionKey()))
                .collect(Collectors.toList());
    }

    public StreamIdentifier getStream() {
        return stream;
    }

    public BatchLimits getLimits() {
        return limits;
    }

    /**
     * Sanitizes a string for safe logging by removing all control characters.
     * Prevents log injection attacks including ANSI escape sequences.
     */
    private static String sanitizeForLog(String input) {
        if (input == null) {
            return "null";
        }
        return LOG_SANITIZE_PATTERN.matcher(input).replaceAll("_");
    }
}
