package io.clype.reactorkinesis.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.reactorkinesis.model.PendingRecord;
import io.clype.reactorkinesis.model.RecordOutcome;
import io.clype.reactorkinesis.model.StreamIdentifier;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kinesis.KinesisAsyncClient;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequestEntry;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResultEntry;

/**
 * {@link StreamTransport} backed by the Kinesis Data Streams {@code PutRecords} API.
 *
 * <p>The async client is used so the writer can share the CRT HTTP client with the rest of the
 * application; each call blocks on the returned future. SDK exceptions ({@code KinesisException},
 * {@code SdkClientException}) are unwrapped from the {@link CompletionException} and rethrown
 * unchanged, so callers see the same exception types as with the synchronous client.</p>
 *
 * <p><b>Thread Safety:</b> This class is stateless and thread-safe.</p>
 */
public class KinesisStreamTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(KinesisStreamTransport.class);

    private final KinesisAsyncClient kinesisClient;

    /**
     * @param kinesisClient the AWS Kinesis async client
     * @throws NullPointerException if kinesisClient is null
     */
    public KinesisStreamTransport(KinesisAsyncClient kinesisClient) {
        this.kinesisClient = Objects.requireNonNull(kinesisClient, "kinesisClient cannot be null");
    }

    @Override
    public List<RecordOutcome> submitBatch(StreamIdentifier stream, List<PendingRecord> records) {
        PutRecordsRequest request = buildRequest(stream, records);
        log.trace("Submitting {} records to stream {}", records.size(), stream.name());

        PutRecordsResponse response = await(request);

        List<PutRecordsResultEntry> results = response.records();
        if (results.size() != records.size()) {
            throw new StreamTransportException(String.format(
                    "PutRecords returned %d results for %d records", results.size(), records.size()));
        }

        List<RecordOutcome> outcomes = new ArrayList<>(results.size());
        for (PutRecordsResultEntry result : results) {
            outcomes.add(toOutcome(result));
        }
        return outcomes;
    }

    private PutRecordsRequest buildRequest(StreamIdentifier stream, List<PendingRecord> records) {
        List<PutRecordsRequestEntry> entries = new ArrayList<>(records.size());
        for (PendingRecord record : records) {
            entries.add(PutRecordsRequestEntry.builder()
                    .data(SdkBytes.fromByteArrayUnsafe(record.data()))
                    .partitionKey(record.partitionKey())
                    .build());
        }

        PutRecordsRequest.Builder builder = PutRecordsRequest.builder().records(entries);
        if (stream.isArn()) {
            builder.streamARN(stream.value());
        } else {
            builder.streamName(stream.value());
        }
        return builder.build();
    }

    private PutRecordsResponse await(PutRecordsRequest request) {
        try {
            return kinesisClient.putRecords(request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new StreamTransportException("PutRecords failed", cause != null ? cause : e);
        }
    }

    private static RecordOutcome toOutcome(PutRecordsResultEntry result) {
        if (result.errorCode() != null) {
            return RecordOutcome.rejected(result.errorCode(), result.errorMessage());
        }
        return RecordOutcome.accepted(result.shardId(), result.sequenceNumber());
    }
}
