package io.clype.reactorkinesis.transport;

import java.util.List;

import io.clype.reactorkinesis.model.PendingRecord;
import io.clype.reactorkinesis.model.RecordOutcome;
import io.clype.reactorkinesis.model.StreamIdentifier;

/**
 * Submits a bounded batch of records to a stream.
 *
 * <p>Implementations block until the service answers. Individual records may be rejected
 * (for example when a shard is over its provisioned throughput); these are reported in the
 * returned list, one outcome per submitted record, in submission order. Failures of the call
 * as a whole (connectivity, authorization, stream not found) are thrown.</p>
 */
public interface StreamTransport {

    /**
     * Submits a batch.
     *
     * @param stream  destination stream
     * @param records records to write, within the service's per-call limits
     * @return one outcome per record, positionally aligned with {@code records}
     * @throws RuntimeException if the call as a whole fails
     */
    List<RecordOutcome> submitBatch(StreamIdentifier stream, List<PendingRecord> records);
}
