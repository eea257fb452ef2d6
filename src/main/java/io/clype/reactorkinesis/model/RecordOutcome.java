package io.clype.reactorkinesis.model;

/**
 * The service's verdict on one record of a submitted batch.
 *
 * <p>Outcomes are positional: the i-th outcome returned by a transport describes the i-th
 * record submitted. This record keeps AWS SDK types out of the writer's API.</p>
 *
 * @param accepted       true if the service stored the record
 * @param shardId        shard the record was written to (accepted only)
 * @param sequenceNumber sequence number assigned by the shard (accepted only)
 * @param errorCode      service error code, e.g. {@code ProvisionedThroughputExceededException} (rejected only)
 * @param errorMessage   service error message (rejected only)
 */
public record RecordOutcome(
    boolean accepted,
    String shardId,
    String sequenceNumber,
    String errorCode,
    String errorMessage
) {

    public static RecordOutcome accepted(String shardId, String sequenceNumber) {
        return new RecordOutcome(true, shardId, sequenceNumber, null, null);
    }

    public static RecordOutcome rejected(String errorCode, String errorMessage) {
        return new RecordOutcome(false, null, null, errorCode, errorMessage);
    }
}
