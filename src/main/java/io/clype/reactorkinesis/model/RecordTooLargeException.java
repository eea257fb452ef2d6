package io.clype.reactorkinesis.model;

/**
 * Thrown by {@code enqueue} when a record can never be accepted by the service.
 *
 * <p>Either the whole record (data plus partition key) exceeds the single-record ceiling, or
 * the partition key alone exceeds the key ceiling. The record is not added to the queue.</p>
 */
public class RecordTooLargeException extends IllegalArgumentException {

    private final long recordBytes;
    private final int limitBytes;

    private RecordTooLargeException(String message, long recordBytes, int limitBytes) {
        super(message);
        this.recordBytes = recordBytes;
        this.limitBytes = limitBytes;
    }

    static RecordTooLargeException record(long recordBytes, int dataBytes, int partitionKeyBytes, int limitBytes) {
        return new RecordTooLargeException(String.format(
                "message too large: %d (base message length = %d, partition key length = %d, limit = %d)",
                recordBytes, dataBytes, partitionKeyBytes, limitBytes),
                recordBytes, limitBytes);
    }

    static RecordTooLargeException partitionKey(int partitionKeyBytes, int limitBytes) {
        return new RecordTooLargeException(String.format(
                "partition key too large: %d (limit = %d)", partitionKeyBytes, limitBytes),
                partitionKeyBytes, limitBytes);
    }

    /**
     * Returns the size that exceeded the limit: the whole record, or the key alone.
     */
    public long getRecordBytes() {
        return recordBytes;
    }

    public int getLimitBytes() {
        return limitBytes;
    }
}
