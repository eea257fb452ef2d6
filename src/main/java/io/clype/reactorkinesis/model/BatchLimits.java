package io.clype.reactorkinesis.model;

import com.google.common.base.Utf8;

/**
 * Size and count ceilings applied when assembling a batch.
 *
 * <p>These mirror the limits the stream service enforces on a single batch call. They are
 * transport-imposed constants rather than tuning knobs: a batch assembled locally under these
 * limits must never be rejected by the service for its size. {@link #KINESIS} carries the
 * documented Kinesis Data Streams {@code PutRecords} limits.</p>
 *
 * <p>A record's encoded size is its data length plus the UTF-8 length of its partition key
 * plus {@code recordOverheadBytes}. Kinesis counts only data and key against both the
 * per-record and per-call ceilings, so its overhead is zero.</p>
 *
 * @param maxRecordsPerBatch   maximum number of records in one batch call
 * @param maxBytesPerBatch     maximum total encoded size of one batch call
 * @param maxRecordBytes       maximum encoded size of a single record
 * @param maxPartitionKeyBytes maximum UTF-8 length of a partition key
 * @param recordOverheadBytes  fixed per-record envelope counted against both ceilings
 */
public record BatchLimits(
    int maxRecordsPerBatch,
    int maxBytesPerBatch,
    int maxRecordBytes,
    int maxPartitionKeyBytes,
    int recordOverheadBytes
) {

    /** Kinesis Data Streams PutRecords limits: 500 records, 5 MiB per call, 1 MiB per record. */
    public static final BatchLimits KINESIS = new BatchLimits(500, 5 * 1024 * 1024, 1024 * 1024, 256, 0);

    /**
     * @throws IllegalArgumentException if any ceiling is not positive, the overhead is negative,
     *                                  or a single record could exceed the batch byte ceiling
     */
    public BatchLimits {
        if (maxRecordsPerBatch <= 0) {
            throw new IllegalArgumentException("maxRecordsPerBatch must be positive");
        }
        if (maxBytesPerBatch <= 0) {
            throw new IllegalArgumentException("maxBytesPerBatch must be positive");
        }
        if (maxRecordBytes <= 0) {
            throw new IllegalArgumentException("maxRecordBytes must be positive");
        }
        if (maxPartitionKeyBytes <= 0) {
            throw new IllegalArgumentException("maxPartitionKeyBytes must be positive");
        }
        if (recordOverheadBytes < 0) {
            throw new IllegalArgumentException("recordOverheadBytes must not be negative");
        }
        if (maxRecordBytes > maxBytesPerBatch) {
            throw new IllegalArgumentException("maxRecordBytes must not exceed maxBytesPerBatch");
        }
    }

    /**
     * Returns a copy of these limits with a different record count ceiling.
     */
    public BatchLimits withMaxRecordsPerBatch(int maxRecordsPerBatch) {
        return new BatchLimits(maxRecordsPerBatch, maxBytesPerBatch, maxRecordBytes,
                maxPartitionKeyBytes, recordOverheadBytes);
    }

    /**
     * Computes the size the service charges for a record.
     */
    public int encodedSize(PendingRecord record) {
        return Math.toIntExact(encodedSize(record.data().length, Utf8.encodedLength(record.partitionKey())));
    }

    long encodedSize(int dataBytes, int partitionKeyBytes) {
        return (long) dataBytes + partitionKeyBytes + recordOverheadBytes;
    }

    /**
     * Checks a prospective record against the per-record ceilings.
     *
     * @param data         serialized message
     * @param partitionKey routing key
     * @throws RecordTooLargeException if the key or the whole record is over its ceiling
     */
    public void validate(byte[] data, String partitionKey) {
        validate(data.length, partitionKey);
    }

    void validate(int dataBytes, String partitionKey) {
        int keyBytes = Utf8.encodedLength(partitionKey);
        if (keyBytes > maxPartitionKeyBytes) {
            throw RecordTooLargeException.partitionKey(keyBytes, maxPartitionKeyBytes);
        }
        long recordBytes = encodedSize(dataBytes, keyBytes);
        if (recordBytes > maxRecordBytes) {
            throw RecordTooLargeException.record(recordBytes, dataBytes, keyBytes, maxRecordBytes);
        }
    }
}
