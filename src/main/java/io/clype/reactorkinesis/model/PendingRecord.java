package io.clype.reactorkinesis.model;

import java.util.Objects;

/**
 * A serialized message waiting in a writer's queue.
 *
 * <p>The data array is held as given and must not be modified after the record is created.</p>
 *
 * @param data         the serialized message bytes
 * @param partitionKey the key the service uses to choose a shard
 */
public record PendingRecord(
    byte[] data,
    String partitionKey
) {
    public PendingRecord {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(partitionKey, "partitionKey cannot be null");
    }

    @Override
    public String toString() {
        return "PendingRecord[partitionKey=" + partitionKey + ", dataBytes=" + data.length + "]";
    }
}
