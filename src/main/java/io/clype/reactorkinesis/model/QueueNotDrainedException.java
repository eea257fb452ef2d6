package io.clype.reactorkinesis.model;

/**
 * Signals that a drain loop used up its flush budget while records were still queued.
 *
 * <p>The records remain in the writer's queue; draining again later will resume with them.</p>
 */
public class QueueNotDrainedException extends RuntimeException {

    private final int flushCount;
    private final int remainingRecords;

    public QueueNotDrainedException(int flushCount, int remainingRecords) {
        super(String.format("Queue not drained after %d flushes: %d records remain",
                flushCount, remainingRecords));
        this.flushCount = flushCount;
        this.remainingRecords = remainingRecords;
    }

    public int getFlushCount() {
        return flushCount;
    }

    public int getRemainingRecords() {
        return remainingRecords;
    }
}
