package io.clype.reactorkinesis.model;

/**
 * Status information about a writer's queue.
 *
 * @param queuedRecords number of records waiting to be sent (including requeued failures)
 * @param queuedBytes   total encoded size of the queued records
 */
public record WriterStatus(
    int queuedRecords,
    long queuedBytes
) {}
