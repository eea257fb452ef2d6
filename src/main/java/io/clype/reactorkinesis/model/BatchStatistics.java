package io.clype.reactorkinesis.model;

import java.util.Set;

/**
 * Summary of the most recent batch a writer submitted.
 *
 * @param batchSize       number of records submitted
 * @param successCount    number of records the service accepted
 * @param failureMessages distinct error messages reported for rejected records
 */
public record BatchStatistics(
    int batchSize,
    int successCount,
    Set<String> failureMessages
) {

    /** Statistics before any batch has been submitted. */
    public static final BatchStatistics EMPTY = new BatchStatistics(0, 0, Set.of());

    public BatchStatistics {
        failureMessages = Set.copyOf(failureMessages);
    }

    public int failureCount() {
        return batchSize - successCount;
    }
}
