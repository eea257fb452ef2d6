package io.clype.reactorkinesis.service;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.reactorkinesis.model.QueueNotDrainedException;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Flushes a {@link KinesisBatchWriter} until its queue is empty.
 *
 * <p>Each {@link #drain()} subscription calls {@code flush()} on a dedicated single thread,
 * pausing between calls so a throttled stream is not hammered. The loop ends when a flush
 * reports an empty queue, or fails with {@link QueueNotDrainedException} once
 * {@code maxFlushes} calls have been made. A failure of the batch call itself is propagated
 * as-is and is not retried.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * drainer.drain()
 *     .subscribe(
 *         flushes -> log.info("Queue drained after {} flushes", flushes),
 *         error -> log.error("Failed to drain queue", error));
 * }</pre>
 *
 * <p><b>Thread Safety:</b> All flushes run on the drainer's own thread, but the writer is not
 * thread-safe: do not enqueue from other threads while a drain is in progress, and do not run
 * two drains at once.</p>
 *
 * <p><b>Resource Management:</b> This class implements {@link DisposableBean} and releases its
 * thread when the Spring context is destroyed.</p>
 */
public class QueueDrainer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(QueueDrainer.class);

    public static final Duration DEFAULT_PAUSE = Duration.ofMillis(100);
    public static final int DEFAULT_MAX_FLUSHES = 1000;

    private final KinesisBatchWriter writer;
    private final Duration pause;
    private final int maxFlushes;
    private final Scheduler scheduler;

    /**
     * Creates a drainer with the default pause and flush budget.
     *
     * @param writer the writer to drain
     */
    public QueueDrainer(KinesisBatchWriter writer) {
        this(writer, DEFAULT_PAUSE, DEFAULT_MAX_FLUSHES);
    }

    /**
     * @param writer     the writer to drain
     * @param pause      delay between consecutive flushes
     * @param maxFlushes maximum flushes per drain
     * @throws NullPointerException     if writer or pause is null
     * @throws IllegalArgumentException if pause is negative or maxFlushes is not positive
     */
    public QueueDrainer(KinesisBatchWriter writer, Duration pause, int maxFlushes) {
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
        this.pause = Objects.requireNonNull(pause, "pause cannot be null");
        if (pause.isNegative()) {
            throw new IllegalArgumentException("pause must not be negative");
        }
        if (maxFlushes <= 0) {
            throw new IllegalArgumentException("maxFlushes must be positive");
        }
        this.maxFlushes = maxFlushes;
        this.scheduler = Schedulers.newSingle("kinesis-writer-drain");
    }

    /**
     * Flushes until the writer's queue is empty.
     *
     * @return a Mono emitting the number of flushes made; errors with
     *         {@link QueueNotDrainedException} if the budget runs out, or with the transport's
     *         exception if a batch call fails
     */
    public Mono<Integer> drain() {
        return Mono.defer(() -> flushUntilDrained(1));
    }

    private Mono<Integer> flushUntilDrained(int attempt) {
        return Mono.fromCallable(writer::flush)
                .subscribeOn(scheduler)
                .flatMap(workRemains -> {
                    if (!workRemains) {
                        log.debug("Stream {} drained after {} flushes", writer.getStream().name(), attempt);
                        return Mono.just(attempt);
                    }
                    if (attempt >= maxFlushes) {
                        int remaining = writer.getQueueSize();
                        log.warn("Stream {} not drained after {} flushes; {} records remain queued",
                                writer.getStream().name(), attempt, remaining);
                        return Mono.error(new QueueNotDrainedException(attempt, remaining));
                    }
                    return Mono.delay(pause, scheduler)
                            .then(Mono.defer(() -> flushUntilDrained(attempt + 1)));
                });
    }

    /**
     * Disposes of the drain thread when the Spring context is destroyed.
     */
    @Override
    public void destroy() {
        scheduler.dispose();
    }
}
