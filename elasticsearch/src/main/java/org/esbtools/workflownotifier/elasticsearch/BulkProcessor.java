/*
 *  Copyright 2026 esbtools Contributors and/or its affiliates.
 *
 *  This file is part of esbtools.
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.esbtools.workflownotifier.elasticsearch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.esbtools.workflownotifier.BatchFailure;
import org.esbtools.workflownotifier.BatchItemResult;
import org.esbtools.workflownotifier.BatchListener;
import org.esbtools.workflownotifier.BatchResult;
import org.esbtools.workflownotifier.BatchSink;
import org.esbtools.workflownotifier.BatchSinkFactory;
import org.esbtools.workflownotifier.StatusClass;
import org.esbtools.workflownotifier.config.BulkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Groups submitted requests into bulk calls.
 *
 * <p>A batch is committed once {@code bulkActions} requests are queued, or every
 * {@code flushInterval}, whichever comes first. At most {@code numOfWorkers} batches are committed
 * at once. A bulk call which fails with a retryable status is retried after an exponential
 * backoff, up to {@code maxRetries} times.
 *
 * <p>Requests which come back with a retryable status, individually or because their whole
 * batch failed that way, are queued again and committed in a later batch. The
 * {@link BatchListener} hears about every attempt.
 */
@ThreadSafe
public class BulkProcessor implements BatchSink<BulkIndexRequest> {
    private final String name;
    private final BulkClient client;
    private final BatchListener<BulkIndexRequest> listener;
    private final int bulkActions;
    private final ExponentialBackoff backoff;
    private final int maxRetries;
    private final Duration stopTimeout;

    private final BlockingQueue<BulkIndexRequest> queue;
    private final Queue<BulkIndexRequest> retries = new ConcurrentLinkedQueue<>();
    private final Semaphore commitPermits;
    private final ScheduledExecutorService flusher;
    private final ExecutorService committers;

    private final AtomicLong executionIds = new AtomicLong(0);
    private final AtomicBoolean flushRequested = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private static final long OFFER_INTERVAL_MILLIS = 100;
    private static final int UNEXPECTED_FAILURE_STATUS = 0;

    private static final Logger log = LoggerFactory.getLogger(BulkProcessor.class);

    BulkProcessor(String name, BulkClient client, BatchListener<BulkIndexRequest> listener,
            BulkConfig config, Duration stopTimeout) {
        this.name = Objects.requireNonNull(name, "name");
        this.client = Objects.requireNonNull(client, "client");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.bulkActions = config.getBulkActions();
        this.backoff = new ExponentialBackoff(config.getInitialBackoff(), config.getMaxBackoff());
        this.maxRetries = config.getMaxRetries();
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");

        this.queue = new LinkedBlockingQueue<>(config.getQueueCapacity());
        this.commitPermits = new Semaphore(config.getNumOfWorkers());
        this.flusher = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat(name + "-bulk-flusher")
                .build());
        this.committers = Executors.newFixedThreadPool(config.getNumOfWorkers(),
                new ThreadFactoryBuilder()
                        .setNameFormat(name + "-bulk-committer-%d")
                        .build());

        long intervalMillis = config.getFlushInterval().toMillis();
        flusher.scheduleWithFixedDelay(this::flushSafely, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
    }

    /**
     * Creates processors which commit through {@code client}, started by an
     * {@link org.esbtools.workflownotifier.AcknowledgingBatchProcessor}.
     */
    public static BatchSinkFactory<BulkIndexRequest> factory(String name, BulkClient client,
            BulkConfig config, Duration stopTimeout) {
        return listener -> {
            BulkProcessor processor = new BulkProcessor(name, client, listener, config,
                    stopTimeout);
            log.info("Started bulk processor {} with {}", name, config);
            return processor;
        };
    }

    @Override
    public void submit(BulkIndexRequest request) throws InterruptedException {
        Objects.requireNonNull(request, "request");

        while (true) {
            if (stopped.get()) {
                throw new IllegalStateException("Bulk processor " + name + " is stopped");
            }

            if (queue.offer(request, OFFER_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                break;
            }
        }

        if (queue.size() >= bulkActions && flushRequested.compareAndSet(false, true)) {
            try {
                flusher.execute(this::flushSafely);
            } catch (RejectedExecutionException e) {
                flushRequested.set(false);
                log.debug("Bulk processor {} stopping; flush left to stop()", name);
            }
        }
    }

    /**
     * Commits whatever is queued, waits for in-flight batches up to the stop timeout, and shuts
     * down. Requests which still need retrying afterwards are dropped.
     */
    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        log.info("Stopping bulk processor {}", name);

        flusher.shutdown();

        try {
            if (!flusher.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Bulk processor {} flusher did not stop within {}", name, stopTimeout);
                flusher.shutdownNow();
            }

            flush();

            committers.shutdown();

            if (!committers.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Bulk processor {} batches still in flight after {}; abandoning them.",
                        name, stopTimeout);
                committers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted stopping bulk processor {}", name);
            committers.shutdownNow();
        }

        int dropped = queue.size() + retries.size();

        if (dropped > 0) {
            log.warn("Bulk processor {} stopped with {} requests never committed", name, dropped);
        }

        log.info("Stopped bulk processor {}", name);
    }

    long lastExecutionId() {
        return executionIds.get();
    }

    private void flushSafely() {
        flushRequested.set(false);

        try {
            flush();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Bulk processor {} failed to flush", name, e);
        }
    }

    /** Commits queued requests in batches of at most {@code bulkActions}. */
    private void flush() throws InterruptedException {
        while (true) {
            List<BulkIndexRequest> batch = new ArrayList<>(bulkActions);

            BulkIndexRequest retry;
            while (batch.size() < bulkActions && (retry = retries.poll()) != null) {
                batch.add(retry);
            }

            queue.drainTo(batch, bulkActions - batch.size());

            if (batch.isEmpty()) {
                return;
            }

            if (!commitPermits.tryAcquire(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Bulk processor {} has no free committer after {}; requeueing {} " +
                        "requests", name, stopTimeout, batch.size());
                retries.addAll(batch);
                return;
            }

            long executionId = executionIds.incrementAndGet();

            try {
                committers.execute(() -> {
                    try {
                        commit(executionId, batch);
                    } finally {
                        commitPermits.release();
                    }
                });
            } catch (RejectedExecutionException e) {
                commitPermits.release();
                retries.addAll(batch);
                log.warn("Bulk processor {} rejected batch {}; requeued",
                        name, executionId);
                return;
            }

            if (batch.size() < bulkActions) {
                return;
            }
        }
    }

    private void commit(long executionId, List<BulkIndexRequest> batch) {
        try {
            listener.beforeBatch(executionId, batch);
        } catch (RuntimeException e) {
            log.error("Bulk processor {} listener failed before batch {}", name, executionId, e);
        }

        BatchResult result;
        List<BulkIndexRequest> toRetry = new ArrayList<>();

        try {
            List<BatchItemResult> items = commitWithBackoff(executionId, batch);
            result = BatchResult.completed(items);

            for (int i = 0; i < items.size(); i++) {
                if (StatusClass.isRetryable(items.get(i).status())) {
                    toRetry.add(batch.get(i));
                }
            }
        } catch (BulkRequestException e) {
            result = BatchResult.failed(
                    new BatchFailure(e.status(), e.getMessage(), Optional.<Throwable>of(e)));

            if (StatusClass.isRetryable(e.status())) {
                toRetry.addAll(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Bulk processor {} interrupted committing batch {}", name, executionId);
            return;
        } catch (RuntimeException e) {
            log.error("Bulk processor {} failed unexpectedly committing batch {}",
                    name, executionId, e);
            result = BatchResult.failed(new BatchFailure(UNEXPECTED_FAILURE_STATUS,
                    e.toString(), Optional.<Throwable>of(e)));
        }

        try {
            listener.afterBatch(executionId, batch, result);
        } catch (RuntimeException e) {
            log.error("Bulk processor {} listener failed after batch {}", name, executionId, e);
        }

        if (!toRetry.isEmpty()) {
            if (stopped.get()) {
                log.warn("Bulk processor {} stopped; not retrying {} requests of batch {}",
                        name, toRetry.size(), executionId);
            } else {
                log.debug("Bulk processor {} requeueing {} requests of batch {}",
                        name, toRetry.size(), executionId);
                retries.addAll(toRetry);
            }
        }
    }

    private List<BatchItemResult> commitWithBackoff(long executionId,
            List<BulkIndexRequest> batch) throws BulkRequestException, InterruptedException {
        int attempt = 0;

        while (true) {
            try {
                return client.bulk(batch);
            } catch (BulkRequestException e) {
                if (!StatusClass.isRetryable(e.status()) || attempt >= maxRetries ||
                        stopped.get()) {
                    throw e;
                }

                Duration delay = backoff.delay(attempt);
                attempt++;

                log.warn("Bulk processor {} batch {} failed (attempt {} of {}); retrying in {}. " +
                        "Status: {}, message: {}", name, executionId, attempt, maxRetries + 1,
                        delay, e.status(), e.getMessage());

                Thread.sleep(delay.toMillis());
            }
        }
    }
}
