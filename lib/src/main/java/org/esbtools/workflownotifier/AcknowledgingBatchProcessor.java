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

package org.esbtools.workflownotifier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.esbtools.workflownotifier.model.MalformedMessageException;
import org.esbtools.workflownotifier.model.WorkflowMessage;
import org.esbtools.workflownotifier.model.WorkflowMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Submits requests to an asynchronous {@link BatchSink} and acknowledges each request's source
 * {@link LogMessage} once the sink reports what happened to it.
 *
 * <p>Every submitted message is tracked in a {@link DispatchTable} under its identity key until
 * resolved:
 *
 * <ul>
 *     <li>A message submitted while another with the same key is pending is acked right away
 *     and never reaches the sink. The pending one speaks for both.</li>
 *     <li>Successful items are acked. Permanently failed items are nacked.</li>
 *     <li>Retryable items stay pending. The sink retries them and reports them again in a later
 *     batch.</li>
 * </ul>
 *
 * <p>Each source message is therefore acked or nacked exactly once, unless it is still pending
 * when this processor is {@link #stop() stopped}, in which case it is never acknowledged and the
 * log redelivers it.
 *
 * @param <R> The sink's request type.
 */
@ThreadSafe
public class AcknowledgingBatchProcessor<R> implements BatchListener<R> {
    private final String name;
    private final DispatchTable<PendingMessage> pending;
    private final RequestKeyResolver<R> keyResolver;
    private final WorkflowMessageDecoder decoder;
    private final MeterRegistry registry;

    private final Counter requests;
    private final Counter retries;
    private final Counter failures;
    private final Counter duplicates;
    private final Timer ackLatency;

    private volatile BatchSink<R> sink;

    private static final Logger log = LoggerFactory.getLogger(AcknowledgingBatchProcessor.class);

    public AcknowledgingBatchProcessor(String name, DispatchTable<PendingMessage> pending,
            RequestKeyResolver<R> keyResolver, WorkflowMessageDecoder decoder,
            MeterRegistry registry) {
        this.name = Objects.requireNonNull(name, "name");
        this.pending = Objects.requireNonNull(pending, "pending");
        this.keyResolver = Objects.requireNonNull(keyResolver, "keyResolver");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.registry = Objects.requireNonNull(registry, "registry");

        requests = Counter.builder(Metrics.BATCH_REQUESTS)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
        retries = Counter.builder(Metrics.BATCH_RETRIES)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
        failures = Counter.builder(Metrics.BATCH_FAILURES)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
        duplicates = Counter.builder(Metrics.DUPLICATES)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
        ackLatency = Timer.builder(Metrics.ACK_LATENCY)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
    }

    /**
     * Starts the sink, registering this processor as its listener. Must be called once, before
     * {@link #submit(String, Object, LogMessage)}.
     */
    public synchronized void start(BatchSinkFactory<R> sinkFactory) throws Exception {
        if (sink != null) {
            throw new IllegalStateException("Batch processor " + name + " already started");
        }

        sink = sinkFactory.start(this);

        log.info("Started batch processor {}", name);
    }

    /**
     * Hands {@code request} to the sink and tracks {@code message} until the sink reports the
     * request's outcome, unless a message with the same {@code key} is already pending, in which
     * case {@code message} is acked immediately and {@code request} is dropped.
     *
     * <p>If this throws, {@code message} is not tracked and acknowledging it is up to the caller.
     */
    public void submit(String key, R request, LogMessage message) throws InterruptedException {
        BatchSink<R> sink = this.sink;

        if (sink == null) {
            throw new IllegalStateException("Batch processor " + name + " not started");
        }

        PendingMessage entry = new PendingMessage(message, Timer.start(registry), ackLatency);

        DispatchTable.PutResult<PendingMessage> put = pending.putIfAbsent(key, entry,
                (duplicateKey, existing) -> {
                    duplicates.increment();
                    log.debug("Message at partition {} offset {} duplicates pending key {} " +
                            "(partition {} offset {}); acking it.", message.partition(),
                            message.offset(), duplicateKey, existing.message().partition(),
                            existing.message().offset());
                    MessageAcknowledgements.ack(message);
                });

        if (put.wasDuplicate()) {
            return;
        }

        try {
            sink.submit(request);
        } catch (InterruptedException | RuntimeException e) {
            pending.remove(key, entry);
            throw e;
        }
    }

    @Override
    public void beforeBatch(long executionId, List<R> batch) {
        requests.increment(batch.size());
        log.debug("[{}] Committing batch {} of {} requests", name, executionId, batch.size());
    }

    @Override
    public void afterBatch(long executionId, List<R> batch, BatchResult result) {
        Optional<BatchFailure> failure = result.failure();

        if (failure.isPresent()) {
            onBatchFailure(executionId, batch, failure.get());
            return;
        }

        List<BatchItemResult> items = result.items();

        if (items.size() != batch.size()) {
            log.error("[{}] Batch {} has {} requests but {} results. Unmatched requests stay " +
                    "pending.", name, executionId, batch.size(), items.size());
        }

        for (int i = 0; i < Math.min(batch.size(), items.size()); i++) {
            R request = batch.get(i);
            BatchItemResult item = items.get(i);
            Optional<String> maybeKey = keyResolver.keyOf(request);

            if (!maybeKey.isPresent()) {
                log.error("[{}] Cannot resolve key of request {} in batch {}; skipping result {}",
                        name, request, executionId, item);
                continue;
            }

            String key = maybeKey.get();

            switch (StatusClass.of(item.status())) {
                case SUCCESS:
                    resolveSuccess(key);
                    break;
                case PERMANENT:
                    resolveFailure(key, item.status(), item.error().orElse("(no details)"));
                    break;
                case RETRYABLE:
                    retries.increment();
                    log.info("[{}] Request for key {} in batch {} will be retried. Status: {}, " +
                            "error: {}", name, key, executionId, item.status(),
                            item.error().orElse("(no details)"));
                    break;
            }
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Stops the sink, which flushes what it can, then forgets every message still pending. Those
     * are never acknowledged.
     */
    public void stop() {
        BatchSink<R> sink = this.sink;

        if (sink != null) {
            sink.stop();
        }

        int abandoned = pending.clear();

        if (abandoned > 0) {
            log.warn("[{}] Stopped with {} messages never acknowledged; they will be redelivered.",
                    name, abandoned);
        } else {
            log.info("Stopped batch processor {}", name);
        }
    }

    private void onBatchFailure(long executionId, List<R> batch, BatchFailure failure) {
        failures.increment();

        if (StatusClass.isRetryable(failure.status())) {
            log.warn("[{}] Batch {} of {} requests failed and will be retried. Status: {}, " +
                    "details: {}", name, executionId, batch.size(), failure.status(),
                    failure.details(), failure.cause().orElse(null));
            return;
        }

        log.error("[{}] Batch {} of {} requests failed permanently. Status: {}, details: {}",
                name, executionId, batch.size(), failure.status(), failure.details(),
                failure.cause().orElse(null));

        for (R request : batch) {
            Optional<String> key = keyResolver.keyOf(request);

            if (!key.isPresent()) {
                log.error("[{}] Cannot resolve key of request {} in failed batch {}; skipping",
                        name, request, executionId);
                continue;
            }

            resolveFailure(key.get(), failure.status(), failure.details());
        }
    }

    private void resolveSuccess(String key) {
        Optional<PendingMessage> entry = pending.remove(key);

        if (!entry.isPresent()) {
            log.debug("[{}] No pending message for key {}; already resolved.", name, key);
            return;
        }

        entry.get().ack();
    }

    private void resolveFailure(String key, int status, String details) {
        Optional<PendingMessage> entry = pending.remove(key);

        if (!entry.isPresent()) {
            log.debug("[{}] No pending message for key {}; already resolved.", name, key);
            return;
        }

        log.error("[{}] Delivery of {} failed permanently. Status: {}, details: {}",
                name, describe(entry.get().message()), status, details);

        entry.get().nack();
    }

    private String describe(LogMessage message) {
        try {
            WorkflowMessage workflow = decoder.decode(message.value());
            return "workflow " + workflow.getWorkflowId() + " run " + workflow.getRunId() +
                    " in domain " + workflow.getDomainId() + " (partition " +
                    message.partition() + " offset " + message.offset() + ")";
        } catch (MalformedMessageException e) {
            return "message at partition " + message.partition() + " offset " +
                    message.offset();
        }
    }
}
