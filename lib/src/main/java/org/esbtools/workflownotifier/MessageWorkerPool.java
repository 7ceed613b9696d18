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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fixed number of threads, each pulling messages off a shared {@link MessageStream} and passing
 * them to a {@link MessageHandler}. A message whose handler throws is nacked; the thread carries
 * on with the next one.
 */
@ThreadSafe
public class MessageWorkerPool {
    private final String name;
    private final MessageStream stream;
    private final MessageHandler handler;
    private final int concurrency;
    private final Duration pollTimeout;
    private final MeterRegistry registry;

    private final Timer processLatency;
    private final Counter processFailures;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;

    private static final Duration INTERRUPTED_GRACE = Duration.ofSeconds(1);

    private static final Logger log = LoggerFactory.getLogger(MessageWorkerPool.class);

    public MessageWorkerPool(String name, MessageStream stream, MessageHandler handler,
            int concurrency, Duration pollTimeout, MeterRegistry registry) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1 but was " +
                    concurrency);
        }

        this.name = Objects.requireNonNull(name, "name");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.concurrency = concurrency;
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.registry = Objects.requireNonNull(registry, "registry");

        processLatency = Timer.builder(Metrics.PROCESS_LATENCY)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
        processFailures = Counter.builder(Metrics.PROCESS_FAILURES)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Worker pool " + name + " already started");
        }

        running.set(true);
        executor = Executors.newFixedThreadPool(concurrency, new ThreadFactoryBuilder()
                .setNameFormat(name + "-worker-%d")
                .build());

        for (int i = 0; i < concurrency; i++) {
            executor.execute(this::pullMessages);
        }

        executor.shutdown();

        log.info("Started {} workers for {}", concurrency, name);
    }

    /**
     * Tells workers to stop pulling. Each finishes the message it is processing first.
     */
    public void signalStop() {
        running.set(false);
    }

    /**
     * Waits for every worker to finish its current message. On timeout, workers are interrupted.
     *
     * @return False if workers did not finish within {@code timeout}.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService executor;

        synchronized (this) {
            executor = this.executor;
        }

        if (executor == null) {
            return true;
        }

        if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return true;
        }

        executor.shutdownNow();
        executor.awaitTermination(INTERRUPTED_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        return false;
    }

    private void pullMessages() {
        while (running.get() && !stream.isStopped()) {
            Optional<LogMessage> next;

            try {
                next = stream.poll(pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("[{}] Worker interrupted while waiting for a message", name);
                return;
            }

            if (next.isPresent()) {
                process(next.get());
            }
        }
    }

    private void process(LogMessage message) {
        Timer.Sample sample = Timer.start(registry);

        try {
            handler.handle(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted processing message at partition {} offset {}; nacking.",
                    name, message.partition(), message.offset());
            MessageAcknowledgements.nack(message);
        } catch (Exception e) {
            processFailures.increment();
            log.error("[{}] Failed to process message at partition {} offset {}; nacking.",
                    name, message.partition(), message.offset(), e);
            MessageAcknowledgements.nack(message);
        } finally {
            sample.stop(processLatency);
        }
    }
}
