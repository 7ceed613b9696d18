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

import com.google.common.hash.Hashing;
import org.apache.camel.AsyncCallback;
import org.apache.camel.CamelContext;
import org.apache.camel.CamelExchangeException;
import org.apache.camel.Exchange;
import org.apache.camel.InvalidPayloadException;
import org.apache.camel.ProducerTemplate;
import org.apache.camel.builder.RouteBuilder;
import org.apache.camel.support.AsyncProcessorSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link MessageStream} fed by any Camel endpoint, such as a {@code kafka:} or {@code seda:}
 * URI.
 *
 * <p>Exchanges are routed asynchronously: an exchange is complete only once its message is
 * acked or nacked, so the consuming endpoint commits (or redelivers) based on what happened to
 * the message downstream. A nacked message is forwarded to the dead letter URI, if there is one,
 * before its exchange completes. Otherwise its exchange fails.
 *
 * <p>Partition and offset are read from Kafka's {@value #PARTITION_HEADER} and
 * {@value #OFFSET_HEADER} headers. Messages from other endpoints have no position in a log, so
 * they are placed in partition 0 at an offset derived from a SHA-256 hash of their body. A
 * redelivered message keeps its offset across restarts of the stream, and different messages
 * get different offsets.
 */
@ThreadSafe
public class CamelMessageStream implements MessageStream {
    public static final String PARTITION_HEADER = "kafka.PARTITION";
    public static final String OFFSET_HEADER = "kafka.OFFSET";

    private final CamelContext context;
    private final String fromUri;
    private final Optional<String> deadLetterUri;
    private final Duration routeStopTimeout;
    private final BlockingQueue<CamelLogMessage> received;
    private final Set<CamelLogMessage> outstanding = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ProducerTemplate producer;

    private final int idCount = idCounter.getAndIncrement();
    private final String routeId;

    private static final AtomicInteger idCounter = new AtomicInteger(0);
    private static final long OFFER_INTERVAL_MILLIS = 100;

    private static final Logger log = LoggerFactory.getLogger(CamelMessageStream.class);

    /**
     * @param queueCapacity How many received messages may wait for a worker. Once full, the
     *                      consuming endpoint is held back.
     * @param routeStopTimeout How long {@link #stop()} waits for the route to shut down.
     */
    public CamelMessageStream(CamelContext context, String name, String fromUri,
            Optional<String> deadLetterUri, int queueCapacity, Duration routeStopTimeout) {
        this.context = Objects.requireNonNull(context, "context");
        this.fromUri = Objects.requireNonNull(fromUri, "fromUri");
        this.deadLetterUri = Objects.requireNonNull(deadLetterUri, "deadLetterUri");
        this.routeStopTimeout = Objects.requireNonNull(routeStopTimeout, "routeStopTimeout");
        this.received = new LinkedBlockingQueue<>(queueCapacity);
        this.routeId = "messageStream-" + Objects.requireNonNull(name, "name") + "-" + idCount;
    }

    @Override
    public void start() throws Exception {
        if (stopped.get()) {
            throw new IllegalStateException("Message stream " + routeId + " was stopped");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        producer = context.createProducerTemplate();

        context.addRoutes(new RouteBuilder() {
            @Override
            public void configure() throws Exception {
                from(fromUri)
                .routeId(routeId)
                .process(new EnqueueingProcessor());
            }
        });

        log.info("Consuming {} on route {}", fromUri, routeId);
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true) || !started.get()) {
            return;
        }

        abandonOutstanding();

        try {
            context.getRouteController().stopRoute(routeId, routeStopTimeout.toMillis(),
                    TimeUnit.MILLISECONDS);
            context.removeRoute(routeId);
        } catch (Exception e) {
            log.warn("Failed to stop route {} cleanly", routeId, e);
        }

        // Anything which slipped in while the route stopped.
        abandonOutstanding();

        ProducerTemplate producer = this.producer;

        if (producer != null) {
            try {
                producer.stop();
            } catch (Exception e) {
                log.warn("Failed to stop producer of route {}", routeId, e);
            }
        }

        log.info("Stopped consuming {} on route {}", fromUri, routeId);
    }

    @Override
    public Optional<LogMessage> poll(Duration timeout) throws InterruptedException {
        if (stopped.get()) {
            return Optional.empty();
        }

        return Optional.ofNullable(received.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean isStopped() {
        return stopped.get();
    }

    static long contentOffset(byte[] body) {
        return Hashing.sha256().hashBytes(body).asLong() & Long.MAX_VALUE;
    }

    private void abandonOutstanding() {
        received.clear();

        List<CamelLogMessage> abandoned = new ArrayList<>(outstanding);
        for (CamelLogMessage message : abandoned) {
            message.abandon();
        }

        if (!abandoned.isEmpty()) {
            log.info("Returned {} unacknowledged messages to {}", abandoned.size(), fromUri);
        }
    }

    private class EnqueueingProcessor extends AsyncProcessorSupport {
        @Override
        public boolean process(Exchange exchange, AsyncCallback callback) {
            CamelLogMessage message;

            try {
                message = new CamelLogMessage(exchange, callback);
            } catch (InvalidPayloadException e) {
                exchange.setException(e);
                callback.done(true);
                return true;
            }

            outstanding.add(message);

            try {
                while (!stopped.get()) {
                    if (received.offer(message, OFFER_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                        return false;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            message.abandon();
            return false;
        }
    }

    private final class CamelLogMessage implements LogMessage {
        private final Exchange exchange;
        private final AsyncCallback callback;
        private final byte[] value;
        private final int partition;
        private final long offset;
        private final AtomicBoolean completed = new AtomicBoolean(false);

        CamelLogMessage(Exchange exchange, AsyncCallback callback)
                throws InvalidPayloadException {
            this.exchange = exchange;
            this.callback = callback;
            this.value = exchange.getIn().getMandatoryBody(byte[].class);

            Integer partitionHeader = exchange.getIn().getHeader(PARTITION_HEADER, Integer.class);
            Long offsetHeader = exchange.getIn().getHeader(OFFSET_HEADER, Long.class);

            if (partitionHeader != null && offsetHeader != null) {
                this.partition = partitionHeader;
                this.offset = offsetHeader;
            } else {
                this.partition = 0;
                this.offset = contentOffset(value);
            }
        }

        @Override
        public byte[] value() {
            return value;
        }

        @Override
        public int partition() {
            return partition;
        }

        @Override
        public long offset() {
            return offset;
        }

        @Override
        public void ack() {
            startCompleting();
            complete();
        }

        @Override
        public void nack() throws Exception {
            startCompleting();

            if (!deadLetterUri.isPresent()) {
                exchange.setException(new CamelExchangeException(
                        "Message at partition " + partition + " offset " + offset +
                                " was nacked", exchange));
                complete();
                return;
            }

            try {
                Map<String, Object> headers = new HashMap<>(exchange.getIn().getHeaders());
                producer.sendBodyAndHeaders(deadLetterUri.get(), value, headers);
            } catch (RuntimeException e) {
                exchange.setException(e);
                throw e;
            } finally {
                complete();
            }
        }

        void abandon() {
            if (!completed.compareAndSet(false, true)) {
                return;
            }

            exchange.setException(new CamelExchangeException(
                    "Stream stopped before message was acknowledged", exchange));
            complete();
        }

        private void startCompleting() {
            if (!completed.compareAndSet(false, true)) {
                throw new IllegalStateException("Message at partition " + partition +
                        " offset " + offset + " was already acknowledged or returned");
            }
        }

        private void complete() {
            outstanding.remove(this);
            callback.done(false);
        }
    }
}
