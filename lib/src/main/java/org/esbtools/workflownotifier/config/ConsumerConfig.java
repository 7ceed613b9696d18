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

package org.esbtools.workflownotifier.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Optional;

/**
 * Where a subscriber's messages come from and how many are processed at once.
 */
public final class ConsumerConfig {
    public static final int DEFAULT_CONCURRENCY = 10;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final String fromUri;
    private final String deadLetterUri;
    private final int concurrency;
    private final int queueCapacity;
    private final Duration pollTimeout;
    private final Duration shutdownTimeout;

    /**
     * @param fromUri A Camel endpoint URI to consume workflow messages from.
     * @param deadLetterUri A Camel endpoint URI nacked messages are forwarded to. Without one, a
     *                      nack fails the exchange back to the consumer.
     */
    @JsonCreator
    public ConsumerConfig(
            @JsonProperty("fromUri") String fromUri,
            @JsonProperty("deadLetterUri") @Nullable String deadLetterUri,
            @JsonProperty("concurrency") @Nullable Integer concurrency,
            @JsonProperty("queueCapacity") @Nullable Integer queueCapacity,
            @JsonProperty("pollTimeout") @Nullable Duration pollTimeout,
            @JsonProperty("shutdownTimeout") @Nullable Duration shutdownTimeout) {
        if (fromUri == null || fromUri.isEmpty()) {
            throw new IllegalArgumentException("Consumer fromUri is required");
        }

        this.fromUri = fromUri;
        this.deadLetterUri = deadLetterUri;
        this.concurrency = positive("concurrency", concurrency, DEFAULT_CONCURRENCY);
        this.queueCapacity = positive("queueCapacity", queueCapacity, DEFAULT_QUEUE_CAPACITY);
        this.pollTimeout = pollTimeout == null ? DEFAULT_POLL_TIMEOUT : pollTimeout;
        this.shutdownTimeout = shutdownTimeout == null
                ? DEFAULT_SHUTDOWN_TIMEOUT
                : shutdownTimeout;
    }

    public ConsumerConfig(String fromUri, @Nullable String deadLetterUri) {
        this(fromUri, deadLetterUri, null, null, null, null);
    }

    static int positive(String name, @Nullable Integer value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive but was " + value);
        }
        return value;
    }

    public String getFromUri() {
        return fromUri;
    }

    public Optional<String> getDeadLetterUri() {
        return Optional.ofNullable(deadLetterUri);
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public String toString() {
        return "ConsumerConfig{" +
                "fromUri='" + fromUri + '\'' +
                ", deadLetterUri='" + deadLetterUri + '\'' +
                ", concurrency=" + concurrency +
                ", queueCapacity=" + queueCapacity +
                ", pollTimeout=" + pollTimeout +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }
}
