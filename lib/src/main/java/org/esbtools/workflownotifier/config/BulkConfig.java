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
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

import static org.esbtools.workflownotifier.config.ConsumerConfig.positive;

/**
 * Settings of a bulk indexing backend and of the batches sent to it.
 */
public final class BulkConfig {
    public static final int DEFAULT_BULK_ACTIONS = 1000;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_NUM_OF_WORKERS = 1;
    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    public static final int DEFAULT_DISPATCH_SHARDS = 1024;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(200);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(20);
    public static final int DEFAULT_MAX_RETRIES = 8;

    private final URI url;
    private final String index;
    private final int bulkActions;
    private final Duration flushInterval;
    private final int numOfWorkers;
    private final int queueCapacity;
    private final int dispatchShards;
    private final Duration requestTimeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final int maxRetries;

    @JsonCreator
    public BulkConfig(
            @JsonProperty("url") URI url,
            @JsonProperty("index") String index,
            @JsonProperty("bulkActions") @Nullable Integer bulkActions,
            @JsonProperty("flushInterval") @Nullable Duration flushInterval,
            @JsonProperty("numOfWorkers") @Nullable Integer numOfWorkers,
            @JsonProperty("queueCapacity") @Nullable Integer queueCapacity,
            @JsonProperty("dispatchShards") @Nullable Integer dispatchShards,
            @JsonProperty("requestTimeout") @Nullable Duration requestTimeout,
            @JsonProperty("initialBackoff") @Nullable Duration initialBackoff,
            @JsonProperty("maxBackoff") @Nullable Duration maxBackoff,
            @JsonProperty("maxRetries") @Nullable Integer maxRetries) {
        if (index == null || index.isEmpty()) {
            throw new IllegalArgumentException("Bulk index is required");
        }

        this.url = Objects.requireNonNull(url, "bulk url");
        this.index = index;
        this.bulkActions = positive("bulkActions", bulkActions, DEFAULT_BULK_ACTIONS);
        this.flushInterval = orDefault(flushInterval, DEFAULT_FLUSH_INTERVAL);
        this.numOfWorkers = positive("numOfWorkers", numOfWorkers, DEFAULT_NUM_OF_WORKERS);
        this.queueCapacity = positive("queueCapacity", queueCapacity, DEFAULT_QUEUE_CAPACITY);
        this.dispatchShards = positive("dispatchShards", dispatchShards, DEFAULT_DISPATCH_SHARDS);
        this.requestTimeout = orDefault(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
        this.initialBackoff = orDefault(initialBackoff, DEFAULT_INITIAL_BACKOFF);
        this.maxBackoff = orDefault(maxBackoff, DEFAULT_MAX_BACKOFF);
        this.maxRetries = maxRetries == null ? DEFAULT_MAX_RETRIES : maxRetries;

        if (this.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative but was " +
                    maxRetries);
        }
    }

    public BulkConfig(URI url, String index) {
        this(url, index, null, null, null, null, null, null, null, null, null);
    }

    private static Duration orDefault(@Nullable Duration value, Duration defaultValue) {
        return value == null ? defaultValue : value;
    }

    public URI getUrl() {
        return url;
    }

    public String getIndex() {
        return index;
    }

    public int getBulkActions() {
        return bulkActions;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public int getNumOfWorkers() {
        return numOfWorkers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getDispatchShards() {
        return dispatchShards;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "BulkConfig{" +
                "url=" + url +
                ", index='" + index + '\'' +
                ", bulkActions=" + bulkActions +
                ", flushInterval=" + flushInterval +
                ", numOfWorkers=" + numOfWorkers +
                ", queueCapacity=" + queueCapacity +
                ", dispatchShards=" + dispatchShards +
                ", requestTimeout=" + requestTimeout +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                ", maxRetries=" + maxRetries +
                '}';
    }
}
