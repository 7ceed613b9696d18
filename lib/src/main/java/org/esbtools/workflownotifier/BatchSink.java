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

/**
 * A backend which groups submitted requests into batches and performs each batch as one network
 * call, on its own schedule and threads.
 *
 * <p>A sink reports each batch it attempts to the {@link BatchListener} it was created with: once
 * before the attempt and once after, with one result per request in the same order the requests
 * are listed. Requests whose result is {@link StatusClass#RETRYABLE retryable} are kept by the sink
 * and show up again in a later batch.
 *
 * @param <R> The type of request the backend understands.
 * @see BatchSinkFactory
 */
public interface BatchSink<R> {
    /**
     * Queues a request for a future batch. May block while the sink is full.
     *
     * @throws IllegalStateException if the sink was stopped.
     */
    void submit(R request) throws InterruptedException;

    /**
     * Flushes what is queued, waits a bounded time for in-flight batches, and releases threads.
     * Requests still pending afterwards are abandoned.
     */
    void stop();
}
