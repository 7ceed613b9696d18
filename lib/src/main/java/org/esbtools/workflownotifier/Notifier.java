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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one subscriber: its inbound {@link MessageStream}, the {@link MessageWorkerPool} draining
 * it, and the {@link NotificationDelivery} the workers deliver to.
 *
 * <p>{@link #start()} and {@link #stop()} may each be called any number of times; only the first
 * call of each does anything. A stopped notifier cannot be restarted.
 */
@ThreadSafe
public class Notifier {
    private final String name;
    private final MessageStream stream;
    private final MessageWorkerPool workers;
    private final NotificationDelivery delivery;
    private final Duration shutdownTimeout;

    private final AtomicReference<DaemonState> state =
            new AtomicReference<>(DaemonState.INITIALIZED);

    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    public Notifier(String name, MessageStream stream, MessageWorkerPool workers,
            NotificationDelivery delivery, Duration shutdownTimeout) {
        this.name = Objects.requireNonNull(name, "name");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    /**
     * Starts the stream, then the workers.
     *
     * @throws Exception If the stream could not be started. The stream and the delivery are then
     *                   stopped, along with the notifier.
     */
    public void start() throws Exception {
        if (!state.compareAndSet(DaemonState.INITIALIZED, DaemonState.STARTED)) {
            log.debug("Notifier {} already {}", name, state.get());
            return;
        }

        log.info("Starting notifier {}", name);

        try {
            stream.start();
        } catch (Exception e) {
            state.set(DaemonState.STOPPED);
            log.error("Failed to start stream of notifier {}", name, e);
            stream.stop();
            delivery.close();
            throw e;
        }

        workers.start();

        log.info("Started notifier {}", name);
    }

    /**
     * Stops pulling new messages, waits up to the shutdown timeout for workers to finish the
     * messages they hold, settles what the delivery can still settle, and finally stops the
     * stream. Messages left unacknowledged are redelivered by the log later.
     */
    public void stop() {
        DaemonState previous = state.getAndSet(DaemonState.STOPPED);

        if (previous == DaemonState.STOPPED) {
            return;
        }

        if (previous == DaemonState.INITIALIZED) {
            delivery.close();
            return;
        }

        log.info("Stopping notifier {}", name);

        workers.signalStop();

        try {
            if (!workers.awaitTermination(shutdownTimeout)) {
                log.warn("Workers of notifier {} did not finish within {}; some messages may " +
                        "be redelivered.", name, shutdownTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for workers of notifier {} to finish", name);
        }

        delivery.close();
        stream.stop();

        log.info("Stopped notifier {}", name);
    }

    public String name() {
        return name;
    }

    DaemonState state() {
        return state.get();
    }
}
