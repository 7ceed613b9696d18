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

import java.time.Duration;
import java.util.Optional;

/**
 * The inbound side of a {@link Notifier}: a stream of {@link LogMessage log messages} which may be
 * pulled concurrently by many workers.
 */
public interface MessageStream {
    /**
     * Begins consuming from the underlying log. Failing to start is fatal to the owning notifier.
     */
    void start() throws Exception;

    /**
     * Stops consuming. Messages which were received but not yet pulled are handed back to the log
     * unacknowledged so they are redelivered.
     */
    void stop();

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return The next message, or empty if none arrived in time or the stream is stopped.
     */
    Optional<LogMessage> poll(Duration timeout) throws InterruptedException;

    boolean isStopped();
}
