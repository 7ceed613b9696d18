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

import io.micrometer.core.instrument.Timer;

import java.util.Objects;

/**
 * A submitted message which has not been acknowledged yet. Stored in the dispatch table until the
 * batch sink reports an outcome for it.
 */
public final class PendingMessage {
    private final LogMessage message;
    private final Timer.Sample sinceSubmit;
    private final Timer ackLatency;

    public PendingMessage(LogMessage message, Timer.Sample sinceSubmit, Timer ackLatency) {
        this.message = Objects.requireNonNull(message, "message");
        this.sinceSubmit = Objects.requireNonNull(sinceSubmit, "sinceSubmit");
        this.ackLatency = Objects.requireNonNull(ackLatency, "ackLatency");
    }

    public LogMessage message() {
        return message;
    }

    void ack() {
        sinceSubmit.stop(ackLatency);
        MessageAcknowledgements.ack(message);
    }

    void nack() {
        sinceSubmit.stop(ackLatency);
        MessageAcknowledgements.nack(message);
    }

    @Override
    public String toString() {
        return "PendingMessage{" +
                "partition=" + message.partition() +
                ", offset=" + message.offset() +
                '}';
    }
}
