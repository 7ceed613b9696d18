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

package org.esbtools.workflownotifier.testing;

import org.esbtools.workflownotifier.LogMessage;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

public class RecordingLogMessage implements LogMessage {
    private final byte[] value;
    private final int partition;
    private final long offset;

    private final AtomicInteger acks = new AtomicInteger(0);
    private final AtomicInteger nacks = new AtomicInteger(0);
    private volatile boolean failOnAck = false;

    public RecordingLogMessage(int partition, long offset, byte[] value) {
        this.partition = partition;
        this.offset = offset;
        this.value = value;
    }

    public RecordingLogMessage(int partition, long offset, String value) {
        this(partition, offset, value.getBytes(StandardCharsets.UTF_8));
    }

    public void failOnAck() {
        failOnAck = true;
    }

    public int acks() {
        return acks.get();
    }

    public int nacks() {
        return nacks.get();
    }

    /** Acks plus nacks. */
    public int acknowledgements() {
        return acks.get() + nacks.get();
    }

    public boolean isAcked() {
        return acks.get() > 0;
    }

    public boolean isNacked() {
        return nacks.get() > 0;
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
    public void ack() throws Exception {
        acks.incrementAndGet();

        if (failOnAck) {
            throw new Exception("Simulated ack failure of " + this);
        }
    }

    @Override
    public void nack() {
        nacks.incrementAndGet();
    }

    @Override
    public String toString() {
        return "RecordingLogMessage{" +
                "partition=" + partition +
                ", offset=" + offset +
                ", acks=" + acks +
                ", nacks=" + nacks +
                '}';
    }
}
