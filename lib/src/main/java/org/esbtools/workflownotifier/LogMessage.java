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
 * One message consumed from a durable, ordered log, such as a Kafka partition.
 *
 * <p>A message is acknowledged, positively or negatively, at most once. Positive acknowledgement
 * lets the log move past the message; negative acknowledgement hands it to whatever dead letter
 * handling the log is configured with. A message that is never acknowledged is redelivered by the
 * log after a restart.
 */
public interface LogMessage {
    /** The raw payload, as written by the producer. */
    byte[] value();

    int partition();

    long offset();

    void ack() throws Exception;

    void nack() throws Exception;
}
