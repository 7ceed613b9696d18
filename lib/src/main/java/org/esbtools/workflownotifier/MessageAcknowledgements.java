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

/**
 * Acknowledges messages on behalf of the engine. A failure to acknowledge is logged rather than
 * thrown: the outcome of the message is already decided, and the log will redeliver anything it
 * did not hear about.
 */
public final class MessageAcknowledgements {
    private static final Logger log = LoggerFactory.getLogger(MessageAcknowledgements.class);

    private MessageAcknowledgements() {}

    public static void ack(LogMessage message) {
        try {
            message.ack();
        } catch (Exception e) {
            log.warn("Failed to ack message at partition {} offset {}.",
                    message.partition(), message.offset(), e);
        }
    }

    public static void nack(LogMessage message) {
        try {
            message.nack();
        } catch (Exception e) {
            log.warn("Failed to nack message at partition {} offset {}.",
                    message.partition(), message.offset(), e);
        }
    }
}
