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

import org.esbtools.workflownotifier.model.Notification;

/**
 * Sends notifications to a subscriber.
 */
public interface NotificationDelivery extends AutoCloseable {
    /**
     * Delivers {@code notification} and, now or later, acks or nacks {@code source} depending on
     * the outcome.
     *
     * @param key The notification's identity key.
     * @throws Exception If the notification could not be handed off. {@code source} was not
     *                   acknowledged in this case.
     */
    void deliver(String key, Notification notification, LogMessage source) throws Exception;

    /**
     * Settles what can still be settled and releases resources. Messages not yet acknowledged
     * when this returns never will be.
     */
    @Override
    void close();
}
