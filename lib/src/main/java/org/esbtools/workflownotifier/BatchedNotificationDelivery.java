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

import java.util.Objects;

public class BatchedNotificationDelivery<R> implements NotificationDelivery {
    private final AcknowledgingBatchProcessor<R> processor;
    private final BatchRequestBuilder<R> requestBuilder;

    public BatchedNotificationDelivery(AcknowledgingBatchProcessor<R> processor,
            BatchRequestBuilder<R> requestBuilder) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.requestBuilder = Objects.requireNonNull(requestBuilder, "requestBuilder");
    }

    @Override
    public void deliver(String key, Notification notification, LogMessage source)
            throws InterruptedException {
        processor.submit(key, requestBuilder.build(key, notification), source);
    }

    @Override
    public void close() {
        processor.stop();
    }
}
