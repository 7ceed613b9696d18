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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.esbtools.workflownotifier.model.MalformedMessageException;
import org.esbtools.workflownotifier.model.MessageType;
import org.esbtools.workflownotifier.model.Notification;
import org.esbtools.workflownotifier.model.NotificationFactory;
import org.esbtools.workflownotifier.model.NotificationJson;
import org.esbtools.workflownotifier.model.WorkflowMessage;
import org.esbtools.workflownotifier.model.WorkflowMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decodes workflow messages and hands the resulting notifications to a
 * {@link NotificationDelivery}.
 *
 * <p>Malformed messages are nacked. Deletions and messages from unselected domains are acked
 * without delivery.
 */
public class NotificationMessageHandler implements MessageHandler {
    private final String name;
    private final WorkflowMessageDecoder decoder;
    private final NotificationFactory notificationFactory;
    private final IdentityKeyStrategy keyStrategy;
    private final DomainFilter domainFilter;
    private final NotificationDelivery delivery;

    private final Counter corruptedData;
    private final Counter filtered;

    private static final Logger log = LoggerFactory.getLogger(NotificationMessageHandler.class);

    public NotificationMessageHandler(String name, WorkflowMessageDecoder decoder,
            IdentityKeyStrategy keyStrategy, DomainFilter domainFilter,
            NotificationDelivery delivery, MeterRegistry registry) {
        this.name = Objects.requireNonNull(name, "name");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.keyStrategy = Objects.requireNonNull(keyStrategy, "keyStrategy");
        this.domainFilter = Objects.requireNonNull(domainFilter, "domainFilter");
        this.delivery = Objects.requireNonNull(delivery, "delivery");

        corruptedData = Counter.builder(Metrics.CORRUPTED_DATA)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
        filtered = Counter.builder(Metrics.FILTERED)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);

        notificationFactory = new NotificationFactory(NotificationJson.newObjectMapper(),
                corruptedData);
    }

    @Override
    public void handle(LogMessage message) throws Exception {
        WorkflowMessage workflow;

        try {
            workflow = decoder.decode(message.value());
        } catch (MalformedMessageException e) {
            corruptedData.increment();
            log.error("[{}] Malformed message at partition {} offset {}; nacking.",
                    name, message.partition(), message.offset(), e);
            MessageAcknowledgements.nack(message);
            return;
        }

        if (workflow.getMessageType() == MessageType.DELETE) {
            log.debug("[{}] Workflow {} run {} passed retention; acking.",
                    name, workflow.getWorkflowId(), workflow.getRunId());
            MessageAcknowledgements.ack(message);
            return;
        }

        if (!domainFilter.accepts(workflow.getDomainId())) {
            filtered.increment();
            MessageAcknowledgements.ack(message);
            return;
        }

        String key = keyStrategy.keyOf(message, workflow);
        Notification notification = notificationFactory.fromMessage(
                IdentityKeyStrategy.logPosition(message), workflow);

        delivery.deliver(key, notification, message);
    }
}
