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

package org.esbtools.workflownotifier.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.esbtools.workflownotifier.LogMessage;
import org.esbtools.workflownotifier.MessageAcknowledgements;
import org.esbtools.workflownotifier.Metrics;
import org.esbtools.workflownotifier.NotificationDelivery;
import org.esbtools.workflownotifier.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * POSTs each notification as JSON to a subscriber's URL and waits for the response. The source
 * message is acked on a 2xx response and nacked on anything else, including no response at all.
 *
 * <p>Failed posts are not retried here; a nacked message goes to the dead letter endpoint.
 */
public class WebhookNotificationDelivery implements NotificationDelivery {
    private final String name;
    private final HttpClient client;
    private final URI url;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;
    private final Counter failures;

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationDelivery.class);

    public WebhookNotificationDelivery(String name, HttpClient client, URI url,
            Duration requestTimeout, ObjectMapper mapper, MeterRegistry registry) {
        this.name = Objects.requireNonNull(name, "name");
        this.client = Objects.requireNonNull(client, "client");
        this.url = Objects.requireNonNull(url, "url");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.mapper = Objects.requireNonNull(mapper, "mapper");

        failures = Counter.builder(Metrics.WEBHOOK_FAILURES)
                .tag(Metrics.SUBSCRIBER_TAG, name)
                .register(registry);
    }

    @Override
    public void deliver(String key, Notification notification, LogMessage source)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(notification)))
                .build();

        HttpResponse<String> response;

        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            failures.increment();
            log.warn("[{}] Failed to post notification {} of workflow {} run {} to {}; nacking.",
                    name, key, notification.getWorkflowId(), notification.getRunId(), url, e);
            MessageAcknowledgements.nack(source);
            return;
        }

        int status = response.statusCode();

        if (status >= 200 && status < 300) {
            log.debug("[{}] Posted notification {} to {}. Status: {}", name, key, url, status);
            MessageAcknowledgements.ack(source);
            return;
        }

        failures.increment();
        log.warn("[{}] Webhook {} rejected notification {} of workflow {} run {}; nacking. " +
                "Status: {}, body: {}", name, url, key, notification.getWorkflowId(),
                notification.getRunId(), status, response.body());
        MessageAcknowledgements.nack(source);
    }

    @Override
    public void close() {
        log.debug("Closed webhook delivery {}", name);
    }
}
