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

import com.google.common.collect.ImmutableMap;
import com.google.common.truth.Truth;
import com.jayway.awaitility.Awaitility;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.camel.component.mock.MockEndpoint;
import org.apache.camel.test.junit4.CamelTestSupport;
import org.esbtools.workflownotifier.config.BulkConfig;
import org.esbtools.workflownotifier.config.ConsumerConfig;
import org.esbtools.workflownotifier.config.DeliveryConfig;
import org.esbtools.workflownotifier.config.DeliveryMethod;
import org.esbtools.workflownotifier.config.FilterConfig;
import org.esbtools.workflownotifier.config.NotificationServiceConfig;
import org.esbtools.workflownotifier.config.SubscriberConfig;
import org.esbtools.workflownotifier.config.WebhookConfig;
import org.esbtools.workflownotifier.model.Notification;
import org.esbtools.workflownotifier.testing.WorkflowMessages;
import org.hamcrest.Matchers;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

public class NotificationServiceTest extends CamelTestSupport {
    List<RecordingDelivery> deliveries = Collections.synchronizedList(new ArrayList<>());

    DeliveryFactory recordingDeliveries = (subscriber, registry) -> {
        RecordingDelivery delivery = new RecordingDelivery(subscriber.getName());
        deliveries.add(delivery);
        return delivery;
    };

    NotificationService service;

    @After
    public void stopService() {
        if (service != null) {
            service.stop();
        }
    }

    @Test(timeout = 20000)
    public void shouldDeliverEachSubscribersMessagesAndDeadLetterMalformedOnes() throws Exception {
        MockEndpoint deadLetters = getMockEndpoint("mock:dead-letters");
        deadLetters.expectedMessageCount(1);

        service = newService(Arrays.asList(
                webhookSubscriber("orders", "seda:orders", FilterConfig.allDomains()),
                webhookSubscriber("billing", "seda:billing",
                        new FilterConfig(Collections.singletonList("billing")))));
        service.start();

        template.sendBody("seda:orders",
                WorkflowMessages.payload(WorkflowMessages.started("orders", "order-1", "run-1")));
        template.sendBody("seda:orders", "not a workflow message");
        template.sendBody("seda:billing",
                WorkflowMessages.payload(WorkflowMessages.started("orders", "order-2", "run-1")));
        template.sendBody("seda:billing",
                WorkflowMessages.payload(WorkflowMessages.closed("billing", "invoice-1", "run-1")));

        RecordingDelivery orders = deliveries.get(0);
        RecordingDelivery billing = deliveries.get(1);

        Awaitility.await().atMost(10, TimeUnit.SECONDS)
                .until(() -> orders.delivered, Matchers.hasSize(1));
        Awaitility.await().atMost(10, TimeUnit.SECONDS)
                .until(() -> billing.delivered, Matchers.hasSize(1));
        deadLetters.assertIsSatisfied();

        Truth.assertThat(orders.delivered.get(0).getWorkflowId()).isEqualTo("order-1");
        Truth.assertThat(billing.delivered.get(0).getWorkflowId()).isEqualTo("invoice-1");
        Truth.assertThat(service.notifiers()).hasSize(2);
    }

    @Test(timeout = 20000)
    public void shouldCloseEveryDeliveryOnStop() throws Exception {
        service = newService(Arrays.asList(
                webhookSubscriber("orders", "seda:orders", FilterConfig.allDomains()),
                webhookSubscriber("billing", "seda:billing", FilterConfig.allDomains())));
        service.start();

        service.stop();

        Truth.assertThat(deliveries).hasSize(2);
        for (RecordingDelivery delivery : deliveries) {
            Truth.assertWithMessage("closed " + delivery.name).that(delivery.closed).isTrue();
        }
        Truth.assertThat(service.state()).isEqualTo(DaemonState.STOPPED);
    }

    @Test(timeout = 20000)
    public void shouldStopStartedSubscribersWhenAnotherCannotStart() throws Exception {
        SubscriberConfig bulk = new SubscriberConfig("search",
                new ConsumerConfig("seda:search", null),
                DeliveryConfig.bulk(new BulkConfig(URI.create("http://localhost:9200"), "index")),
                null, null);

        service = newService(Arrays.asList(
                webhookSubscriber("orders", "seda:orders", FilterConfig.allDomains()), bulk));

        try {
            service.start();
            Assert.fail("Expected start to fail without a BULK delivery factory");
        } catch (IllegalArgumentException expected) {
            Truth.assertThat(expected.getMessage()).contains("BULK");
        }

        Truth.assertThat(service.state()).isEqualTo(DaemonState.STOPPED);
        Truth.assertThat(deliveries).hasSize(1);
        Truth.assertThat(deliveries.get(0).closed).isTrue();
    }

    @Test(timeout = 20000)
    public void shouldStopSubscribersWhichWereStillStartingWhenStopWasCalled() throws Exception {
        CountDownLatch creatingBilling = new CountDownLatch(1);
        CountDownLatch releaseBilling = new CountDownLatch(1);
        DeliveryFactory slowBilling = (subscriber, registry) -> {
            if ("billing".equals(subscriber.getName())) {
                creatingBilling.countDown();
                releaseBilling.await();
            }
            return recordingDeliveries.create(subscriber, registry);
        };

        service = new NotificationService(new NotificationServiceConfig(Arrays.asList(
                webhookSubscriber("orders", "seda:orders", FilterConfig.allDomains()),
                webhookSubscriber("billing", "seda:billing", FilterConfig.allDomains()))),
                context, ImmutableMap.of(DeliveryMethod.WEBHOOK, slowBilling),
                new SimpleMeterRegistry());

        AtomicReference<Exception> startFailure = new AtomicReference<>();
        Thread starter = new Thread(() -> {
            try {
                service.start();
            } catch (Exception e) {
                startFailure.set(e);
            }
        });
        Thread stopper = new Thread(() -> service.stop());

        starter.start();
        creatingBilling.await();
        stopper.start();

        Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() ->
                stopper.getState() == Thread.State.BLOCKED ||
                        stopper.getState() == Thread.State.TERMINATED);

        releaseBilling.countDown();
        starter.join();
        stopper.join();

        Truth.assertThat(startFailure.get()).isNull();
        Truth.assertThat(service.state()).isEqualTo(DaemonState.STOPPED);
        Truth.assertThat(deliveries).hasSize(2);
        for (RecordingDelivery delivery : deliveries) {
            Truth.assertWithMessage("closed " + delivery.name).that(delivery.closed).isTrue();
        }
        for (Notifier notifier : service.notifiers()) {
            Truth.assertWithMessage("state of " + notifier.name()).that(notifier.state())
                    .isEqualTo(DaemonState.STOPPED);
        }
    }

    private NotificationService newService(List<SubscriberConfig> subscribers) {
        return new NotificationService(new NotificationServiceConfig(subscribers), context,
                ImmutableMap.of(DeliveryMethod.WEBHOOK, recordingDeliveries),
                new SimpleMeterRegistry());
    }

    private static SubscriberConfig webhookSubscriber(String name, String fromUri,
            FilterConfig filter) {
        return new SubscriberConfig(name,
                new ConsumerConfig(fromUri, "mock:dead-letters"),
                DeliveryConfig.webhook(new WebhookConfig(URI.create("http://localhost/hook"),
                        null)),
                filter, null);
    }

    static class RecordingDelivery implements NotificationDelivery {
        final String name;
        final List<Notification> delivered = Collections.synchronizedList(new ArrayList<>());
        volatile boolean closed = false;

        RecordingDelivery(String name) {
            this.name = name;
        }

        @Override
        public void deliver(String key, Notification notification, LogMessage source)
                throws Exception {
            delivered.add(notification);
            source.ack();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
