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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.camel.CamelContext;
import org.esbtools.workflownotifier.config.ConsumerConfig;
import org.esbtools.workflownotifier.config.DeliveryMethod;
import org.esbtools.workflownotifier.config.NotificationServiceConfig;
import org.esbtools.workflownotifier.config.SubscriberConfig;
import org.esbtools.workflownotifier.model.WorkflowMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a {@link Notifier} for every configured subscriber, consuming through routes added to the
 * given {@link CamelContext}.
 *
 * <p>Deliveries are created by the factory registered for each subscriber's delivery method.
 */
@ThreadSafe
public class NotificationService {
    private final NotificationServiceConfig config;
    private final CamelContext camelContext;
    private final Map<DeliveryMethod, DeliveryFactory> deliveryFactories;
    private final MeterRegistry registry;

    private final AtomicReference<DaemonState> state =
            new AtomicReference<>(DaemonState.INITIALIZED);
    private volatile List<Notifier> notifiers = ImmutableList.of();

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    public NotificationService(NotificationServiceConfig config, CamelContext camelContext,
            Map<DeliveryMethod, DeliveryFactory> deliveryFactories, MeterRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.camelContext = Objects.requireNonNull(camelContext, "camelContext");
        this.deliveryFactories = ImmutableMap.copyOf(deliveryFactories);
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Starts a notifier per subscriber. If any fails to start, those already started are stopped
     * and the failure is rethrown.
     *
     * <p>Mutually exclusive with {@link #stop()}: a stop requested while subscribers are starting
     * waits for them and then stops all of them.
     */
    public synchronized void start() throws Exception {
        if (!state.compareAndSet(DaemonState.INITIALIZED, DaemonState.STARTED)) {
            return;
        }

        List<Notifier> started = new ArrayList<>();

        try {
            for (SubscriberConfig subscriber : config.getSubscribers()) {
                Notifier notifier = newNotifier(subscriber);
                started.add(notifier);
                notifier.start();
            }
        } catch (Exception e) {
            log.error("Failed to start notification service; stopping {} started notifiers",
                    started.size(), e);
            state.set(DaemonState.STOPPED);
            stopAll(started);
            throw e;
        }

        notifiers = ImmutableList.copyOf(started);

        log.info("Started notification service with subscribers {}", notifierNames());
    }

    public synchronized void stop() {
        if (state.getAndSet(DaemonState.STOPPED) != DaemonState.STARTED) {
            return;
        }

        stopAll(notifiers);

        log.info("Stopped notification service");
    }

    public List<Notifier> notifiers() {
        return notifiers;
    }

    DaemonState state() {
        return state.get();
    }

    private Notifier newNotifier(SubscriberConfig subscriber) throws Exception {
        String name = subscriber.getName();
        DeliveryMethod method = subscriber.getDelivery().getMethod();
        DeliveryFactory deliveryFactory = deliveryFactories.get(method);

        if (deliveryFactory == null) {
            throw new IllegalArgumentException("No delivery factory for " + method +
                    " delivery of subscriber " + name);
        }

        ConsumerConfig consumer = subscriber.getConsumer();
        NotificationDelivery delivery = deliveryFactory.create(subscriber, registry);

        MessageStream stream = new CamelMessageStream(camelContext, name,
                consumer.getFromUri(), consumer.getDeadLetterUri(), consumer.getQueueCapacity(),
                consumer.getShutdownTimeout());

        MessageHandler handler = new NotificationMessageHandler(name,
                new WorkflowMessageDecoder(), subscriber.getIdentityKey(),
                DomainFilter.selecting(subscriber.getFilter().getSelectedDomains()),
                delivery, registry);

        MessageWorkerPool workers = new MessageWorkerPool(name, stream, handler,
                consumer.getConcurrency(), consumer.getPollTimeout(), registry);

        return new Notifier(name, stream, workers, delivery, consumer.getShutdownTimeout());
    }

    private static void stopAll(List<Notifier> notifiers) {
        for (Notifier notifier : Lists.reverse(notifiers)) {
            try {
                notifier.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop notifier {}", notifier.name(), e);
            }
        }
    }

    private List<String> notifierNames() {
        List<String> names = new ArrayList<>();
        for (Notifier notifier : notifiers) {
            names.add(notifier.name());
        }
        return names;
    }
}
