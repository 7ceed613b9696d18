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

package org.esbtools.workflownotifier.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.esbtools.workflownotifier.IdentityKeyStrategy;

import java.util.Objects;

public final class SubscriberConfig {
    private final String name;
    private final ConsumerConfig consumer;
    private final DeliveryConfig delivery;
    private final FilterConfig filter;
    private final IdentityKeyStrategy identityKey;

    @JsonCreator
    public SubscriberConfig(
            @JsonProperty("name") String name,
            @JsonProperty("consumer") ConsumerConfig consumer,
            @JsonProperty("delivery") DeliveryConfig delivery,
            @JsonProperty("filter") FilterConfig filter,
            @JsonProperty("identityKey") IdentityKeyStrategy identityKey) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Subscriber name is required");
        }

        this.name = name;
        this.consumer = Objects.requireNonNull(consumer, "consumer of subscriber " + name);
        this.delivery = Objects.requireNonNull(delivery, "delivery of subscriber " + name);
        this.filter = filter == null ? FilterConfig.allDomains() : filter;
        this.identityKey = identityKey == null ? IdentityKeyStrategy.LOG_POSITION : identityKey;
    }

    public String getName() {
        return name;
    }

    public ConsumerConfig getConsumer() {
        return consumer;
    }

    public DeliveryConfig getDelivery() {
        return delivery;
    }

    public FilterConfig getFilter() {
        return filter;
    }

    public IdentityKeyStrategy getIdentityKey() {
        return identityKey;
    }

    @Override
    public String toString() {
        return "SubscriberConfig{" +
                "name='" + name + '\'' +
                ", consumer=" + consumer +
                ", delivery=" + delivery +
                ", filter=" + filter +
                ", identityKey=" + identityKey +
                '}';
    }
}
