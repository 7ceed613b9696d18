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

import javax.annotation.Nullable;
import java.util.Objects;

public final class DeliveryConfig {
    private final DeliveryMethod method;
    private final WebhookConfig webhook;
    private final BulkConfig bulk;

    @JsonCreator
    public DeliveryConfig(
            @JsonProperty("method") DeliveryMethod method,
            @JsonProperty("webhook") @Nullable WebhookConfig webhook,
            @JsonProperty("bulk") @Nullable BulkConfig bulk) {
        this.method = Objects.requireNonNull(method, "delivery method");

        if (method == DeliveryMethod.WEBHOOK && webhook == null) {
            throw new IllegalArgumentException("WEBHOOK delivery requires webhook settings");
        }
        if (method == DeliveryMethod.BULK && bulk == null) {
            throw new IllegalArgumentException("BULK delivery requires bulk settings");
        }

        this.webhook = webhook;
        this.bulk = bulk;
    }

    public static DeliveryConfig webhook(WebhookConfig webhook) {
        return new DeliveryConfig(DeliveryMethod.WEBHOOK, webhook, null);
    }

    public static DeliveryConfig bulk(BulkConfig bulk) {
        return new DeliveryConfig(DeliveryMethod.BULK, null, bulk);
    }

    public DeliveryMethod getMethod() {
        return method;
    }

    /**
     * @throws IllegalStateException If the delivery method is not {@link DeliveryMethod#WEBHOOK}.
     */
    public WebhookConfig getWebhook() {
        if (webhook == null) {
            throw new IllegalStateException("No webhook settings for " + method + " delivery");
        }
        return webhook;
    }

    /**
     * @throws IllegalStateException If the delivery method is not {@link DeliveryMethod#BULK}.
     */
    public BulkConfig getBulk() {
        if (bulk == null) {
            throw new IllegalStateException("No bulk settings for " + method + " delivery");
        }
        return bulk;
    }

    @Override
    public String toString() {
        return "DeliveryConfig{" +
                "method=" + method +
                ", webhook=" + webhook +
                ", bulk=" + bulk +
                '}';
    }
}
