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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top level configuration: the subscribers to notify. Usually loaded from YAML, for example:
 *
 * <pre><code>
 * subscribers:
 *   - name: billing
 *     consumer:
 *       fromUri: kafka:workflow-visibility?groupId=billing-notifier
 *       deadLetterUri: kafka:workflow-visibility-dlq
 *     delivery:
 *       method: WEBHOOK
 *       webhook:
 *         url: https://billing.example.com/workflow-events
 *     filter:
 *       selectedDomains: [billing]
 * </code></pre>
 *
 * <p>Durations are ISO-8601, like {@code PT10S}.
 */
public final class NotificationServiceConfig {
    private final List<SubscriberConfig> subscribers;

    @JsonCreator
    public NotificationServiceConfig(
            @JsonProperty("subscribers") List<SubscriberConfig> subscribers) {
        if (subscribers == null || subscribers.isEmpty()) {
            throw new IllegalArgumentException("At least one subscriber must be configured");
        }

        Set<String> names = new HashSet<>();
        for (SubscriberConfig subscriber : subscribers) {
            if (!names.add(subscriber.getName())) {
                throw new IllegalArgumentException("Duplicate subscriber name: " +
                        subscriber.getName());
            }
        }

        this.subscribers = ImmutableList.copyOf(subscribers);
    }

    public static NotificationServiceConfig fromYaml(InputStream yaml) throws IOException {
        return yamlMapper().readValue(yaml, NotificationServiceConfig.class);
    }

    public static NotificationServiceConfig fromYaml(Path yaml) throws IOException {
        try (InputStream in = Files.newInputStream(yaml)) {
            return fromYaml(in);
        }
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory()).registerModule(new JavaTimeModule());
    }

    public List<SubscriberConfig> getSubscribers() {
        return subscribers;
    }

    @Override
    public String toString() {
        return "NotificationServiceConfig{" +
                "subscribers=" + subscribers +
                '}';
    }
}
