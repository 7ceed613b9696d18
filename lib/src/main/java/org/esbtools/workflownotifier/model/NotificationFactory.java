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

package org.esbtools.workflownotifier.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns decoded {@link WorkflowMessage}s into {@link Notification}s.
 *
 * <p>The {@value #MEMO} field becomes the notification's memo; every other field is a search
 * attribute. Custom search attributes arrive as binary JSON. Scalars are unwrapped into the
 * matching variant. Anything else stays binary.
 */
public class NotificationFactory {
    public static final String MEMO = "Memo";
    public static final String WORKFLOW_TYPE = "WorkflowType";
    public static final String START_TIME = "StartTime";
    public static final String CLOSE_TIME = "CloseTime";

    private final ObjectMapper mapper;
    private final Counter corruptedData;

    private static final Logger log = LoggerFactory.getLogger(NotificationFactory.class);

    public NotificationFactory(ObjectMapper mapper, Counter corruptedData) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.corruptedData = Objects.requireNonNull(corruptedData, "corruptedData");
    }

    public Notification fromMessage(String id, WorkflowMessage message) {
        Map<String, AttributeValue> searchAttributes = new LinkedHashMap<>();
        Map<String, AttributeValue> memo = new LinkedHashMap<>();

        for (Map.Entry<String, AttributeValue> field : message.getFields().entrySet()) {
            String name = field.getKey();
            AttributeValue value = field.getValue();

            if (value.type() == AttributeValue.Type.BINARY) {
                if (MEMO.equals(name)) {
                    memo.put(name, value);
                } else {
                    searchAttributes.put(name, decodeCustomAttribute(name, value, message));
                }
            } else {
                searchAttributes.put(name, value);
            }
        }

        Map<String, AttributeValue> fields = message.getFields();

        return new Notification(
                id,
                notificationTypeOf(fields),
                message.getDomainId(),
                message.getWorkflowId(),
                message.getRunId(),
                stringField(fields, WORKFLOW_TYPE),
                instantField(fields, START_TIME),
                instantField(fields, CLOSE_TIME),
                searchAttributes,
                memo);
    }

    static NotificationType notificationTypeOf(Map<String, AttributeValue> fields) {
        if (fields.containsKey(CLOSE_TIME)) {
            return NotificationType.WORKFLOW_CLOSED;
        }
        if (fields.containsKey(START_TIME)) {
            return NotificationType.WORKFLOW_STARTED;
        }
        return NotificationType.UPSERT_SEARCH_ATTRIBUTES;
    }

    private AttributeValue decodeCustomAttribute(String name, AttributeValue binary,
            WorkflowMessage message) {
        JsonNode json;

        try {
            json = mapper.readTree(binary.asBinary());
        } catch (IOException e) {
            log.error("Search attribute '{}' of workflow {} run {} in domain {} is not JSON; " +
                    "keeping raw bytes.", name, message.getWorkflowId(), message.getRunId(),
                    message.getDomainId(), e);
            corruptedData.increment();
            return binary;
        }

        if (json == null || json.isMissingNode()) {
            return binary;
        }
        if (json.isTextual()) {
            return AttributeValue.ofString(json.textValue());
        }
        if (json.isIntegralNumber() && json.canConvertToLong()) {
            return AttributeValue.ofInt(json.longValue());
        }
        if (json.isBoolean()) {
            return AttributeValue.ofBool(json.booleanValue());
        }

        return binary;
    }

    private static String stringField(Map<String, AttributeValue> fields, String name) {
        AttributeValue value = fields.get(name);
        if (value == null || value.type() != AttributeValue.Type.STRING) {
            return null;
        }
        return value.asString();
    }

    private static Instant instantField(Map<String, AttributeValue> fields, String name) {
        AttributeValue value = fields.get(name);
        if (value == null || value.type() != AttributeValue.Type.INT) {
            return null;
        }
        long nanos = value.asInt();
        return Instant.ofEpochSecond(0, nanos);
    }
}
