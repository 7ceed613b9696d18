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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The decoded payload of one workflow visibility event, as published to the log by the workflow
 * engine whenever a run changes.
 *
 * @see WorkflowMessageDecoder
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkflowMessage {
    private final MessageType messageType;
    private final String domainId;
    private final String workflowId;
    private final String runId;
    private final long version;
    private final Map<String, AttributeValue> fields;

    @JsonCreator
    public WorkflowMessage(
            @JsonProperty("messageType") MessageType messageType,
            @JsonProperty("domainId") String domainId,
            @JsonProperty("workflowId") String workflowId,
            @JsonProperty("runId") String runId,
            @JsonProperty("version") long version,
            @JsonProperty("fields") Map<String, AttributeValue> fields) {
        this.messageType = messageType;
        this.domainId = domainId;
        this.workflowId = workflowId;
        this.runId = runId;
        this.version = version;
        this.fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public MessageType getMessageType() {
        return messageType;
    }

    public String getDomainId() {
        return domainId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getRunId() {
        return runId;
    }

    public long getVersion() {
        return version;
    }

    public Map<String, AttributeValue> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowMessage that = (WorkflowMessage) o;
        return version == that.version &&
                messageType == that.messageType &&
                Objects.equals(domainId, that.domainId) &&
                Objects.equals(workflowId, that.workflowId) &&
                Objects.equals(runId, that.runId) &&
                Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageType, domainId, workflowId, runId, version, fields);
    }

    @Override
    public String toString() {
        return "WorkflowMessage{" +
                "messageType=" + messageType +
                ", domainId='" + domainId + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", runId='" + runId + '\'' +
                ", version=" + version +
                ", fields=" + fields +
                '}';
    }
}
