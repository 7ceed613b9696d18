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

import com.fasterxml.jackson.annotation.JsonInclude;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What subscribers are told about a workflow run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Notification {
    private final String id;
    private final NotificationType notificationType;
    private final String domainId;
    private final String workflowId;
    private final String runId;
    private final String workflowType;
    private final Instant startedTimestamp;
    private final Instant closedTimestamp;
    private final Map<String, AttributeValue> searchAttributes;
    private final Map<String, AttributeValue> memo;

    public Notification(String id, NotificationType notificationType, String domainId,
            String workflowId, String runId, @Nullable String workflowType,
            @Nullable Instant startedTimestamp, @Nullable Instant closedTimestamp,
            Map<String, AttributeValue> searchAttributes, Map<String, AttributeValue> memo) {
        this.id = Objects.requireNonNull(id, "id");
        this.notificationType = Objects.requireNonNull(notificationType, "notificationType");
        this.domainId = domainId;
        this.workflowId = workflowId;
        this.runId = runId;
        this.workflowType = workflowType;
        this.startedTimestamp = startedTimestamp;
        this.closedTimestamp = closedTimestamp;
        this.searchAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(searchAttributes));
        this.memo = Collections.unmodifiableMap(new LinkedHashMap<>(memo));
    }

    public String getId() {
        return id;
    }

    public NotificationType getNotificationType() {
        return notificationType;
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

    @Nullable
    public String getWorkflowType() {
        return workflowType;
    }

    @Nullable
    public Instant getStartedTimestamp() {
        return startedTimestamp;
    }

    @Nullable
    public Instant getClosedTimestamp() {
        return closedTimestamp;
    }

    public Map<String, AttributeValue> getSearchAttributes() {
        return searchAttributes;
    }

    public Map<String, AttributeValue> getMemo() {
        return memo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Notification that = (Notification) o;
        return Objects.equals(id, that.id) &&
                notificationType == that.notificationType &&
                Objects.equals(domainId, that.domainId) &&
                Objects.equals(workflowId, that.workflowId) &&
                Objects.equals(runId, that.runId) &&
                Objects.equals(workflowType, that.workflowType) &&
                Objects.equals(startedTimestamp, that.startedTimestamp) &&
                Objects.equals(closedTimestamp, that.closedTimestamp) &&
                Objects.equals(searchAttributes, that.searchAttributes) &&
                Objects.equals(memo, that.memo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, notificationType, domainId, workflowId, runId, workflowType,
                startedTimestamp, closedTimestamp, searchAttributes, memo);
    }

    @Override
    public String toString() {
        return "Notification{" +
                "id='" + id + '\'' +
                ", notificationType=" + notificationType +
                ", domainId='" + domainId + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", runId='" + runId + '\'' +
                ", workflowType='" + workflowType + '\'' +
                ", startedTimestamp=" + startedTimestamp +
                ", closedTimestamp=" + closedTimestamp +
                ", searchAttributes=" + searchAttributes +
                ", memo=" + memo +
                '}';
    }
}
