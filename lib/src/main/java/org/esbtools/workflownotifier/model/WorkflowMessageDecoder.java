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

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Parses raw log payloads into {@link WorkflowMessage}s.
 */
public class WorkflowMessageDecoder {
    private final ObjectMapper mapper;

    public WorkflowMessageDecoder() {
        this(NotificationJson.newObjectMapper());
    }

    public WorkflowMessageDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public WorkflowMessage decode(byte[] payload) throws MalformedMessageException {
        if (payload == null || payload.length == 0) {
            throw new MalformedMessageException("Empty payload");
        }

        WorkflowMessage message;

        try {
            message = mapper.readValue(payload, WorkflowMessage.class);
        } catch (IOException e) {
            throw new MalformedMessageException("Payload is not a workflow message: " +
                    e.getMessage(), e);
        }

        if (message == null) {
            throw new MalformedMessageException("Payload is a JSON null");
        }

        if (message.getMessageType() == null) {
            throw new MalformedMessageException("Workflow message has no message type: " + message);
        }

        requireId(message.getDomainId(), "domainId", message);
        requireId(message.getWorkflowId(), "workflowId", message);
        requireId(message.getRunId(), "runId", message);

        return message;
    }

    private static void requireId(String id, String name, WorkflowMessage message)
            throws MalformedMessageException {
        if (id == null || id.isEmpty()) {
            throw new MalformedMessageException("Workflow message has no " + name + ": " + message);
        }
    }
}
