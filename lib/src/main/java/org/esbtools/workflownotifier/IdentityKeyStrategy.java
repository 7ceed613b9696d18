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

import org.esbtools.workflownotifier.model.WorkflowMessage;

/**
 * How a message's identity key is derived. Messages with equal keys are deduplicated while one of
 * them is pending.
 */
public enum IdentityKeyStrategy {
    /**
     * Where the message sits in the log: {@code <partition>-<offset>}. Only redeliveries of the
     * same log message share a key.
     */
    LOG_POSITION {
        @Override
        public String keyOf(LogMessage message, WorkflowMessage workflow) {
            return logPosition(message);
        }
    },

    /**
     * Which version of which workflow run the message describes:
     * {@code <domainId>:<workflowId>:<runId>:<version>}. Also deduplicates republished events.
     */
    WORKFLOW_RUN {
        @Override
        public String keyOf(LogMessage message, WorkflowMessage workflow) {
            return workflow.getDomainId() + ":" + workflow.getWorkflowId() + ":" +
                    workflow.getRunId() + ":" + workflow.getVersion();
        }
    };

    public abstract String keyOf(LogMessage message, WorkflowMessage workflow);

    public static String logPosition(LogMessage message) {
        return message.partition() + "-" + message.offset();
    }
}
