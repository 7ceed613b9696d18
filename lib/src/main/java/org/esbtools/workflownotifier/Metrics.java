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

/**
 * Meter names. Every meter is tagged with the {@link #SUBSCRIBER_TAG subscriber} it belongs to.
 */
public abstract class Metrics {
    public static final String SUBSCRIBER_TAG = "subscriber";

    public static final String BATCH_REQUESTS = "workflow.notifier.batch.requests";
    public static final String BATCH_RETRIES = "workflow.notifier.batch.retries";
    public static final String BATCH_FAILURES = "workflow.notifier.batch.failures";
    public static final String DUPLICATES = "workflow.notifier.duplicates";
    public static final String ACK_LATENCY = "workflow.notifier.ack.latency";

    public static final String CORRUPTED_DATA = "workflow.notifier.corrupted.data";
    public static final String FILTERED = "workflow.notifier.filtered";
    public static final String PROCESS_LATENCY = "workflow.notifier.process.latency";
    public static final String PROCESS_FAILURES = "workflow.notifier.process.failures";
    public static final String WEBHOOK_FAILURES = "workflow.notifier.webhook.failures";
}
