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

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * How the engine reacts to a status code reported by a batch backend for one submitted item.
 */
public enum StatusClass {
    /** The item's effect happened, possibly on a previous attempt. Ack and forget it. */
    SUCCESS,

    /**
     * Transient failure. The backend retries the item on its own and reports it again later, so
     * the engine leaves it pending.
     */
    RETRYABLE,

    /** The item will never succeed. Nack and forget it. */
    PERMANENT;

    /**
     * 408 Request Timeout, 429 Too Many Requests, 500 node not connected, 503 Service Unavailable,
     * 507 Insufficient Storage. Backends keep items with these statuses queued and retry them.
     */
    private static final Set<Integer> RETRYABLE_STATUSES = ImmutableSet.of(408, 429, 500, 503, 507);

    /**
     * 2xx, plus 404 Not Found and 409 Version Conflict: both mean the document is already past the
     * state this item would have put it in, which is what a redelivered item looks like.
     */
    public static StatusClass of(int status) {
        if ((status >= 200 && status < 300) || status == 404 || status == 409) {
            return SUCCESS;
        }

        if (RETRYABLE_STATUSES.contains(status)) {
            return RETRYABLE;
        }

        return PERMANENT;
    }

    public static boolean isRetryable(int status) {
        return of(status) == RETRYABLE;
    }
}
