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

package org.esbtools.workflownotifier.elasticsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.esbtools.workflownotifier.BatchRequestBuilder;
import org.esbtools.workflownotifier.model.Notification;

import java.util.Objects;

/**
 * Indexes each notification as a document whose id is the notification's identity key, so a
 * redelivered notification overwrites its earlier copy.
 */
public class NotificationIndexRequestBuilder implements BatchRequestBuilder<BulkIndexRequest> {
    private final String index;
    private final ObjectMapper mapper;

    public NotificationIndexRequestBuilder(String index, ObjectMapper mapper) {
        this.index = Objects.requireNonNull(index, "index");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public BulkIndexRequest build(String key, Notification notification) {
        return BulkIndexRequest.index(index, key, mapper.valueToTree(notification));
    }
}
