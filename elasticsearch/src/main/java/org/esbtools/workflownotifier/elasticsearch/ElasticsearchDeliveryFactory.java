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
import io.micrometer.core.instrument.MeterRegistry;
import org.esbtools.workflownotifier.AcknowledgingBatchProcessor;
import org.esbtools.workflownotifier.BatchedNotificationDelivery;
import org.esbtools.workflownotifier.DeliveryFactory;
import org.esbtools.workflownotifier.NotificationDelivery;
import org.esbtools.workflownotifier.ShardedDispatchTable;
import org.esbtools.workflownotifier.config.BulkConfig;
import org.esbtools.workflownotifier.config.SubscriberConfig;
import org.esbtools.workflownotifier.model.NotificationJson;
import org.esbtools.workflownotifier.model.WorkflowMessageDecoder;

import java.net.http.HttpClient;

/**
 * Delivers a {@link org.esbtools.workflownotifier.config.DeliveryMethod#BULK BULK} subscriber's
 * notifications by indexing them into Elasticsearch.
 */
public class ElasticsearchDeliveryFactory implements DeliveryFactory {
    @Override
    public NotificationDelivery create(SubscriberConfig subscriber, MeterRegistry registry)
            throws Exception {
        String name = subscriber.getName();
        BulkConfig bulk = subscriber.getDelivery().getBulk();
        ObjectMapper mapper = NotificationJson.newObjectMapper();

        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(bulk.getRequestTimeout())
                .build();

        BulkClient client = new HttpBulkClient(http, bulk.getUrl(), bulk.getRequestTimeout(),
                mapper);

        AcknowledgingBatchProcessor<BulkIndexRequest> processor =
                new AcknowledgingBatchProcessor<>(name,
                        new ShardedDispatchTable<>(bulk.getDispatchShards()),
                        BulkIndexRequest::keyOf, new WorkflowMessageDecoder(mapper), registry);

        processor.start(BulkProcessor.factory(name, client, bulk,
                subscriber.getConsumer().getShutdownTimeout()));

        return new BatchedNotificationDelivery<>(processor,
                new NotificationIndexRequestBuilder(bulk.getIndex(), mapper));
    }
}
