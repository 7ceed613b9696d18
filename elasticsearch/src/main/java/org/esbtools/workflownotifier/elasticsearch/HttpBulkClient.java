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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.esbtools.workflownotifier.BatchItemResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Speaks the Elasticsearch {@code _bulk} API: newline delimited action and source lines in,
 * one item per action out.
 */
public class HttpBulkClient implements BulkClient {
    private final HttpClient client;
    private final URI bulkUri;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;

    static final int NO_RESPONSE_STATUS = 503;
    /**
     * A 2xx response which cannot be matched to the request. Not retryable: the same batch would
     * get the same answer again.
     */
    static final int BAD_RESPONSE_STATUS = 502;
    static final int UNSERIALIZABLE_STATUS = 400;

    private static final int MAX_LOGGED_BODY = 1024;

    private static final Logger log = LoggerFactory.getLogger(HttpBulkClient.class);

    /**
     * @param url The cluster's base URL. Requests go to {@code <url>/_bulk}.
     */
    public HttpBulkClient(HttpClient client, URI url, Duration requestTimeout,
            ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.bulkUri = bulkUriOf(Objects.requireNonNull(url, "url"));
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public List<BatchItemResult> bulk(List<BulkIndexRequest> requests)
            throws BulkRequestException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(bulkUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-ndjson")
                .POST(HttpRequest.BodyPublishers.ofByteArray(toNdjson(requests)))
                .build();

        HttpResponse<byte[]> response;

        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new BulkRequestException(NO_RESPONSE_STATUS,
                    "No response to bulk request to " + bulkUri + ": " + e, e);
        }

        int status = response.statusCode();

        if (status < 200 || status >= 300) {
            throw new BulkRequestException(status, "Bulk request to " + bulkUri +
                    " failed with status " + status + ": " + truncatedBody(response.body()));
        }

        return parseItems(response.body(), requests.size());
    }

    byte[] toNdjson(List<BulkIndexRequest> requests) throws BulkRequestException {
        ByteArrayOutputStream ndjson = new ByteArrayOutputStream();

        try {
            for (BulkIndexRequest request : requests) {
                ObjectNode action = mapper.createObjectNode();
                action.putObject(BulkIndexRequest.ACTION)
                        .put("_index", request.index())
                        .put("_id", request.id());

                writeLine(ndjson, action);
                writeLine(ndjson, request.source());
            }
        } catch (IOException e) {
            throw new BulkRequestException(UNSERIALIZABLE_STATUS,
                    "Cannot serialize bulk request: " + e, e);
        }

        return ndjson.toByteArray();
    }

    private void writeLine(ByteArrayOutputStream out, JsonNode json) throws IOException {
        out.write(mapper.writeValueAsBytes(json));
        out.write('\n');
    }

    private List<BatchItemResult> parseItems(byte[] body, int expected)
            throws BulkRequestException {
        JsonNode items;

        try {
            items = mapper.readTree(body).path("items");
        } catch (IOException e) {
            throw new BulkRequestException(BAD_RESPONSE_STATUS,
                    "Unparseable bulk response from " + bulkUri + ": " + truncatedBody(body), e);
        }

        if (!items.isArray() || items.size() != expected) {
            throw new BulkRequestException(BAD_RESPONSE_STATUS, "Expected " + expected +
                    " items in bulk response from " + bulkUri + " but got: " +
                    truncatedBody(body));
        }

        List<BatchItemResult> results = new ArrayList<>(expected);

        for (JsonNode item : items) {
            Iterator<JsonNode> actions = item.elements();
            JsonNode result = actions.hasNext() ? actions.next() : item;

            int status = result.path("status").asInt(BAD_RESPONSE_STATUS);
            JsonNode error = result.path("error");

            results.add(new BatchItemResult(status, error.isMissingNode() || error.isNull()
                    ? Optional.empty()
                    : Optional.of(error.isTextual() ? error.textValue() : error.toString())));
        }

        log.debug("Bulk request to {} returned {} items", bulkUri, results.size());

        return results;
    }

    private static URI bulkUriOf(URI url) {
        String base = url.toString();
        return URI.create(base.endsWith("/") ? base + "_bulk" : base + "/_bulk");
    }

    private static String truncatedBody(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() <= MAX_LOGGED_BODY ? text : text.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
