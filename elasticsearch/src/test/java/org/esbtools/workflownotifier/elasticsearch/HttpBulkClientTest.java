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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.truth.Truth;
import org.esbtools.workflownotifier.BatchItemResult;
import org.esbtools.workflownotifier.StatusClass;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@RunWith(JUnit4.class)
public class HttpBulkClientTest {
    ObjectMapper mapper = new ObjectMapper();

    FakeBulkServer server = newServer();

    HttpBulkClient client = new HttpBulkClient(HttpClient.newHttpClient(), server.url(),
            Duration.ofSeconds(5), mapper);

    @After
    public void stopServer() {
        server.close();
    }

    @Test
    public void shouldSendActionsAsNdjsonAndReturnItemResultsInOrder() throws Exception {
        server.respondToId("b", 409);
        server.respondToId("c", 503);

        List<BatchItemResult> results = client.bulk(Arrays.asList(
                BulkIndexRequest.index("notifications", "a", document("a")),
                BulkIndexRequest.index("notifications", "b", document("b")),
                BulkIndexRequest.index("notifications", "c", document("c")),
                BulkIndexRequest.index("notifications", "d", document("d"))));

        Truth.assertThat(server.bulkIds()).containsExactly(Arrays.asList("a", "b", "c", "d"));
        Truth.assertThat(server.contentTypes()).containsExactly("application/x-ndjson");
        Truth.assertThat(server.documents()).hasSize(4);
        Truth.assertThat(server.documents().get(0).path("name").asText()).isEqualTo("a");

        Truth.assertThat(results).hasSize(4);
        Truth.assertThat(results.get(0).status()).isEqualTo(201);
        Truth.assertThat(results.get(0).error().isPresent()).isFalse();
        Truth.assertThat(results.get(1).status()).isEqualTo(409);
        Truth.assertThat(results.get(2).status()).isEqualTo(503);
        Truth.assertThat(results.get(2).error().get()).contains("simulated 503");
        Truth.assertThat(results.get(3).status()).isEqualTo(201);
    }

    @Test
    public void shouldWriteOneActionLineAndOneSourceLinePerRequest() throws Exception {
        byte[] ndjson = client.toNdjson(Arrays.asList(
                BulkIndexRequest.index("notifications", "a", document("a")),
                BulkIndexRequest.index("archive", "b", document("b"))));

        Truth.assertThat(new String(ndjson, StandardCharsets.UTF_8)).isEqualTo("" +
                "{\"index\":{\"_index\":\"notifications\",\"_id\":\"a\"}}\n" +
                "{\"name\":\"a\"}\n" +
                "{\"index\":{\"_index\":\"archive\",\"_id\":\"b\"}}\n" +
                "{\"name\":\"b\"}\n");
    }

    @Test
    public void shouldReportStatusOfFailedRequest() throws Exception {
        server.failRequests(429);

        try {
            client.bulk(Arrays.asList(BulkIndexRequest.index("n", "a", document("a"))));
            Assert.fail("Expected bulk request to fail");
        } catch (BulkRequestException e) {
            Truth.assertThat(e.status()).isEqualTo(429);
        }
    }

    @Test
    public void shouldReportResponseWithWrongItemCountAsNotRetryable() throws Exception {
        server.dropLastItemOfResponses();

        try {
            client.bulk(Arrays.asList(
                    BulkIndexRequest.index("n", "a", document("a")),
                    BulkIndexRequest.index("n", "b", document("b"))));
            Assert.fail("Expected bulk request to fail");
        } catch (BulkRequestException e) {
            Truth.assertThat(e.status()).isEqualTo(HttpBulkClient.BAD_RESPONSE_STATUS);
            Truth.assertThat(StatusClass.of(e.status())).isEqualTo(StatusClass.PERMANENT);
        }
    }

    @Test
    public void shouldReportUnreachableClusterAsUnavailable() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        HttpBulkClient unreachable = new HttpBulkClient(HttpClient.newHttpClient(),
                URI.create("http://localhost:" + unusedPort + "/"), Duration.ofSeconds(2),
                mapper);

        try {
            unreachable.bulk(Arrays.asList(BulkIndexRequest.index("n", "a", document("a"))));
            Assert.fail("Expected bulk request to fail");
        } catch (BulkRequestException e) {
            Truth.assertThat(e.status()).isEqualTo(503);
        }
    }

    private ObjectNode document(String name) {
        return mapper.createObjectNode().put("name", name);
    }

    private static FakeBulkServer newServer() {
        try {
            return new FakeBulkServer();
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }
}
