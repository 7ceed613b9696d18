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

import com.google.common.truth.Truth;
import org.apache.camel.Exchange;
import org.apache.camel.component.mock.MockEndpoint;
import org.apache.camel.test.junit4.CamelTestSupport;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class CamelMessageStreamTest extends CamelTestSupport {
    static final Duration POLL_TIMEOUT = Duration.ofSeconds(5);

    CamelMessageStream stream;

    @After
    public void stopStream() {
        if (stream != null) {
            stream.stop();
        }
    }

    @Test(timeout = 20000)
    public void shouldDeriveOffsetFromBodyForEndpointsWithoutPartitions() throws Exception {
        stream = startStream("seda:incoming", Optional.empty());

        template.sendBody("seda:incoming", "first");
        template.sendBody("seda:incoming", "second");

        LogMessage first = stream.poll(POLL_TIMEOUT).get();
        LogMessage second = stream.poll(POLL_TIMEOUT).get();

        Truth.assertThat(new String(first.value(), StandardCharsets.UTF_8)).isEqualTo("first");
        Truth.assertThat(first.partition()).isEqualTo(0);
        Truth.assertThat(first.offset()).isEqualTo(CamelMessageStream.contentOffset(
                "first".getBytes(StandardCharsets.UTF_8)));
        Truth.assertThat(first.offset()).isAtLeast(0L);
        Truth.assertThat(second.offset()).isNotEqualTo(first.offset());

        first.ack();
        second.ack();
    }

    @Test(timeout = 20000)
    public void shouldKeepPositionOfRedeliveredMessageAcrossStreamRestarts() throws Exception {
        stream = startStream("seda:incoming", Optional.empty());
        template.sendBody("seda:incoming", "{\"payload\":\"A\"}");

        LogMessage beforeRestart = stream.poll(POLL_TIMEOUT).get();
        String keyBeforeRestart = IdentityKeyStrategy.logPosition(beforeRestart);
        beforeRestart.ack();
        stream.stop();

        stream = startStream("seda:incoming", Optional.empty());
        template.sendBody("seda:incoming", "{\"payload\":\"B\"}");
        template.sendBody("seda:incoming", "{\"payload\":\"A\"}");

        Map<String, String> keysByBody = new HashMap<>();
        for (int i = 0; i < 2; i++) {
            LogMessage message = stream.poll(POLL_TIMEOUT).get();
            keysByBody.put(new String(message.value(), StandardCharsets.UTF_8),
                    IdentityKeyStrategy.logPosition(message));
            message.ack();
        }

        Truth.assertThat(keysByBody.get("{\"payload\":\"A\"}")).isEqualTo(keyBeforeRestart);
        Truth.assertThat(keysByBody.get("{\"payload\":\"B\"}")).isNotEqualTo(keyBeforeRestart);
    }

    @Test(timeout = 20000)
    public void shouldTakePartitionAndOffsetFromKafkaHeaders() throws Exception {
        stream = startStream("direct:incoming", Optional.empty());

        Future<Exchange> sent = template.asyncSend("direct:incoming", exchange -> {
            exchange.getIn().setBody("payload");
            exchange.getIn().setHeader(CamelMessageStream.PARTITION_HEADER, 3);
            exchange.getIn().setHeader(CamelMessageStream.OFFSET_HEADER, 77L);
        });

        LogMessage message = stream.poll(POLL_TIMEOUT).get();

        Truth.assertThat(message.partition()).isEqualTo(3);
        Truth.assertThat(message.offset()).isEqualTo(77L);

        message.ack();
        sent.get(5, TimeUnit.SECONDS);
    }

    @Test(timeout = 20000)
    public void shouldCompleteExchangeOnlyOnceMessageIsAcked() throws Exception {
        stream = startStream("direct:incoming", Optional.empty());

        Future<Exchange> sent = template.asyncSend("direct:incoming",
                exchange -> exchange.getIn().setBody("payload"));

        LogMessage message = stream.poll(POLL_TIMEOUT).get();

        Truth.assertThat(sent.isDone()).isFalse();

        message.ack();

        Exchange exchange = sent.get(5, TimeUnit.SECONDS);
        Truth.assertThat(exchange.getException()).isNull();
    }

    @Test(timeout = 20000)
    public void shouldForwardNackedMessageWithHeadersToDeadLetterUri() throws Exception {
        MockEndpoint deadLetters = getMockEndpoint("mock:dead-letters");
        deadLetters.expectedMessageCount(1);
        deadLetters.expectedHeaderReceived("workflowId", "order-1");
        stream = startStream("direct:incoming", Optional.of("mock:dead-letters"));

        Future<Exchange> sent = template.asyncSend("direct:incoming", exchange -> {
            exchange.getIn().setBody("poison");
            exchange.getIn().setHeader("workflowId", "order-1");
        });

        stream.poll(POLL_TIMEOUT).get().nack();

        deadLetters.assertIsSatisfied();
        byte[] deadLetter = deadLetters.getExchanges().get(0).getIn().getBody(byte[].class);
        Truth.assertThat(new String(deadLetter, StandardCharsets.UTF_8)).isEqualTo("poison");
        Truth.assertThat(sent.get(5, TimeUnit.SECONDS).getException()).isNull();
    }

    @Test(timeout = 20000)
    public void shouldFailExchangeOfNackedMessageWhenThereIsNoDeadLetterUri() throws Exception {
        stream = startStream("direct:incoming", Optional.empty());

        Future<Exchange> sent = template.asyncSend("direct:incoming",
                exchange -> exchange.getIn().setBody("poison"));

        stream.poll(POLL_TIMEOUT).get().nack();

        Truth.assertThat(sent.get(5, TimeUnit.SECONDS).getException()).isNotNull();
    }

    @Test(timeout = 20000, expected = IllegalStateException.class)
    public void shouldRefuseToAcknowledgeMessageTwice() throws Exception {
        stream = startStream("seda:incoming", Optional.empty());
        template.sendBody("seda:incoming", "payload");

        LogMessage message = stream.poll(POLL_TIMEOUT).get();
        message.ack();
        message.nack();
    }

    @Test(timeout = 20000)
    public void shouldFailUnacknowledgedExchangesBackToEndpointOnStop() throws Exception {
        stream = startStream("direct:incoming", Optional.empty());

        Future<Exchange> first = template.asyncSend("direct:incoming",
                exchange -> exchange.getIn().setBody("first"));
        Future<Exchange> second = template.asyncSend("direct:incoming",
                exchange -> exchange.getIn().setBody("second"));

        LogMessage pulled = stream.poll(POLL_TIMEOUT).get();

        stream.stop();

        Truth.assertThat(first.get(5, TimeUnit.SECONDS).getException()).isNotNull();
        Truth.assertThat(second.get(5, TimeUnit.SECONDS).getException()).isNotNull();
        Truth.assertThat(stream.isStopped()).isTrue();
        Truth.assertThat(stream.poll(Duration.ofMillis(10)).isPresent()).isFalse();

        try {
            pulled.ack();
            Assert.fail("Ack after stop should be refused");
        } catch (IllegalStateException expected) {
            // expected
        }
    }

    @Test(timeout = 20000)
    public void shouldStillStopStreamWhoseRouteFailedToStart() throws Exception {
        stream = new CamelMessageStream(context, "test", "no-such-component:incoming",
                Optional.empty(), 10, Duration.ofSeconds(2));

        try {
            stream.start();
            Assert.fail("Expected start to fail for an unknown component");
        } catch (Exception expected) {
            // expected
        }

        stream.stop();

        Truth.assertThat(stream.isStopped()).isTrue();
        Truth.assertThat(stream.poll(Duration.ofMillis(10)).isPresent()).isFalse();
    }

    private CamelMessageStream startStream(String fromUri, Optional<String> deadLetterUri)
            throws Exception {
        CamelMessageStream stream = new CamelMessageStream(context, "test", fromUri,
                deadLetterUri, 10, Duration.ofSeconds(2));
        stream.start();
        return stream;
    }
}
