package com.work.confirm.core.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.confirm.core.channel.FakePushTransport;
import com.work.confirm.core.channel.PushChannelConnection;
import com.work.confirm.core.config.PushChannelConfig;
import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.SignatureNotification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class SubscriptionRegistryTest {

    private static final String SIG_A = "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";
    private static final String SIG_B = "4uQeVj5tqViQh7yWWGStvkEG1Zmhx6uasJtWCJziofM95hbFfRsAqNfK7URSdJbGDnMm2KmT4eqbgN7Gbo5R5Nfy";
    private static final Duration ACK_TIMEOUT = Duration.ofSeconds(2);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong nextSubscriptionId = new AtomicLong(42);

    private FakePushTransport transport;
    private PushChannelConnection connection;
    private SubscriptionRegistry registry;

    @BeforeEach
    public void setUp() {
        transport = new FakePushTransport();
        PushChannelConfig config = new PushChannelConfig(Duration.ofSeconds(1), ACK_TIMEOUT, Duration.ofMinutes(10),
                Duration.ofMillis(200), Duration.ofMinutes(1), Duration.ofMillis(200));
        connection = new PushChannelConnection(URI.create("ws://127.0.0.1:8900"), () -> transport, config);
        registry = new SubscriptionRegistry(connection, new SignatureWireCodec(objectMapper));
    }

    @AfterEach
    public void tearDown() {
        connection.close();
    }

    /**
     * 模拟节点：对每个订阅请求回一个递增的订阅 id。
     */
    private void ackSubscribes() {
        transport.onSend = frame -> {
            JsonNode req = read(frame);
            if ("signatureSubscribe".equals(req.path("method").asText())) {
                transport.push("{\"jsonrpc\":\"2.0\",\"result\":" + nextSubscriptionId.getAndIncrement()
                        + ",\"id\":" + req.path("id").asLong() + "}");
            }
        };
    }

    private JsonNode read(String frame) {
        try {
            return objectMapper.readTree(frame);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String notification(long subscriptionId, String err) {
        return "{\"jsonrpc\":\"2.0\",\"method\":\"signatureNotification\",\"params\":{\"result\":"
                + "{\"context\":{\"slot\":5207624},\"value\":{\"err\":" + err + "}},\"subscription\":" + subscriptionId + "}}";
    }

    @Test
    public void subscribe_ack_then_notification_invokes_callback_once() throws Exception {
        ackSubscribes();
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<SignatureNotification> first = new CompletableFuture<>();
        CompletableFuture<SignatureNotification> barrier = new CompletableFuture<>();

        SubscribeOutcome a = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> {
            calls.incrementAndGet();
            first.complete(n);
        }, ACK_TIMEOUT);
        SubscribeOutcome b = registry.subscribe(SIG_B, Commitment.CONFIRMED, barrier::complete, ACK_TIMEOUT);

        assertTrue(a.isSubscribed());
        assertEquals(42L, a.getSubscriptionId().get());
        assertEquals(43L, b.getSubscriptionId().get());
        assertEquals(2, registry.pendingCount());

        transport.push(notification(42, "null"));
        transport.push(notification(42, "null"));
        transport.push(notification(43, "null"));

        SignatureNotification n = first.get(2, TimeUnit.SECONDS);
        barrier.get(2, TimeUnit.SECONDS);
        assertTrue(n.isSuccess());
        assertEquals(5207624L, n.getSlot());
        assertEquals(1, calls.get());
        assertEquals(0, registry.pendingCount());
    }

    @Test
    public void notification_with_error_is_delivered_as_failure() throws Exception {
        ackSubscribes();
        CompletableFuture<SignatureNotification> slot = new CompletableFuture<>();
        registry.subscribe(SIG_A, Commitment.FINALIZED, slot::complete, ACK_TIMEOUT);

        transport.push(notification(42, "{\"InstructionError\":[0,{\"Custom\":6001}]}"));

        SignatureNotification n = slot.get(2, TimeUnit.SECONDS);
        assertFalse(n.isSuccess());
        assertTrue(n.getErr().has("InstructionError"));
    }

    @Test
    public void unknown_subscription_notification_is_dropped() throws Exception {
        ackSubscribes();
        CompletableFuture<SignatureNotification> slot = new CompletableFuture<>();
        registry.subscribe(SIG_A, Commitment.CONFIRMED, slot::complete, ACK_TIMEOUT);

        transport.push(notification(999, "null"));
        transport.push("not json at all");
        transport.push(notification(42, "null"));

        assertEquals(42L, slot.get(2, TimeUnit.SECONDS).getSubscriptionId());
        assertTrue(connection.isConnected());
    }

    @Test
    public void callback_exception_is_isolated_from_other_subscriptions() throws Exception {
        ackSubscribes();
        CompletableFuture<SignatureNotification> healthy = new CompletableFuture<>();
        registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> {
            throw new IllegalStateException("caller bug");
        }, ACK_TIMEOUT);
        registry.subscribe(SIG_B, Commitment.CONFIRMED, healthy::complete, ACK_TIMEOUT);

        transport.push(notification(42, "null"));
        transport.push(notification(43, "null"));

        assertEquals(43L, healthy.get(2, TimeUnit.SECONDS).getSubscriptionId());
    }

    @Test
    public void unsubscribe_twice_returns_false_the_second_time() {
        ackSubscribes();
        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);
        long subId = outcome.getSubscriptionId().get();

        assertTrue(registry.unsubscribe(subId));
        assertFalse(registry.unsubscribe(subId));
        assertEquals(0, registry.pendingCount());

        String last = transport.sent.get(transport.sent.size() - 1);
        JsonNode req = read(last);
        assertEquals("signatureUnsubscribe", req.path("method").asText());
        assertEquals(subId, req.path("params").get(0).asLong());
    }

    @Test
    public void missing_ack_times_out() {
        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, Duration.ofMillis(100));

        assertFalse(outcome.isSubscribed());
        assertEquals(PushFailureKind.SUBSCRIBE_TIMEOUT, outcome.getFailureKind());
        assertEquals(0, registry.pendingCount());
    }

    @Test
    public void late_ack_after_timeout_is_unsubscribed() throws Exception {
        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, Duration.ofMillis(100));
        assertEquals(PushFailureKind.SUBSCRIBE_TIMEOUT, outcome.getFailureKind());
        long requestId = read(transport.sent.get(0)).path("id").asLong();

        transport.push("{\"jsonrpc\":\"2.0\",\"result\":77,\"id\":" + requestId + "}");

        long deadline = System.currentTimeMillis() + 2000;
        while (transport.sent.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        JsonNode unsub = read(transport.sent.get(1));
        assertEquals("signatureUnsubscribe", unsub.path("method").asText());
        assertEquals(77L, unsub.path("params").get(0).asLong());
        assertEquals(0, registry.pendingCount());
    }

    @Test
    public void error_ack_is_rejected() {
        transport.onSend = frame -> transport.push("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32602,\"message\":\"Invalid param: WrongSize\"},\"id\":"
                + read(frame).path("id").asLong() + "}");

        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);

        assertEquals(PushFailureKind.SUBSCRIBE_REJECTED, outcome.getFailureKind());
        assertTrue(outcome.getReason().contains("Invalid param"));
    }

    @Test
    public void malformed_ack_is_rejected() {
        transport.onSend = frame -> transport.push("{\"jsonrpc\":\"2.0\",\"result\":\"abc\",\"id\":"
                + read(frame).path("id").asLong() + "}");

        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);

        assertEquals(PushFailureKind.SUBSCRIBE_REJECTED, outcome.getFailureKind());
        assertEquals(0, registry.pendingCount());
    }

    @Test
    public void ack_without_id_matches_oldest_pending_request() {
        transport.onSend = frame -> transport.push("{\"jsonrpc\":\"2.0\",\"result\":42}");

        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);

        assertTrue(outcome.isSubscribed());
        assertEquals(42L, outcome.getSubscriptionId().get());
    }

    @Test
    public void idless_unsubscribe_ack_is_not_taken_as_subscribe_ack() {
        transport.onSend = frame -> {
            if ("signatureSubscribe".equals(read(frame).path("method").asText())) {
                transport.push("{\"jsonrpc\":\"2.0\",\"result\":true}");
                transport.push("{\"jsonrpc\":\"2.0\",\"result\":" + nextSubscriptionId.getAndIncrement() + "}");
            }
        };

        SubscribeOutcome outcome = registry.subscribe(SIG_B, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);

        assertTrue(outcome.isSubscribed());
        assertEquals(42L, outcome.getSubscriptionId().get());
        assertEquals(1, registry.pendingCount());
    }

    @Test
    public void delivered_subscription_is_not_unsubscribed_again() throws Exception {
        ackSubscribes();
        CompletableFuture<SignatureNotification> slot = new CompletableFuture<>();
        long subId = registry.subscribe(SIG_A, Commitment.CONFIRMED, slot::complete, ACK_TIMEOUT).getSubscriptionId().get();

        transport.push(notification(subId, "null"));
        slot.get(2, TimeUnit.SECONDS);

        assertFalse(registry.unsubscribe(subId));
        assertEquals(1, transport.sent.size());
        assertEquals("signatureSubscribe", read(transport.sent.get(0)).path("method").asText());
    }

    @Test
    public void unavailable_channel_returns_connection_error() {
        transport.refuseConnect = true;

        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);

        assertEquals(PushFailureKind.CONNECTION_ERROR, outcome.getFailureKind());
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    public void send_failure_returns_transport_error() {
        assertTrue(connection.ensureConnected());
        transport.failSend = true;

        SubscribeOutcome outcome = registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);

        assertEquals(PushFailureKind.TRANSPORT_ERROR, outcome.getFailureKind());
    }

    @Test
    public void disconnect_purges_subscriptions() {
        ackSubscribes();
        registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);
        registry.subscribe(SIG_B, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);
        assertEquals(2, registry.pendingCount());

        connection.disconnect();

        assertEquals(0, registry.pendingCount());
        assertFalse(registry.unsubscribe(42));
    }

    @Test
    public void request_ids_are_monotonic_across_reconnects() {
        ackSubscribes();
        registry.subscribe(SIG_A, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);
        connection.disconnect();
        registry.subscribe(SIG_B, Commitment.CONFIRMED, n -> { }, ACK_TIMEOUT);

        List<Long> ids = new ArrayList<>();
        for (String frame : transport.sent) {
            ids.add(read(frame).path("id").asLong());
        }
        assertEquals(List.of(1L, 2L), ids);
    }
}
