package com.work.confirm.core.subscription;

import com.work.confirm.core.channel.ChannelListener;
import com.work.confirm.core.channel.PushChannelConnection;
import com.work.confirm.core.exception.PushChannelException;
import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.SignatureNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static com.work.confirm.core.support.ValidationUtils.requireNonEmpty;
import static com.work.confirm.core.support.ValidationUtils.requireNonNull;

/**
 * 订阅表 + 入站分发：把 push 通知关联回发起订阅的等待方。
 *
 * <ul>
 *     <li>请求 id 单调递增，永不复用（跨重连也不重置）</li>
 *     <li>ack 在 dispatch 线程上处理：先登记订阅再完成 ack，保证随后到达的通知一定能找到回调</li>
 *     <li>订阅表的所有变更都在同一把锁下进行：订阅插入、退订移除、投递移除互斥，回调至多触发一次</li>
 *     <li>回调在锁外执行，异常只记录日志，不影响 dispatch 循环</li>
 *     <li>连接丢失时清空订阅表，不完成任何结果槽</li>
 * </ul>
 */
public class SubscriptionRegistry implements SignatureSubscriber, ChannelListener {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final PushChannelConnection connection;
    private final SignatureWireCodec codec;

    private final AtomicLong nextRequestId = new AtomicLong(1);
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final ConcurrentNavigableMap<Long, PendingAck> pendingAcks = new ConcurrentSkipListMap<>();
    private final Map<Long, Subscription> subscriptions = new ConcurrentHashMap<>();
    // ack 超时后才到达的订阅请求，收到后立即退订，避免节点侧残留
    private final Set<Long> abandonedRequests = ConcurrentHashMap.newKeySet();

    public SubscriptionRegistry(PushChannelConnection connection, SignatureWireCodec codec) {
        this.connection = requireNonNull(connection, "connection");
        this.codec = requireNonNull(codec, "codec");
        connection.setListener(this);
    }

    @Override
    public SubscribeOutcome subscribe(String signature, Commitment commitment,
                                      Consumer<SignatureNotification> callback, Duration ackTimeout) {
        requireNonEmpty(signature, "signature");
        requireNonNull(commitment, "commitment");
        requireNonNull(callback, "callback");
        requireNonNull(ackTimeout, "ackTimeout");

        if (!connection.ensureConnected()) {
            return SubscribeOutcome.failure(PushFailureKind.CONNECTION_ERROR, "push channel unavailable");
        }

        long requestId = nextRequestId.getAndIncrement();
        PendingAck pending = new PendingAck(requestId, signature, commitment, callback);
        mutationLock.lock();
        try {
            pendingAcks.put(requestId, pending);
        } finally {
            mutationLock.unlock();
        }

        try {
            connection.send(codec.subscribeRequest(requestId, signature, commitment));
        } catch (PushChannelException e) {
            removePending(requestId);
            return SubscribeOutcome.failure(PushFailureKind.TRANSPORT_ERROR, e.getMessage());
        }

        try {
            long waitMillis = Math.max(0L, ackTimeout.toMillis());
            return pending.ack.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!removePending(requestId)) {
                // ack 与超时同时发生：dispatch 线程已经处理完该 ack
                return pending.ack.join();
            }
            abandonedRequests.add(requestId);
            log.warn("Subscribe ack timeout. signature={} requestId={} timeout={}", abbreviate(signature), requestId, ackTimeout);
            return SubscribeOutcome.failure(PushFailureKind.SUBSCRIBE_TIMEOUT, "no ack within " + ackTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!removePending(requestId)) {
                return pending.ack.join();
            }
            abandonedRequests.add(requestId);
            return SubscribeOutcome.failure(PushFailureKind.TRANSPORT_ERROR, "interrupted while waiting for ack");
        } catch (ExecutionException e) {
            removePending(requestId);
            return SubscribeOutcome.failure(PushFailureKind.TRANSPORT_ERROR, String.valueOf(e.getCause()));
        }
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        Subscription removed;
        mutationLock.lock();
        try {
            removed = subscriptions.remove(subscriptionId);
        } finally {
            mutationLock.unlock();
        }
        if (removed == null) {
            // 通知送达时条目已移除，节点在推送通知后自行取消该订阅，不再发送 signatureUnsubscribe
            return false;
        }
        if (!connection.isConnected()) {
            return false;
        }
        try {
            connection.send(codec.unsubscribeRequest(nextRequestId.getAndIncrement(), subscriptionId));
            log.info("Unsubscribed signature. signature={} subscriptionId={}", abbreviate(removed.signature), subscriptionId);
            return true;
        } catch (PushChannelException e) {
            log.debug("Unsubscribe send failed. subscriptionId={} err={}", subscriptionId, e.getMessage());
            return false;
        }
    }

    @Override
    public int pendingCount() {
        return subscriptions.size();
    }

    @Override
    public void onFrame(String frame) {
        InboundFrame f = codec.parse(frame);
        switch (f.getType()) {
            case RESPONSE:
                handleResponse(f);
                break;
            case NOTIFICATION:
                handleNotification(f.getNotification());
                break;
            default:
                log.debug("Ignored push frame");
        }
    }

    @Override
    public void onDisconnected(String reason) {
        List<PendingAck> orphaned;
        int purged;
        mutationLock.lock();
        try {
            orphaned = new ArrayList<>(pendingAcks.values());
            pendingAcks.clear();
            purged = subscriptions.size();
            subscriptions.clear();
            abandonedRequests.clear();
        } finally {
            mutationLock.unlock();
        }
        for (PendingAck p : orphaned) {
            p.ack.complete(SubscribeOutcome.failure(PushFailureKind.CONNECTION_ERROR, "connection lost: " + reason));
        }
        if (purged > 0 || !orphaned.isEmpty()) {
            log.info("Push subscriptions purged. subscriptions={} pendingAcks={} reason={}", purged, orphaned.size(), reason);
        }
    }

    private void handleResponse(InboundFrame f) {
        Long requestId = f.getRequestId();
        if (requestId == null && !f.hasSubscriptionId()) {
            // 不带 id 且不是订阅 id 的响应（如退订 ack 的 true）无法归属到任何订阅请求
            log.debug("Ignored response without id. result={}", f.getResult());
            return;
        }
        PendingAck pending;
        mutationLock.lock();
        try {
            if (requestId != null) {
                pending = pendingAcks.remove(requestId);
            } else {
                // 不带 id 的 ack 按发送顺序匹配最早的待确认订阅
                Map.Entry<Long, PendingAck> first = pendingAcks.pollFirstEntry();
                pending = first == null ? null : first.getValue();
            }
            if (pending != null && f.getError() == null && f.hasSubscriptionId()) {
                long subId = f.getResult().asLong();
                subscriptions.put(subId, new Subscription(subId, pending.signature, pending.commitment, pending.callback));
            }
        } finally {
            mutationLock.unlock();
        }

        if (pending == null) {
            if (requestId != null && abandonedRequests.remove(requestId) && f.hasSubscriptionId()) {
                sendLateUnsubscribe(f.getResult().asLong());
            }
            return;
        }

        if (f.getError() != null) {
            log.warn("Subscribe rejected. signature={} requestId={} err={}", abbreviate(pending.signature), pending.requestId, f.getError());
            pending.ack.complete(SubscribeOutcome.failure(PushFailureKind.SUBSCRIBE_REJECTED, f.getError()));
        } else if (!f.hasSubscriptionId()) {
            log.warn("Malformed subscribe ack. signature={} requestId={}", abbreviate(pending.signature), pending.requestId);
            pending.ack.complete(SubscribeOutcome.failure(PushFailureKind.SUBSCRIBE_REJECTED, "malformed ack"));
        } else {
            long subId = f.getResult().asLong();
            log.info("Subscribed signature. signature={} subscriptionId={} commitment={}",
                    abbreviate(pending.signature), subId, pending.commitment.getWireValue());
            pending.ack.complete(SubscribeOutcome.subscribed(subId));
        }
    }

    private void handleNotification(SignatureNotification n) {
        Subscription s;
        mutationLock.lock();
        try {
            s = subscriptions.remove(n.getSubscriptionId());
        } finally {
            mutationLock.unlock();
        }
        if (s == null) {
            log.debug("Notification for unknown subscription dropped. subscriptionId={}", n.getSubscriptionId());
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("Signature notification delivered. signature={} subscriptionId={} commitment={} waitedMs={} success={}",
                    abbreviate(s.signature), s.id, s.commitment.getWireValue(),
                    Duration.between(s.registeredAt, Instant.now()).toMillis(), n.isSuccess());
        }
        try {
            s.callback.accept(n);
        } catch (RuntimeException e) {
            log.warn("Subscription callback failed. signature={} subscriptionId={}", abbreviate(s.signature), s.id, e);
        }
    }

    private void sendLateUnsubscribe(long subscriptionId) {
        try {
            connection.send(codec.unsubscribeRequest(nextRequestId.getAndIncrement(), subscriptionId));
            log.info("Late subscribe ack, unsubscribed. subscriptionId={}", subscriptionId);
        } catch (PushChannelException e) {
            log.debug("Late unsubscribe failed. subscriptionId={} err={}", subscriptionId, e.getMessage());
        }
    }

    private boolean removePending(long requestId) {
        mutationLock.lock();
        try {
            return pendingAcks.remove(requestId) != null;
        } finally {
            mutationLock.unlock();
        }
    }

    static String abbreviate(String signature) {
        return signature.length() <= 12 ? signature : signature.substring(0, 8) + "...";
    }

    private static final class PendingAck {
        final long requestId;
        final String signature;
        final Commitment commitment;
        final Consumer<SignatureNotification> callback;
        final CompletableFuture<SubscribeOutcome> ack = new CompletableFuture<>();

        PendingAck(long requestId, String signature, Commitment commitment, Consumer<SignatureNotification> callback) {
            this.requestId = requestId;
            this.signature = signature;
            this.commitment = commitment;
            this.callback = callback;
        }
    }

    private static final class Subscription {
        final long id;
        final String signature;
        final Commitment commitment;
        final Instant registeredAt = Instant.now();
        final Consumer<SignatureNotification> callback;

        Subscription(long id, String signature, Commitment commitment, Consumer<SignatureNotification> callback) {
            this.id = id;
            this.signature = signature;
            this.commitment = commitment;
            this.callback = callback;
        }
    }
}
