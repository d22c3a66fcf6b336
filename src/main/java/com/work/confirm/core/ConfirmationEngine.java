package com.work.confirm.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.confirm.core.channel.ChannelEndpointResolver;
import com.work.confirm.core.channel.ConnectionState;
import com.work.confirm.core.channel.PushChannelConnection;
import com.work.confirm.core.channel.PushTransport;
import com.work.confirm.core.config.ConfirmConfig;
import com.work.confirm.core.config.PushChannelConfig;
import com.work.confirm.core.degrade.PushCircuitBreaker;
import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.ConfirmationPath;
import com.work.confirm.core.model.ConfirmationResult;
import com.work.confirm.core.model.SignatureNotification;
import com.work.confirm.core.polling.PollingFallback;
import com.work.confirm.core.polling.PollingResult;
import com.work.confirm.core.record.ConfirmationRecord;
import com.work.confirm.core.record.ConfirmationRecordRepository;
import com.work.confirm.core.subscription.PushFailureKind;
import com.work.confirm.core.subscription.SignatureSubscriber;
import com.work.confirm.core.subscription.SignatureWireCodec;
import com.work.confirm.core.subscription.SubscribeOutcome;
import com.work.confirm.core.subscription.SubscriptionRegistry;
import com.work.confirm.core.support.metrics.ConfirmMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;
import static com.work.confirm.core.support.ValidationUtils.requirePositive;
import static com.work.confirm.core.support.ValidationUtils.requireValidSignature;

/**
 * 交易确认引擎：所有提交交易的操作在拿到签名后都调用 {@link #confirm}。
 *
 * <pre>
 * Start -> AwaitingPush -> (通知到达) Confirmed / Failed
 *                       -> (订阅失败/传输异常) Fallback
 *                       -> (超时) 退订 -> Fallback
 * Start -> (push 不可用/已降级) Fallback
 * Fallback -> polling 结果：Confirmed / Failed / TimedOut / TransportError
 * </pre>
 *
 * push 只是延迟优化：任何 push 失败都有定义好的兜底，confirm 本身从不抛异常，
 * 也不会在调用方给定的 push 超时之外无限等待（polling 是有界次数的同步查询）。
 */
public class ConfirmationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationEngine.class);

    private final ConfirmConfig config;
    private final Duration subscribeAckTimeout;
    private final SignatureSubscriber subscriber;
    private final PushChannelConnection connection;
    private final PollingFallback pollingFallback;
    private final ConfirmationRecordRepository records;
    private final ConfirmMetrics metrics;
    private final PushCircuitBreaker breaker;
    private final ThreadPoolExecutor asyncExecutor;

    /**
     * @param subscriber      null 表示不走 push
     * @param connection      subscriber 底层的连接，close 时断开；可为 null
     * @param pollingFallback null 表示不启用 polling 兜底
     */
    public ConfirmationEngine(ConfirmConfig config,
                              Duration subscribeAckTimeout,
                              SignatureSubscriber subscriber,
                              PushChannelConnection connection,
                              PollingFallback pollingFallback,
                              ConfirmationRecordRepository records,
                              ConfirmMetrics metrics) {
        this.config = requireNonNull(config, "config");
        this.subscribeAckTimeout = requirePositive(subscribeAckTimeout, "subscribeAckTimeout");
        this.subscriber = subscriber;
        this.connection = connection;
        this.pollingFallback = pollingFallback;
        this.records = requireNonNull(records, "records");
        this.metrics = requireNonNull(metrics, "metrics");
        if (subscriber == null && pollingFallback == null) {
            throw new IllegalArgumentException("push 与 polling 至少需要启用一条确认路径");
        }
        this.breaker = new PushCircuitBreaker(config.getDegradeFailThreshold(), config.getDegradeOpenDuration());

        AtomicInteger threadSeq = new AtomicInteger(0);
        this.asyncExecutor = new ThreadPoolExecutor(
                config.getAsyncWorkers(), config.getAsyncWorkers(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "confirm-worker-" + threadSeq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        this.asyncExecutor.allowCoreThreadTimeOut(true);
    }

    /**
     * 按节点端点装配完整引擎：端点可推导出 push 地址且启用 push 时创建连接与订阅表（连接懒建立）。
     */
    public static ConfirmationEngine create(ConfirmConfig config,
                                            PushChannelConfig pushConfig,
                                            String rpcUrl,
                                            String explicitPushUrl,
                                            ChannelEndpointResolver resolver,
                                            Supplier<PushTransport> transportFactory,
                                            ObjectMapper objectMapper,
                                            PollingFallback pollingFallback,
                                            ConfirmationRecordRepository records,
                                            ConfirmMetrics metrics) {
        PushChannelConnection connection = null;
        SubscriptionRegistry registry = null;
        if (config.isPushEnabled()) {
            String source = (explicitPushUrl == null || explicitPushUrl.trim().isEmpty()) ? rpcUrl : explicitPushUrl;
            Optional<URI> endpoint = resolver.resolve(source);
            if (endpoint.isPresent()) {
                connection = new PushChannelConnection(endpoint.get(), transportFactory, pushConfig);
                registry = new SubscriptionRegistry(connection, new SignatureWireCodec(objectMapper));
            } else {
                log.warn("Push endpoint not derivable, confirmations will use polling only. rpcUrl={}", rpcUrl);
            }
        }
        return new ConfirmationEngine(config, pushConfig.getSubscribeAckTimeout(), registry, connection,
                pollingFallback, records, metrics);
    }

    public ConfirmationResult confirm(String signature) {
        return confirm(signature, config.getDefaultCommitment(), config.getDefaultTimeout());
    }

    public ConfirmationResult confirm(String signature, Commitment commitment, long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds 必须大于0");
        }
        return confirm(signature, commitment, Duration.ofSeconds(timeoutSeconds));
    }

    /**
     * 等待签名达到 commitment。可并发、可重复调用，不修改任何链上/链下状态（审计记录除外）。
     *
     * @param timeout 仅约束 push 等待；超时后进入 polling，polling 按自身界限完成
     * @return 恰好一个终态，从不抛出传输相关异常
     */
    public ConfirmationResult confirm(String signature, Commitment commitment, Duration timeout) {
        requireValidSignature(signature);
        requireNonNull(commitment, "commitment");
        requirePositive(timeout, "timeout");

        long startNanos = System.nanoTime();
        ConfirmationResult result;
        try {
            result = doConfirm(signature, commitment, timeout, startNanos);
        } catch (RuntimeException e) {
            log.warn("Confirmation aborted by unexpected error. signature={}", signature, e);
            result = ConfirmationResult.transportError(signature, ConfirmationPath.NONE,
                    "unexpected error: " + e.getMessage(), elapsedSince(startNanos));
        }

        metrics.result(result.getStatus().name());
        record(result, commitment);
        if (result.getStatus().isDecisive()) {
            log.info("Confirmation finished. signature={} status={} path={} elapsedMs={}",
                    signature, result.getStatus(), result.getPath(), result.getElapsed().toMillis());
        } else {
            log.warn("Confirmation not reached. signature={} status={} path={} elapsedMs={} detail={}",
                    signature, result.getStatus(), result.getPath(), result.getElapsed().toMillis(), result.getDetail());
        }
        return result;
    }

    /**
     * 在引擎自有的有界线程池上执行 {@link #confirm}。
     */
    public CompletableFuture<ConfirmationResult> confirmAsync(String signature, Commitment commitment, Duration timeout) {
        requireValidSignature(signature);
        requireNonNull(commitment, "commitment");
        requirePositive(timeout, "timeout");
        return CompletableFuture.supplyAsync(() -> confirm(signature, commitment, timeout), asyncExecutor);
    }

    public ConfirmConfig getConfig() {
        return config;
    }

    public boolean isPushAvailable() {
        return subscriber != null && config.isPushEnabled();
    }

    public boolean isPushDegraded() {
        return breaker.isOpen();
    }

    public ConnectionState getConnectionState() {
        return connection == null ? ConnectionState.DISCONNECTED : connection.getState();
    }

    public int getPendingSubscriptions() {
        return subscriber == null ? 0 : subscriber.pendingCount();
    }

    @Override
    public void close() {
        asyncExecutor.shutdownNow();
        if (connection != null) {
            connection.close();
        }
    }

    private ConfirmationResult doConfirm(String signature, Commitment commitment, Duration timeout, long startNanos) {
        PushFailureKind failure;
        String reason;
        if (!isPushAvailable()) {
            metrics.pushOutcome("skipped");
            failure = PushFailureKind.CONNECTION_ERROR;
            reason = "push unavailable";
        } else if (!breaker.allowPush()) {
            metrics.pushOutcome("skipped");
            failure = PushFailureKind.CONNECTION_ERROR;
            reason = "push degraded";
        } else {
            PushAttempt attempt = awaitPush(signature, commitment, startNanos + timeout.toNanos(), startNanos);
            if (attempt.result != null) {
                return attempt.result;
            }
            failure = attempt.failure;
            reason = attempt.reason;
        }
        return fallback(signature, commitment, failure, reason, startNanos);
    }

    private PushAttempt awaitPush(String signature, Commitment commitment, long deadlineNanos, long startNanos) {
        CompletableFuture<SignatureNotification> slot = new CompletableFuture<>();
        Duration ackTimeout = min(subscribeAckTimeout, remaining(deadlineNanos));

        SubscribeOutcome outcome;
        try {
            outcome = subscriber.subscribe(signature, commitment, slot::complete, ackTimeout);
        } catch (RuntimeException e) {
            onPushFailure();
            metrics.pushOutcome("transport_error");
            log.warn("Push subscribe raised, falling back to polling. signature={} err={}", signature, e.getMessage());
            return PushAttempt.fallback(PushFailureKind.TRANSPORT_ERROR, "subscribe raised: " + e.getMessage());
        }
        if (!outcome.isSubscribed()) {
            onPushFailure();
            metrics.pushOutcome("subscribe_failed");
            log.warn("Push subscribe failed, falling back to polling. signature={} kind={} reason={}",
                    signature, outcome.getFailureKind(), outcome.getReason());
            return PushAttempt.fallback(outcome.getFailureKind(), outcome.getReason());
        }

        long subscriptionId = outcome.getSubscriptionId().get();
        try {
            long waitNanos = Math.max(0L, deadlineNanos - System.nanoTime());
            SignatureNotification n = slot.get(waitNanos, TimeUnit.NANOSECONDS);
            breaker.recordSuccess();
            metrics.pushOutcome("delivered");
            if (n.isSuccess()) {
                return PushAttempt.done(ConfirmationResult.confirmed(signature, ConfirmationPath.PUSH, elapsedSince(startNanos)));
            }
            return PushAttempt.done(ConfirmationResult.failed(signature, ConfirmationPath.PUSH,
                    n.getErr().toString(), elapsedSince(startNanos)));
        } catch (TimeoutException e) {
            metrics.pushOutcome("notification_timeout");
            log.info("Push notification timeout, falling back to polling. signature={} subscriptionId={}", signature, subscriptionId);
            return PushAttempt.fallback(PushFailureKind.NOTIFICATION_TIMEOUT, "no notification before deadline");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.pushOutcome("transport_error");
            return PushAttempt.fallback(PushFailureKind.TRANSPORT_ERROR, "interrupted while awaiting notification");
        } catch (ExecutionException e) {
            onPushFailure();
            metrics.pushOutcome("transport_error");
            return PushAttempt.fallback(PushFailureKind.TRANSPORT_ERROR, String.valueOf(e.getCause()));
        } finally {
            // 已收到通知时订阅已由节点取消，这里只清理超时或异常留下的订阅
            unsubscribeQuietly(subscriptionId);
        }
    }

    private ConfirmationResult fallback(String signature, Commitment commitment, PushFailureKind failure,
                                        String reason, long startNanos) {
        if (pollingFallback == null) {
            return pushOnlyResult(signature, failure, reason, startNanos);
        }
        metrics.fallback(failure.name().toLowerCase(Locale.ROOT));

        PollingResult polled;
        try {
            polled = pollingFallback.poll(signature, commitment);
        } catch (RuntimeException e) {
            return ConfirmationResult.transportError(signature, ConfirmationPath.POLLING,
                    "polling error: " + e.getMessage(), elapsedSince(startNanos));
        }
        switch (polled.getOutcome()) {
            case CONFIRMED:
                return ConfirmationResult.confirmed(signature, ConfirmationPath.POLLING, elapsedSince(startNanos));
            case FAILED:
                return ConfirmationResult.failed(signature, ConfirmationPath.POLLING, polled.getDetail(), elapsedSince(startNanos));
            case NOT_REACHED:
                return ConfirmationResult.timedOut(signature, ConfirmationPath.POLLING,
                        "push: " + reason + "; polling: not reached after " + polled.getAttempts() + " attempts",
                        elapsedSince(startNanos));
            default:
                return ConfirmationResult.transportError(signature, ConfirmationPath.POLLING,
                        "polling error: " + polled.getDetail(), elapsedSince(startNanos));
        }
    }

    private ConfirmationResult pushOnlyResult(String signature, PushFailureKind failure, String reason, long startNanos) {
        Duration elapsed = elapsedSince(startNanos);
        switch (failure) {
            case NOTIFICATION_TIMEOUT:
                return ConfirmationResult.timedOut(signature, ConfirmationPath.PUSH, reason, elapsed);
            case SUBSCRIBE_TIMEOUT:
            case SUBSCRIBE_REJECTED:
                return ConfirmationResult.subscribeFailed(signature, reason, elapsed);
            default:
                return ConfirmationResult.transportError(signature, ConfirmationPath.PUSH, reason, elapsed);
        }
    }

    private void onPushFailure() {
        if (breaker.recordFailure()) {
            metrics.breakerOpened();
            log.warn("Push channel degraded, polling only for {}", config.getDegradeOpenDuration());
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void unsubscribeQuietly(long subscriptionId) {
        try {
            subscriber.unsubscribe(subscriptionId);
        } catch (RuntimeException e) {
            log.debug("Unsubscribe failed. subscriptionId={} err={}", subscriptionId, e.getMessage());
        }
    }

    private void record(ConfirmationResult result, Commitment commitment) {
        try {
            records.save(ConfirmationRecord.of(result, commitment, Instant.now()));
        } catch (RuntimeException e) {
            log.warn("Confirmation record write failed. signature={} status={} err={}",
                    result.getSignature(), result.getStatus(), e.getMessage());
        }
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static final class PushAttempt {
        final ConfirmationResult result;
        final PushFailureKind failure;
        final String reason;

        private PushAttempt(ConfirmationResult result, PushFailureKind failure, String reason) {
            this.result = result;
            this.failure = failure;
            this.reason = reason;
        }

        static PushAttempt done(ConfirmationResult result) {
            return new PushAttempt(result, null, null);
        }

        static PushAttempt fallback(PushFailureKind failure, String reason) {
            return new PushAttempt(null, failure, reason);
        }
    }
}
