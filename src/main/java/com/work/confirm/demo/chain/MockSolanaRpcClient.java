package com.work.confirm.demo.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.confirm.core.chain.SignatureStatus;
import com.work.confirm.core.chain.SolanaRpcClient;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版节点客户端，仅用于 demo，真实项目请使用 Web3jSolanaRpcClient 或业务自己的实现。
 *
 * 签名第一次被查询（或被 {@link #markSubmitted}）时开始计时：
 * confirmDelay 后报告 confirmed，finalizeDelay 后报告 finalized。
 */
public class MockSolanaRpcClient implements SolanaRpcClient {

    private final Map<String, TrackedSignature> tracked = new ConcurrentHashMap<>();
    private final AtomicLong slot = new AtomicLong(250_000_000L);
    private final Duration confirmDelay;
    private final Duration finalizeDelay;

    public MockSolanaRpcClient() {
        this(Duration.ofSeconds(2), Duration.ofSeconds(6));
    }

    public MockSolanaRpcClient(Duration confirmDelay, Duration finalizeDelay) {
        this.confirmDelay = confirmDelay;
        this.finalizeDelay = finalizeDelay;
    }

    private static class TrackedSignature {
        final Instant submittedAt;
        final long slot;
        volatile JsonNode err;

        TrackedSignature(Instant submittedAt, long slot) {
            this.submittedAt = submittedAt;
            this.slot = slot;
        }
    }

    public void markSubmitted(String signature) {
        tracked.computeIfAbsent(signature, s -> new TrackedSignature(Instant.now(), slot.incrementAndGet()));
    }

    /**
     * demo：让某个签名以链上错误落块。
     */
    public void markFailed(String signature, JsonNode err) {
        markSubmitted(signature);
        tracked.get(signature).err = err;
    }

    @Override
    public Optional<SignatureStatus> getSignatureStatus(String signature) {
        TrackedSignature t = tracked.computeIfAbsent(signature, s -> new TrackedSignature(Instant.now(), slot.incrementAndGet()));
        Instant now = Instant.now();
        if (now.isBefore(t.submittedAt.plus(confirmDelay))) {
            // 节点尚未看到该交易
            return Optional.empty();
        }
        if (now.isBefore(t.submittedAt.plus(finalizeDelay))) {
            return Optional.of(new SignatureStatus(t.slot, 1L, t.err, "confirmed"));
        }
        return Optional.of(new SignatureStatus(t.slot, null, t.err, "finalized"));
    }
}
