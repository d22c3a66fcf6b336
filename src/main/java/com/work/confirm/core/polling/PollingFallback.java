package com.work.confirm.core.polling;

import com.work.confirm.core.chain.SignatureStatus;
import com.work.confirm.core.chain.SolanaRpcClient;
import com.work.confirm.core.config.PollingConfig;
import com.work.confirm.core.model.Commitment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static com.work.confirm.core.support.ValidationUtils.requireNonEmpty;
import static com.work.confirm.core.support.ValidationUtils.requireNonNull;

/**
 * polling 兜底：有界次数的同步查询，直到签名达到请求的确认等级。
 *
 * 不依赖 push 通道；节点错误在此边界内被吞掉并转换为结果，不向上抛。
 */
public class PollingFallback {

    private static final Logger log = LoggerFactory.getLogger(PollingFallback.class);

    private final SolanaRpcClient rpcClient;
    private final PollingConfig config;

    public PollingFallback(SolanaRpcClient rpcClient, PollingConfig config) {
        this.rpcClient = requireNonNull(rpcClient, "rpcClient");
        this.config = requireNonNull(config, "config");
    }

    public PollingResult poll(String signature, Commitment commitment) {
        requireNonEmpty(signature, "signature");
        requireNonNull(commitment, "commitment");

        int max = config.getMaxAttempts();
        String lastError = null;
        for (int attempt = 1; attempt <= max; attempt++) {
            try {
                Optional<SignatureStatus> statusOpt = rpcClient.getSignatureStatus(signature);
                lastError = null;
                if (statusOpt.isPresent()) {
                    SignatureStatus status = statusOpt.get();
                    if (status.hasError()) {
                        return PollingResult.failed(status.getErr().toString(), attempt);
                    }
                    if (commitment.isReachedBy(status.getEffectiveConfirmationStatus())) {
                        return PollingResult.confirmed(attempt);
                    }
                }
            } catch (RuntimeException e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.debug("Signature status query failed. signature={} attempt={} err={}", signature, attempt, lastError);
            }
            if (attempt < max && !pause()) {
                return PollingResult.error("interrupted", attempt);
            }
        }
        if (lastError != null) {
            log.warn("Polling confirmation ended with error. signature={} attempts={} err={}", signature, max, lastError);
            return PollingResult.error(lastError, max);
        }
        return PollingResult.notReached(max);
    }

    /**
     * 布尔视图：只有 CONFIRMED 返回 true。
     */
    public boolean confirmViaPolling(String signature, Commitment commitment) {
        return poll(signature, commitment).getOutcome() == PollingResult.Outcome.CONFIRMED;
    }

    private boolean pause() {
        long ms = config.getInterval().toMillis();
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
