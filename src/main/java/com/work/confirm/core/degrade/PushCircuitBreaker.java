package com.work.confirm.core.degrade;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;
import static com.work.confirm.core.support.ValidationUtils.requirePositive;

/**
 * push 路径自动降级：
 * - 连续出现“建连失败/订阅失败/传输错误”达到阈值后，开启短暂熔断窗口
 * - 窗口内确认请求直接走 polling，窗口结束后重新尝试 push
 * - 一次成功投递清零失败计数
 *
 * 通知超时不计入失败：通道健康，只是交易迟迟未确认。
 */
public class PushCircuitBreaker {

    private final int failThreshold;
    private final Duration openDuration;
    private final LongSupplier clock;

    private final AtomicInteger consecutiveFails = new AtomicInteger(0);
    private final AtomicLong openUntilMillis = new AtomicLong(0L);

    public PushCircuitBreaker(int failThreshold, Duration openDuration) {
        this(failThreshold, openDuration, System::currentTimeMillis);
    }

    PushCircuitBreaker(int failThreshold, Duration openDuration, LongSupplier clock) {
        this.failThreshold = requirePositive(failThreshold, "failThreshold");
        this.openDuration = requirePositive(openDuration, "openDuration");
        this.clock = requireNonNull(clock, "clock");
    }

    public boolean allowPush() {
        return clock.getAsLong() >= openUntilMillis.get();
    }

    public boolean isOpen() {
        return !allowPush();
    }

    public void recordSuccess() {
        consecutiveFails.set(0);
    }

    /**
     * @return true 表示本次失败触发了熔断
     */
    public boolean recordFailure() {
        int fails = consecutiveFails.incrementAndGet();
        if (fails >= failThreshold) {
            openUntilMillis.set(clock.getAsLong() + openDuration.toMillis());
            consecutiveFails.set(0);
            return true;
        }
        return false;
    }

    public int getConsecutiveFails() {
        return consecutiveFails.get();
    }
}
