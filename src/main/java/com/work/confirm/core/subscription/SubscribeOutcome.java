package com.work.confirm.core.subscription;

import java.util.Optional;

/**
 * 订阅请求的显式结果：成功时携带节点分配的订阅 id，失败时携带分类与原因。
 */
public class SubscribeOutcome {

    private final Long subscriptionId;
    private final PushFailureKind failureKind;
    private final String reason;

    private SubscribeOutcome(Long subscriptionId, PushFailureKind failureKind, String reason) {
        this.subscriptionId = subscriptionId;
        this.failureKind = failureKind;
        this.reason = reason;
    }

    public static SubscribeOutcome subscribed(long subscriptionId) {
        return new SubscribeOutcome(subscriptionId, null, null);
    }

    public static SubscribeOutcome failure(PushFailureKind kind, String reason) {
        return new SubscribeOutcome(null, kind, reason);
    }

    public boolean isSubscribed() {
        return subscriptionId != null;
    }

    public Optional<Long> getSubscriptionId() {
        return Optional.ofNullable(subscriptionId);
    }

    public PushFailureKind getFailureKind() {
        return failureKind;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isSubscribed() ? "subscribed(" + subscriptionId + ")" : failureKind + "(" + reason + ")";
    }
}
