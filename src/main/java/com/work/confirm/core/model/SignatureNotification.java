package com.work.confirm.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * signatureNotification 推送中 result.value 的最小表达：只关心 err 与所在 slot。
 */
public class SignatureNotification {

    private final long subscriptionId;
    private final Long slot;
    private final JsonNode err;

    public SignatureNotification(long subscriptionId, Long slot, JsonNode err) {
        this.subscriptionId = subscriptionId;
        this.slot = slot;
        this.err = err;
    }

    public long getSubscriptionId() {
        return subscriptionId;
    }

    public Long getSlot() {
        return slot;
    }

    /**
     * 链上错误；无错误时为 null。
     */
    public JsonNode getErr() {
        return err;
    }

    public boolean isSuccess() {
        return err == null || err.isNull() || err.isMissingNode();
    }
}
