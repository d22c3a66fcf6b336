package com.work.confirm.core.chain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * getSignatureStatuses 中单个签名的状态。
 */
public class SignatureStatus {

    private final long slot;
    private final Long confirmations;
    private final JsonNode err;
    private final String confirmationStatus;

    public SignatureStatus(long slot, Long confirmations, JsonNode err, String confirmationStatus) {
        this.slot = slot;
        this.confirmations = confirmations;
        this.err = (err == null || err.isNull() || err.isMissingNode()) ? null : err;
        this.confirmationStatus = confirmationStatus;
    }

    public long getSlot() {
        return slot;
    }

    /**
     * 距离提交已过的区块数；null 表示已被 root（最终确定）。
     */
    public Long getConfirmations() {
        return confirmations;
    }

    public JsonNode getErr() {
        return err;
    }

    public boolean hasError() {
        return err != null && !err.isNull();
    }

    /**
     * 节点上报的确认等级。老版本节点不返回该字段时，confirmations 为 null 即视为 finalized。
     */
    public String getEffectiveConfirmationStatus() {
        if (confirmationStatus != null) {
            return confirmationStatus;
        }
        return confirmations == null ? "finalized" : "processed";
    }
}
