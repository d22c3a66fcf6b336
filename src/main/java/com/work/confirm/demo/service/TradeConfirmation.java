package com.work.confirm.demo.service;

import com.work.confirm.core.model.ConfirmationPath;
import com.work.confirm.core.model.ConfirmationStatus;

/**
 * 面向用户的确认结论。summary 可直接展示；detail 仅用于排查，不要透出给终端用户。
 */
public class TradeConfirmation {

    private final String signature;
    private final ConfirmationStatus status;
    private final ConfirmationPath path;
    private final String summary;
    private final String detail;
    private final long elapsedMillis;

    public TradeConfirmation(String signature, ConfirmationStatus status, ConfirmationPath path,
                             String summary, String detail, long elapsedMillis) {
        this.signature = signature;
        this.status = status;
        this.path = path;
        this.summary = summary;
        this.detail = detail;
        this.elapsedMillis = elapsedMillis;
    }

    public String getSignature() {
        return signature;
    }

    public ConfirmationStatus getStatus() {
        return status;
    }

    public ConfirmationPath getPath() {
        return path;
    }

    public String getSummary() {
        return summary;
    }

    public String getDetail() {
        return detail;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public boolean isConfirmed() {
        return status == ConfirmationStatus.CONFIRMED;
    }
}
