package com.work.confirm.core.record;

import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.ConfirmationPath;
import com.work.confirm.core.model.ConfirmationResult;
import com.work.confirm.core.model.ConfirmationStatus;

import java.time.Instant;

/**
 * 一次 confirm 终态的审计记录。
 */
public class ConfirmationRecord {

    private final Long seq;
    private final String signature;
    private final Commitment commitment;
    private final ConfirmationStatus status;
    private final ConfirmationPath path;
    private final String detail;
    private final long elapsedMillis;
    private final Instant completedAt;

    public ConfirmationRecord(Long seq, String signature, Commitment commitment, ConfirmationStatus status,
                              ConfirmationPath path, String detail, long elapsedMillis, Instant completedAt) {
        this.seq = seq;
        this.signature = signature;
        this.commitment = commitment;
        this.status = status;
        this.path = path;
        this.detail = detail;
        this.elapsedMillis = elapsedMillis;
        this.completedAt = completedAt;
    }

    public static ConfirmationRecord of(ConfirmationResult result, Commitment commitment, Instant completedAt) {
        return new ConfirmationRecord(null, result.getSignature(), commitment, result.getStatus(), result.getPath(),
                result.getDetail(), result.getElapsed().toMillis(), completedAt);
    }

    public ConfirmationRecord withSeq(long seq) {
        return new ConfirmationRecord(seq, signature, commitment, status, path, detail, elapsedMillis, completedAt);
    }

    /**
     * 存储分配的序号，未落库时为 null。
     */
    public Long getSeq() {
        return seq;
    }

    public String getSignature() {
        return signature;
    }

    public Commitment getCommitment() {
        return commitment;
    }

    public ConfirmationStatus getStatus() {
        return status;
    }

    public ConfirmationPath getPath() {
        return path;
    }

    public String getDetail() {
        return detail;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
