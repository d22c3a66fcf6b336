package com.work.confirm.core.model;

import java.time.Duration;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;

/**
 * confirm 的标签化终态。
 *
 * detail 只用于审计日志：FAILED 时为链上错误 JSON，其他非成功状态为原因描述。
 */
public class ConfirmationResult {

    private final String signature;
    private final ConfirmationStatus status;
    private final ConfirmationPath path;
    private final String detail;
    private final Duration elapsed;

    private ConfirmationResult(String signature, ConfirmationStatus status, ConfirmationPath path,
                               String detail, Duration elapsed) {
        this.signature = signature;
        this.status = requireNonNull(status, "status");
        this.path = requireNonNull(path, "path");
        this.detail = detail;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static ConfirmationResult confirmed(String signature, ConfirmationPath path, Duration elapsed) {
        return new ConfirmationResult(signature, ConfirmationStatus.CONFIRMED, path, null, elapsed);
    }

    public static ConfirmationResult failed(String signature, ConfirmationPath path, String onChainError, Duration elapsed) {
        return new ConfirmationResult(signature, ConfirmationStatus.FAILED, path, onChainError, elapsed);
    }

    public static ConfirmationResult timedOut(String signature, ConfirmationPath path, String reason, Duration elapsed) {
        return new ConfirmationResult(signature, ConfirmationStatus.TIMED_OUT, path, reason, elapsed);
    }

    public static ConfirmationResult subscribeFailed(String signature, String reason, Duration elapsed) {
        return new ConfirmationResult(signature, ConfirmationStatus.SUBSCRIBE_FAILED, ConfirmationPath.PUSH, reason, elapsed);
    }

    public static ConfirmationResult transportError(String signature, ConfirmationPath path, String reason, Duration elapsed) {
        return new ConfirmationResult(signature, ConfirmationStatus.TRANSPORT_ERROR, path, reason, elapsed);
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

    public String getDetail() {
        return detail;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isConfirmed() {
        return status == ConfirmationStatus.CONFIRMED;
    }

    @Override
    public String toString() {
        return "ConfirmationResult{signature=" + signature + ", status=" + status + ", path=" + path
                + ", detail=" + detail + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
