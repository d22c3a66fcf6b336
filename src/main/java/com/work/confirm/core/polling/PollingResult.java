package com.work.confirm.core.polling;

/**
 * polling 兜底的结果。
 */
public class PollingResult {

    public enum Outcome {
        /** 达到请求的确认等级且无链上错误。 */
        CONFIRMED,
        /** 节点报告交易执行失败。 */
        FAILED,
        /** 次数用尽仍未达到确认等级。 */
        NOT_REACHED,
        /** 最后一次查询出错（或等待被中断）。 */
        ERROR
    }

    private final Outcome outcome;
    private final String detail;
    private final int attempts;

    private PollingResult(Outcome outcome, String detail, int attempts) {
        this.outcome = outcome;
        this.detail = detail;
        this.attempts = attempts;
    }

    public static PollingResult confirmed(int attempts) {
        return new PollingResult(Outcome.CONFIRMED, null, attempts);
    }

    public static PollingResult failed(String onChainError, int attempts) {
        return new PollingResult(Outcome.FAILED, onChainError, attempts);
    }

    public static PollingResult notReached(int attempts) {
        return new PollingResult(Outcome.NOT_REACHED, null, attempts);
    }

    public static PollingResult error(String reason, int attempts) {
        return new PollingResult(Outcome.ERROR, reason, attempts);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * FAILED 时为链上错误 JSON，ERROR 时为错误描述。
     */
    public String getDetail() {
        return detail;
    }

    public int getAttempts() {
        return attempts;
    }
}
