package com.work.confirm.core.model;

/**
 * 一次 confirm 调用的终态，每次调用恰好落入其中之一。
 */
public enum ConfirmationStatus {
    /** 交易已达到请求的确认等级且无链上错误。 */
    CONFIRMED,
    /** 节点报告交易执行失败（携带链上错误）。 */
    FAILED,
    /** push 与 polling 均未在各自界限内等到确认。 */
    TIMED_OUT,
    /** 订阅失败且未进入兜底（仅在兜底不可用时出现）。 */
    SUBSCRIBE_FAILED,
    /** 传输或 polling 错误。 */
    TRANSPORT_ERROR;

    /**
     * 是否是对交易本身的确定性结论（成功或链上失败）。
     */
    public boolean isDecisive() {
        return this == CONFIRMED || this == FAILED;
    }
}
