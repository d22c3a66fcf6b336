package com.work.confirm.core.exception;

/**
 * 组件内部的统⼀异常类型，便于业务侧捕获或转换为 RPC 错误码。
 */
public class ConfirmException extends RuntimeException {

    public ConfirmException(String message) {
        super(message);
    }

    public ConfirmException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（节点抖动、连接断开等）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
