package com.work.confirm.core.exception;

/**
 * 节点 RPC 调用失败：HTTP 传输错误或 JSON-RPC error 响应。
 */
public class RpcCallException extends ConfirmException {

    private final Integer rpcCode;

    public RpcCallException(String message, Throwable cause) {
        super(message, cause);
        this.rpcCode = null;
    }

    public RpcCallException(String message, int rpcCode) {
        super(message);
        this.rpcCode = rpcCode;
    }

    /**
     * JSON-RPC error.code；传输层失败时为 null。
     */
    public Integer getRpcCode() {
        return rpcCode;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
