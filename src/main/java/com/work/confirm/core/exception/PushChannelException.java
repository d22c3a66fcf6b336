package com.work.confirm.core.exception;

/**
 * push 通道发送失败（未连接、连接已断开、写入异常）。只在通道与订阅表之间传递，不会越过确认引擎。
 */
public class PushChannelException extends ConfirmException {

    public PushChannelException(String message) {
        super(message);
    }

    public PushChannelException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
