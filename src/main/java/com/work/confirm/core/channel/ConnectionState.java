package com.work.confirm.core.channel;

/**
 * push 通道连接状态。
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING
}
