package com.work.confirm.core.channel;

/**
 * 传输层回调，由底层 IO 线程调用，实现方不得阻塞。
 */
public interface PushTransportListener {

    void onFrame(String frame);

    void onClosed(String reason);

    void onError(Exception error);
}
