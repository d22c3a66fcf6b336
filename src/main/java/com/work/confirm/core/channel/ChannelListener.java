package com.work.confirm.core.channel;

/**
 * 通道向上层（订阅表）投递的事件。onFrame 只会在唯一的 dispatch 线程上被调用。
 */
public interface ChannelListener {

    void onFrame(String frame);

    /**
     * 连接失效（读循环退出、心跳失败、对端关闭或主动断开）。
     */
    void onDisconnected(String reason);
}
