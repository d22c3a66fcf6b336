package com.work.confirm.core.channel;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * 一条双向文本帧连接的最小端口。每个实例只连接一次，断开后由通道重新创建。
 */
public interface PushTransport {

    /**
     * 建立连接，阻塞直到握手完成或超时。
     *
     * @throws IOException DNS/TLS/拒绝连接/超时等失败
     */
    void connect(URI uri, Duration timeout, PushTransportListener listener) throws IOException;

    /**
     * 发送一帧文本。调用方负责串行化。
     */
    void send(String frame) throws IOException;

    /**
     * 存活探测（ping/pong），在 timeout 内收到回应返回 true。
     */
    boolean probe(Duration timeout);

    boolean isOpen();

    /**
     * 尽力优雅关闭。
     */
    void close(Duration timeout) throws IOException;
}
