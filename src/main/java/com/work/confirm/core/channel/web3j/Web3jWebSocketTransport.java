package com.work.confirm.core.channel.web3j;

import com.work.confirm.core.channel.PushTransport;
import com.work.confirm.core.channel.PushTransportListener;
import org.java_websocket.WebSocket;
import org.java_websocket.framing.Framedata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.websocket.WebSocketClient;
import org.web3j.protocol.websocket.WebSocketListener;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 基于 web3j WebSocketClient（底层 Java-WebSocket）的 push 传输实现。
 *
 * 说明：
 * - web3j 自带的 WebSocketService 面向 EVM 订阅模型，这里只借用它的客户端，帧的编解码由订阅表负责
 * - 关闭 Java-WebSocket 自身的 lost-connection 检测，存活由通道的心跳/空闲探测统一负责
 */
public class Web3jWebSocketTransport implements PushTransport {

    private static final Logger log = LoggerFactory.getLogger(Web3jWebSocketTransport.class);

    private volatile ProbingWebSocketClient client;

    @Override
    public void connect(URI uri, Duration timeout, PushTransportListener listener) throws IOException {
        if (client != null) {
            throw new IllegalStateException("transport 只能连接一次");
        }
        ProbingWebSocketClient c = new ProbingWebSocketClient(uri, listener);
        c.setConnectionLostTimeout(0);
        c.setListener(new ForwardingListener(listener));
        client = c;
        boolean opened;
        try {
            opened = c.connectBlocking(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while connecting to " + uri.getHost(), e);
        }
        if (!opened) {
            throw new IOException("websocket handshake failed or timed out, host=" + uri.getHost());
        }
    }

    @Override
    public void send(String frame) throws IOException {
        ProbingWebSocketClient c = client;
        if (c == null || !c.isOpen()) {
            throw new IOException("websocket not open");
        }
        try {
            c.send(frame);
        } catch (RuntimeException e) {
            // WebsocketNotConnectedException 等
            throw new IOException("websocket send failed", e);
        }
    }

    @Override
    public synchronized boolean probe(Duration timeout) {
        ProbingWebSocketClient c = client;
        if (c == null || !c.isOpen()) {
            return false;
        }
        CountDownLatch pong = new CountDownLatch(1);
        c.pongLatch = pong;
        try {
            c.sendPing();
            return pong.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            log.debug("Websocket ping failed. host={} err={}", c.getURI().getHost(), e.getMessage());
            return false;
        } finally {
            c.pongLatch = null;
        }
    }

    @Override
    public boolean isOpen() {
        ProbingWebSocketClient c = client;
        return c != null && c.isOpen();
    }

    @Override
    public void close(Duration timeout) throws IOException {
        ProbingWebSocketClient c = client;
        if (c == null || c.isClosed()) {
            return;
        }
        c.close();
        try {
            if (!c.closedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                // 对端不回 close 帧时直接断开 TCP
                c.closeConnection(1006, "close timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while closing websocket", e);
        }
    }

    /**
     * 补充 pong 检测与关闭原因，web3j 的 WebSocketListener 只有无参 onClose。
     */
    private static final class ProbingWebSocketClient extends WebSocketClient {

        private final PushTransportListener listener;
        private final CountDownLatch closedLatch = new CountDownLatch(1);
        private volatile CountDownLatch pongLatch;

        ProbingWebSocketClient(URI uri, PushTransportListener listener) {
            super(uri);
            this.listener = listener;
        }

        @Override
        public void onWebsocketPong(WebSocket conn, Framedata f) {
            CountDownLatch latch = pongLatch;
            if (latch != null) {
                latch.countDown();
            }
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            closedLatch.countDown();
            listener.onClosed("code=" + code + (reason == null || reason.isEmpty() ? "" : " " + reason)
                    + (remote ? " remote" : " local"));
        }
    }

    private static final class ForwardingListener implements WebSocketListener {

        private final PushTransportListener delegate;

        ForwardingListener(PushTransportListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onMessage(String message) {
            delegate.onFrame(message);
        }

        @Override
        public void onError(Exception e) {
            delegate.onError(e);
        }

        @Override
        public void onClose() {
            // 由 ProbingWebSocketClient.onClose 携带关闭码通知
        }
    }
}
