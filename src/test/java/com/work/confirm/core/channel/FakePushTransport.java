package com.work.confirm.core.channel;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 内存版 push 传输：记录发出的帧，由测试手动注入入站帧。
 */
public class FakePushTransport implements PushTransport {

    public final List<String> sent = new CopyOnWriteArrayList<>();

    public volatile boolean refuseConnect;
    public volatile boolean failSend;
    public volatile boolean failClose;
    public volatile boolean probeResult = true;
    public volatile int closeCount;

    /**
     * 每次 send 成功后回调，可用于模拟节点应答。
     */
    public volatile Consumer<String> onSend;

    private volatile PushTransportListener listener;
    private volatile boolean open;

    @Override
    public void connect(URI uri, Duration timeout, PushTransportListener listener) throws IOException {
        if (refuseConnect) {
            throw new IOException("connection refused");
        }
        this.listener = listener;
        this.open = true;
    }

    @Override
    public void send(String frame) throws IOException {
        if (failSend) {
            throw new IOException("broken pipe");
        }
        sent.add(frame);
        Consumer<String> hook = onSend;
        if (hook != null) {
            hook.accept(frame);
        }
    }

    @Override
    public boolean probe(Duration timeout) {
        return open && probeResult;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close(Duration timeout) throws IOException {
        closeCount++;
        open = false;
        if (failClose) {
            throw new IOException("close failed");
        }
    }

    public void push(String frame) {
        listener.onFrame(frame);
    }

    public void dropByPeer(String reason) {
        open = false;
        listener.onClosed(reason);
    }
}
