package com.work.confirm.core.channel;

import com.work.confirm.core.config.PushChannelConfig;
import com.work.confirm.core.exception.PushChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;

/**
 * push 通道连接：同一时刻至多一条存活连接。
 *
 * <ul>
 *     <li>ensureConnected 懒建连，已连接时立即返回 true；建连失败只返回 false，不抛异常</li>
 *     <li>每条连接一个 dispatch 线程（唯一读者），空闲超过 idleReadTimeout 发一次探测，探测失败即退出读循环</li>
 *     <li>后台心跳按 heartbeatInterval 探测，失败视为断开</li>
 *     <li>send 由写锁串行化，避免帧交错</li>
 *     <li>disconnect 对调用方总是成功：尽力关闭、吞掉关闭异常、清空句柄并通知上层清理订阅</li>
 * </ul>
 */
public class PushChannelConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PushChannelConnection.class);

    private static final Object END_OF_STREAM = new Object();

    private final URI endpoint;
    private final Supplier<PushTransport> transportFactory;
    private final PushChannelConfig config;

    private final ReentrantLock connectLock = new ReentrantLock();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicLong sessionSeq = new AtomicLong(0);
    private final ScheduledExecutorService keepAlive;

    private volatile Session session;
    private volatile ChannelListener listener;
    private volatile boolean closed;

    public PushChannelConnection(URI endpoint, Supplier<PushTransport> transportFactory, PushChannelConfig config) {
        this.endpoint = requireNonNull(endpoint, "endpoint");
        this.transportFactory = requireNonNull(transportFactory, "transportFactory");
        this.config = requireNonNull(config, "config");
        this.keepAlive = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "push-keepalive");
            t.setDaemon(true);
            return t;
        });
    }

    public void setListener(ChannelListener listener) {
        this.listener = listener;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        Session s = session;
        return s != null && s.isLive();
    }

    /**
     * 确保连接可用。廉价且幂等，可在每次订阅前调用。
     *
     * @return false 表示连接不可用（DNS/TLS/拒绝连接/超时或通道已关闭）
     */
    public boolean ensureConnected() {
        if (isConnected()) {
            return true;
        }
        connectLock.lock();
        try {
            if (isConnected()) {
                return true;
            }
            if (closed) {
                return false;
            }
            state.set(ConnectionState.CONNECTING);
            Session s = new Session(sessionSeq.incrementAndGet(), transportFactory.get());
            try {
                s.transport.connect(endpoint, config.getConnectTimeout(), s);
            } catch (IOException | RuntimeException e) {
                state.set(ConnectionState.DISCONNECTED);
                s.closeTransportQuietly();
                log.warn("Push channel connect failed. host={} err={}", endpoint.getHost(), e.getMessage());
                return false;
            }
            if (!s.transport.isOpen()) {
                state.set(ConnectionState.DISCONNECTED);
                s.closeTransportQuietly();
                log.warn("Push channel connect returned without an open transport. host={}", endpoint.getHost());
                return false;
            }
            session = s;
            state.set(ConnectionState.CONNECTED);
            s.start();
            log.info("Push channel connected. host={} session={}", endpoint.getHost(), s.id);
            return true;
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * 串行写一帧。
     *
     * @throws PushChannelException 未连接或写入失败（写入失败同时视为连接断开）
     */
    public void send(String frame) {
        Session s = session;
        if (s == null || !s.isLive()) {
            throw new PushChannelException("push channel not connected");
        }
        writeLock.lock();
        try {
            s.transport.send(frame);
        } catch (IOException | RuntimeException e) {
            s.end("send failed: " + e.getMessage());
            throw new PushChannelException("push channel send failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 主动断开。不会完成任何等待中的结果槽，等待方靠各自的超时退出。
     */
    public void disconnect() {
        Session s;
        connectLock.lock();
        try {
            s = session;
            if (s != null) {
                state.set(ConnectionState.CLOSING);
            }
        } finally {
            connectLock.unlock();
        }
        if (s != null) {
            s.end("disconnect requested");
            terminate(s, "disconnect requested");
        }
        state.set(ConnectionState.DISCONNECTED);
    }

    @Override
    public void close() {
        closed = true;
        disconnect();
        keepAlive.shutdownNow();
    }

    private void terminate(Session s, String reason) {
        if (!s.terminated.compareAndSet(false, true)) {
            return;
        }
        connectLock.lock();
        try {
            if (session == s) {
                session = null;
                state.set(ConnectionState.DISCONNECTED);
            }
        } finally {
            connectLock.unlock();
        }
        s.cancelHeartbeat();
        s.closeTransportQuietly();
        log.info("Push channel disconnected. host={} session={} reason={}", endpoint.getHost(), s.id, reason);
        ChannelListener l = listener;
        if (l != null) {
            try {
                l.onDisconnected(reason);
            } catch (RuntimeException e) {
                log.warn("Push channel disconnect listener failed. session={}", s.id, e);
            }
        }
    }

    /**
     * 一次物理连接的生命周期。transport 回调只入队，由 dispatch 线程消费。
     */
    private final class Session implements PushTransportListener {

        private final long id;
        private final PushTransport transport;
        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        private final AtomicBoolean live = new AtomicBoolean(true);
        private final AtomicBoolean terminated = new AtomicBoolean(false);
        private volatile String endReason = "closed";
        private volatile ScheduledFuture<?> heartbeat;

        private Session(long id, PushTransport transport) {
            this.id = id;
            this.transport = requireNonNull(transport, "transport");
        }

        private boolean isLive() {
            return live.get() && !terminated.get();
        }

        private void start() {
            Thread t = new Thread(this::dispatchLoop, "push-dispatch-" + id);
            t.setDaemon(true);
            t.start();
            long every = config.getHeartbeatInterval().toMillis();
            try {
                heartbeat = keepAlive.scheduleWithFixedDelay(this::heartbeat, every, every, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                end("keepalive executor stopped");
            }
        }

        private void heartbeat() {
            if (!isLive()) {
                return;
            }
            if (!transport.probe(config.getProbeTimeout())) {
                log.warn("Push channel heartbeat probe failed. session={}", id);
                end("heartbeat probe failed");
            }
        }

        private void dispatchLoop() {
            long idleMillis = config.getIdleReadTimeout().toMillis();
            String reason;
            try {
                while (true) {
                    Object item = inbound.poll(idleMillis, TimeUnit.MILLISECONDS);
                    if (item == END_OF_STREAM) {
                        reason = endReason;
                        break;
                    }
                    if (item == null) {
                        if (!isLive()) {
                            reason = endReason;
                            break;
                        }
                        // 空闲超时：探测一次，失败则认为连接已死
                        if (!transport.probe(config.getProbeTimeout())) {
                            reason = "idle probe failed";
                            break;
                        }
                        continue;
                    }
                    deliver((String) item);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reason = "dispatch interrupted";
            }
            live.set(false);
            log.info("Push dispatch loop ended. session={} reason={}", id, reason);
            terminate(this, reason);
        }

        private void deliver(String frame) {
            ChannelListener l = listener;
            if (l == null) {
                return;
            }
            try {
                l.onFrame(frame);
            } catch (RuntimeException e) {
                log.warn("Push frame handler failed. session={}", id, e);
            }
        }

        private void end(String reason) {
            if (live.compareAndSet(true, false)) {
                endReason = reason;
                inbound.offer(END_OF_STREAM);
            }
        }

        private void cancelHeartbeat() {
            ScheduledFuture<?> h = heartbeat;
            if (h != null) {
                h.cancel(false);
            }
        }

        private void closeTransportQuietly() {
            try {
                transport.close(config.getCloseTimeout());
            } catch (IOException | RuntimeException e) {
                log.debug("Push transport close failed. session={} err={}", id, e.getMessage());
            }
        }

        @Override
        public void onFrame(String frame) {
            if (frame != null && live.get()) {
                inbound.offer(frame);
            }
        }

        @Override
        public void onClosed(String reason) {
            end("closed by peer: " + reason);
        }

        @Override
        public void onError(Exception error) {
            end("transport error: " + (error == null ? "unknown" : error.getMessage()));
        }
    }
}
