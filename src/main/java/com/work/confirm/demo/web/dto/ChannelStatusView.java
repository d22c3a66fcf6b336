package com.work.confirm.demo.web.dto;

/**
 * push 通道运行状态，便于运维判断当前是否已降级为仅 polling。
 */
public class ChannelStatusView {
    private boolean pushAvailable;
    private String connectionState;
    private boolean degraded;
    private int pendingSubscriptions;

    public boolean isPushAvailable() {
        return pushAvailable;
    }

    public void setPushAvailable(boolean pushAvailable) {
        this.pushAvailable = pushAvailable;
    }

    public String getConnectionState() {
        return connectionState;
    }

    public void setConnectionState(String connectionState) {
        this.connectionState = connectionState;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    public int getPendingSubscriptions() {
        return pendingSubscriptions;
    }

    public void setPendingSubscriptions(int pendingSubscriptions) {
        this.pendingSubscriptions = pendingSubscriptions;
    }
}
