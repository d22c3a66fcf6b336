package com.work.confirm.demo.web.dto;

import com.work.confirm.demo.service.TradeConfirmation;

public class TradeConfirmationView {
    private String signature;
    private String status;
    private String path;
    private String summary;
    private String detail;
    private long elapsedMillis;

    public static TradeConfirmationView from(TradeConfirmation c) {
        TradeConfirmationView v = new TradeConfirmationView();
        v.setSignature(c.getSignature());
        v.setStatus(c.getStatus().name());
        v.setPath(c.getPath().name());
        v.setSummary(c.getSummary());
        v.setDetail(c.getDetail());
        v.setElapsedMillis(c.getElapsedMillis());
        return v;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public void setElapsedMillis(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
    }
}
