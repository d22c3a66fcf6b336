package com.work.confirm.core.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.confirm.core.model.SignatureNotification;

/**
 * 解析后的入站帧。
 */
public class InboundFrame {

    public enum Type {
        /** JSON-RPC 响应（订阅 ack、退订 ack 或 error）。 */
        RESPONSE,
        /** signatureNotification 推送。 */
        NOTIFICATION,
        /** 无法识别或与签名订阅无关的帧。 */
        OTHER
    }

    private final Type type;
    private final Long requestId;
    private final JsonNode result;
    private final String error;
    private final SignatureNotification notification;

    private InboundFrame(Type type, Long requestId, JsonNode result, String error, SignatureNotification notification) {
        this.type = type;
        this.requestId = requestId;
        this.result = result;
        this.error = error;
        this.notification = notification;
    }

    static InboundFrame response(Long requestId, JsonNode result, String error) {
        return new InboundFrame(Type.RESPONSE, requestId, result, error, null);
    }

    static InboundFrame notification(SignatureNotification notification) {
        return new InboundFrame(Type.NOTIFICATION, null, null, null, notification);
    }

    static InboundFrame other() {
        return new InboundFrame(Type.OTHER, null, null, null, null);
    }

    public Type getType() {
        return type;
    }

    /**
     * 响应中的请求 id，部分节点实现的 ack 不带 id 时为 null。
     */
    public Long getRequestId() {
        return requestId;
    }

    public JsonNode getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public SignatureNotification getNotification() {
        return notification;
    }

    /**
     * ack 的 result 是否为合法的订阅 id。
     */
    public boolean hasSubscriptionId() {
        return result != null && result.isIntegralNumber();
    }
}
