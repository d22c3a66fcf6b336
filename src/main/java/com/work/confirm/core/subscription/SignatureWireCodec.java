package com.work.confirm.core.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.confirm.core.exception.ConfirmException;
import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.SignatureNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * push 通道 JSON-RPC 帧的编解码：
 * - signatureSubscribe / signatureUnsubscribe 请求
 * - 响应与 signatureNotification 推送
 */
public class SignatureWireCodec {

    private static final Logger log = LoggerFactory.getLogger(SignatureWireCodec.class);

    static final String SUBSCRIBE_METHOD = "signatureSubscribe";
    static final String UNSUBSCRIBE_METHOD = "signatureUnsubscribe";
    static final String NOTIFICATION_METHOD = "signatureNotification";

    private final ObjectMapper objectMapper;

    public SignatureWireCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String subscribeRequest(long requestId, String signature, Commitment commitment) {
        ObjectNode root = envelope(requestId, SUBSCRIBE_METHOD);
        ArrayNode params = root.putArray("params");
        params.add(signature);
        ObjectNode opts = params.addObject();
        opts.put("commitment", commitment.getWireValue());
        opts.put("enableReceivedNotification", false);
        return write(root);
    }

    public String unsubscribeRequest(long requestId, long subscriptionId) {
        ObjectNode root = envelope(requestId, UNSUBSCRIBE_METHOD);
        root.putArray("params").add(subscriptionId);
        return write(root);
    }

    /**
     * 解析入站帧，无法解析时返回 OTHER，不抛异常。
     */
    public InboundFrame parse(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("Undecodable push frame dropped. err={}", e.getOriginalMessage());
            return InboundFrame.other();
        }
        if (root == null || !root.isObject()) {
            return InboundFrame.other();
        }

        JsonNode method = root.get("method");
        if (method != null) {
            if (!NOTIFICATION_METHOD.equals(method.asText())) {
                return InboundFrame.other();
            }
            JsonNode params = root.path("params");
            JsonNode sub = params.get("subscription");
            if (sub == null || !sub.isIntegralNumber()) {
                log.warn("Signature notification without subscription id dropped");
                return InboundFrame.other();
            }
            JsonNode result = params.path("result");
            JsonNode slot = result.path("context").path("slot");
            JsonNode err = result.path("value").get("err");
            return InboundFrame.notification(new SignatureNotification(sub.asLong(),
                    slot.isIntegralNumber() ? slot.asLong() : null,
                    (err == null || err.isNull()) ? null : err));
        }

        if (root.has("result") || root.has("error")) {
            JsonNode id = root.get("id");
            Long requestId = (id != null && id.isIntegralNumber()) ? id.asLong() : null;
            JsonNode error = root.get("error");
            String errorText = null;
            if (error != null && !error.isNull()) {
                errorText = error.path("message").asText(error.toString());
            }
            return InboundFrame.response(requestId, root.get("result"), errorText);
        }
        return InboundFrame.other();
    }

    private ObjectNode envelope(long requestId, String method) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("id", requestId);
        root.put("method", method);
        return root;
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ConfirmException("序列化订阅请求失败", e);
        }
    }
}
