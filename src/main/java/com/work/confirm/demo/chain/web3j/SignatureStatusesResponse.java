package com.work.confirm.demo.chain.web3j;

import com.fasterxml.jackson.databind.JsonNode;
import org.web3j.protocol.core.Response;

import java.util.List;

/**
 * getSignatureStatuses 的 JSON-RPC 响应。value 与请求的签名一一对应，节点不认识的签名为 null。
 */
public class SignatureStatusesResponse extends Response<SignatureStatusesResponse.Result> {

    public static class Result {
        private Context context;
        private List<Value> value;

        public Context getContext() {
            return context;
        }

        public void setContext(Context context) {
            this.context = context;
        }

        public List<Value> getValue() {
            return value;
        }

        public void setValue(List<Value> value) {
            this.value = value;
        }
    }

    public static class Context {
        private long slot;

        public long getSlot() {
            return slot;
        }

        public void setSlot(long slot) {
            this.slot = slot;
        }
    }

    public static class Value {
        private long slot;
        private Long confirmations;
        private JsonNode err;
        private String confirmationStatus;

        public long getSlot() {
            return slot;
        }

        public void setSlot(long slot) {
            this.slot = slot;
        }

        public Long getConfirmations() {
            return confirmations;
        }

        public void setConfirmations(Long confirmations) {
            this.confirmations = confirmations;
        }

        public JsonNode getErr() {
            return err;
        }

        public void setErr(JsonNode err) {
            this.err = err;
        }

        public String getConfirmationStatus() {
            return confirmationStatus;
        }

        public void setConfirmationStatus(String confirmationStatus) {
            this.confirmationStatus = confirmationStatus;
        }
    }
}
