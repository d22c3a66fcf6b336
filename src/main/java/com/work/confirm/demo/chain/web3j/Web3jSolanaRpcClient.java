package com.work.confirm.demo.chain.web3j;

import com.work.confirm.core.chain.SignatureStatus;
import com.work.confirm.core.chain.SolanaRpcClient;
import com.work.confirm.core.exception.RpcCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.work.confirm.core.support.ValidationUtils.requireNonEmpty;

/**
 * 基于 Web3j 传输层的节点客户端实现：
 * - web3j 的 Web3j 接口是 EVM 方法集，这里直接用通用 Request 发 Solana 的 getSignatureStatuses
 * - searchTransactionHistory=true，已出 status cache 的老签名也能查到
 */
public class Web3jSolanaRpcClient implements SolanaRpcClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jSolanaRpcClient.class);

    static final String GET_SIGNATURE_STATUSES = "getSignatureStatuses";

    private final Web3jService web3jService;

    public Web3jSolanaRpcClient(Web3jService web3jService) {
        this.web3jService = web3jService;
    }

    @Override
    public Optional<SignatureStatus> getSignatureStatus(String signature) {
        requireNonEmpty(signature, "signature");
        List<Object> params = Arrays.asList(
                Collections.singletonList(signature),
                Collections.singletonMap("searchTransactionHistory", true));
        Request<Object, SignatureStatusesResponse> request =
                new Request<>(GET_SIGNATURE_STATUSES, params, web3jService, SignatureStatusesResponse.class);

        SignatureStatusesResponse resp;
        try {
            resp = request.send();
        } catch (IOException e) {
            log.warn("Web3j getSignatureStatuses failed. signature={} err={}", signature, e.getMessage());
            throw new RpcCallException("getSignatureStatuses transport failed", e);
        }
        if (resp.hasError()) {
            Response.Error error = resp.getError();
            throw new RpcCallException("getSignatureStatuses rejected: " + error.getMessage(), error.getCode());
        }

        SignatureStatusesResponse.Result result = resp.getResult();
        if (result == null || result.getValue() == null || result.getValue().isEmpty()) {
            return Optional.empty();
        }
        SignatureStatusesResponse.Value v = result.getValue().get(0);
        if (v == null) {
            return Optional.empty();
        }
        return Optional.of(new SignatureStatus(v.getSlot(), v.getConfirmations(), v.getErr(), v.getConfirmationStatus()));
    }
}
