package com.work.confirm.core.chain;

import java.util.Optional;

/**
 * 节点 RPC 客户端端口，组件只依赖这一个查询能力；交易构造、签名与广播由业务侧负责。
 */
public interface SolanaRpcClient {

    /**
     * 查询签名状态（含历史）。节点尚不认识该签名时返回 empty。
     *
     * @throws com.work.confirm.core.exception.RpcCallException 传输失败或 JSON-RPC error
     */
    Optional<SignatureStatus> getSignatureStatus(String signature);
}
