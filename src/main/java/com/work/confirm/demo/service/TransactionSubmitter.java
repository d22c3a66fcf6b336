package com.work.confirm.demo.service;

/**
 * 业务方实现的交易提交逻辑：构造、签名并广播交易，返回签名。
 * 确认组件不感知交易内容，只负责等待签名落块。
 */
@FunctionalInterface
public interface TransactionSubmitter {

    /**
     * @return 已广播交易的签名（base58）
     */
    String submit() throws Exception;
}
