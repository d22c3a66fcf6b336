package com.work.confirm.core.subscription;

import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.SignatureNotification;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * 签名订阅端口。确认引擎只依赖该接口，便于替换与单测。
 */
public interface SignatureSubscriber {

    /**
     * 发送 signatureSubscribe 并同步等待 ack（最长 ackTimeout）。
     * 失败不抛异常，以 {@link SubscribeOutcome#failure} 返回。
     *
     * @param callback 收到该订阅的推送时至多调用一次
     */
    SubscribeOutcome subscribe(String signature, Commitment commitment,
                               Consumer<SignatureNotification> callback, Duration ackTimeout);

    /**
     * 尽力退订并移除本地回调。
     *
     * @return false 表示无连接或该订阅本地已不存在（重复退订是安全的空操作）
     */
    boolean unsubscribe(long subscriptionId);

    /**
     * 当前本地登记的订阅数。
     */
    int pendingCount();
}
