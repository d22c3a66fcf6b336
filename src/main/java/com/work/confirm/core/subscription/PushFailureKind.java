package com.work.confirm.core.subscription;

/**
 * push 路径的失败分类。全部在确认引擎内部被吸收并降级为 polling。
 */
public enum PushFailureKind {
    /** 建连失败或连接中途丢失。 */
    CONNECTION_ERROR,
    /** 订阅确认（ack）未在时限内到达。 */
    SUBSCRIBE_TIMEOUT,
    /** ack 携带 error 或格式不合法。 */
    SUBSCRIBE_REJECTED,
    /** 已订阅，但截止时间前没有收到推送。 */
    NOTIFICATION_TIMEOUT,
    /** 写入失败等其他传输错误。 */
    TRANSPORT_ERROR
}
