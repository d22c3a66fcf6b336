package com.work.confirm.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体 metrics 实现
 * - 业务/平台可通过自定义 Bean 接入 Micrometer 等实现
 */
public interface ConfirmMetrics {

    /**
     * push 路径的结果：delivered / subscribe_failed / notification_timeout / transport_error / skipped。
     */
    default void pushOutcome(String result) {
    }

    /**
     * 进入 polling 兜底的原因。
     */
    default void fallback(String reason) {
    }

    /**
     * confirm 的终态。
     */
    default void result(String status) {
    }

    default void breakerOpened() {
    }

    default void pendingSubscriptions(int count) {
    }
}
