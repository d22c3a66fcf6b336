package com.work.confirm.core.model;

import java.util.Locale;

/**
 * 节点确认等级，按持久性递增排列。
 */
public enum Commitment {
    /** 节点已处理，可能被回滚。 */
    PROCESSED("processed"),
    /** 超级多数投票确认。 */
    CONFIRMED("confirmed"),
    /** 已最终确定。 */
    FINALIZED("finalized");

    private final String wireValue;

    Commitment(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * 节点上报的 confirmationStatus 是否已达到当前等级。
     *
     * @param confirmationStatus 节点返回的状态，null 视为未达到
     */
    public boolean isReachedBy(String confirmationStatus) {
        if (confirmationStatus == null) {
            return false;
        }
        Commitment reported;
        try {
            reported = parse(confirmationStatus);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return reported.ordinal() >= this.ordinal();
    }

    public static Commitment parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("commitment 不能为空");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Commitment c : values()) {
            if (c.wireValue.equals(v)) {
                return c;
            }
        }
        throw new IllegalArgumentException("未知 commitment: " + value);
    }
}
