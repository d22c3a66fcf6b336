package com.work.confirm.core.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * base58 签名：字母表去掉 0/O/I/l，长度 32~88。
     */
    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,88}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验int值必须大于0
     */
    public static int requirePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    /**
     * 校验交易签名的格式，作为 requireNonEmpty 之上的“加强版”校验。
     * <p>约束：base58 字符集，长度 32~88。</p>
     */
    public static String requireValidSignature(String signature) {
        requireNonEmpty(signature, "signature");
        if (!SIGNATURE_PATTERN.matcher(signature).matches()) {
            throw new IllegalArgumentException("signature 非法，只允许 32~88 位的 base58 字符");
        }
        return signature;
    }
}
