package com.work.confirm.demo.web.dto;

import javax.validation.constraints.Max;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Positive;

/**
 * 确认请求体，两个字段都可省略，省略时使用组件默认值。
 */
public class ConfirmRequest {

    /** processed / confirmed / finalized */
    @Pattern(regexp = "(?i)processed|confirmed|finalized", message = "commitment 只能是 processed/confirmed/finalized")
    private String commitment;

    /** push 等待超时（秒）。 */
    @Positive(message = "timeoutSeconds 必须大于0")
    @Max(value = 600, message = "timeoutSeconds 不能超过600")
    private Long timeoutSeconds;

    public String getCommitment() {
        return commitment;
    }

    public void setCommitment(String commitment) {
        this.commitment = commitment;
    }

    public Long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(Long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
