package com.minimember.common.exception;

import lombok.Getter;

/**
 * 成员操作失败。
 *
 * <p>message 保留原始文案（本地规则的英文提示，或远端返回的错误文本），controller 层原样返回给调用方。</p>
 */
@Getter
public class MembershipException extends RuntimeException {

    private final MembershipError error;

    /** 冷却类错误需要等待的秒数，其余为 null */
    private final Integer retryAfterSeconds;

    public MembershipException(MembershipError error, String message) {
        this(error, message, null, null);
    }

    public MembershipException(MembershipError error, String message, Integer retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static MembershipException policy(MembershipError error, String message) {
        return new MembershipException(error, message);
    }

    public static MembershipException closing() {
        return new MembershipException(MembershipError.CLOSING, "Request aborted");
    }

    public static MembershipException dataUnavailable() {
        return new MembershipException(MembershipError.DATA_UNAVAILABLE, "Data unavailable");
    }

    public MembershipError.Category getCategory() {
        return error.getCategory();
    }

    public boolean isPolicy() {
        return error.getCategory() == MembershipError.Category.POLICY;
    }
}
