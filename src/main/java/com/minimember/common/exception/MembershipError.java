package com.minimember.common.exception;

import com.minimember.common.api.ApiCodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 成员操作的错误类型。
 */
@Getter
@RequiredArgsConstructor
public enum MembershipError {

    CHAT_NOT_FOUND(Category.POLICY, 404, ApiCodes.NOT_FOUND),
    MEMBER_NOT_FOUND(Category.POLICY, 404, ApiCodes.NOT_FOUND),
    NOT_SUPPORTED(Category.POLICY, 400, ApiCodes.BAD_REQUEST),
    INVALID_TRANSITION(Category.POLICY, 400, ApiCodes.BAD_REQUEST),
    NOT_ENOUGH_RIGHTS(Category.POLICY, 403, ApiCodes.FORBIDDEN),

    REMOTE_REJECTED(Category.REMOTE, 400, ApiCodes.BAD_REQUEST),
    PRIVACY_RESTRICTED(Category.REMOTE, 406, ApiCodes.PRIVACY_RESTRICTED),
    PASSWORD_NEEDED(Category.REMOTE, 400, ApiCodes.PASSWORD_NEEDED),
    PASSWORD_INVALID(Category.REMOTE, 400, ApiCodes.PASSWORD_INVALID),
    COOLDOWN(Category.REMOTE, 429, ApiCodes.TOO_MANY_REQUESTS),

    REMOTE_UNAVAILABLE(Category.TRANSIENT, 503, ApiCodes.SERVICE_UNAVAILABLE),
    DATA_UNAVAILABLE(Category.INCONSISTENT, 500, ApiCodes.INTERNAL_ERROR),
    CLOSING(Category.CLOSING, 503, ApiCodes.SERVICE_UNAVAILABLE);

    public enum Category {
        /** 本地规则拒绝，未发起远端调用 */
        POLICY,
        /** 远端明确拒绝 */
        REMOTE,
        /** 网络/超时等暂时性失败 */
        TRANSIENT,
        /** 远端数据自相矛盾 */
        INCONSISTENT,
        /** 进程正在关闭 */
        CLOSING
    }

    private final Category category;

    private final int httpStatus;

    private final int apiCode;
}
