package com.minimember.common.api;

/**
 * 统一错误码定义。成员相关的远端错误统一落在 4xxxx 区间，按 HTTP 语义划分。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 需要二次验证密码 */
    public static final int PASSWORD_NEEDED = 40010;

    /** 二次验证密码错误 */
    public static final int PASSWORD_INVALID = 40011;

    /** 权限不足 */
    public static final int FORBIDDEN = 40300;

    /** 会话或成员不存在 */
    public static final int NOT_FOUND = 40400;

    /** 隐私设置拒绝 */
    public static final int PRIVACY_RESTRICTED = 40600;

    /** 冷却中，见 retryAfter */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 远端暂不可用 / 正在关闭 */
    public static final int SERVICE_UNAVAILABLE = 50300;
}
