package com.minimember.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一 HTTP 返回对象。
 *
 * <p>字段约定：</p>
 * <ul>
 *   <li>ok：业务是否成功（不是 HTTP 状态码）。</li>
 *   <li>code：业务错误码。成功固定为 0。</li>
 *   <li>message：简短原因；成员操作失败时就是远端或本地给出的原始文案。</li>
 *   <li>data：成功时的数据。</li>
 *   <li>retryAfter：冷却类错误需要等待的秒数，其余情况为 null。</li>
 *   <li>ts：服务端响应时间戳（毫秒）。</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean ok,
        int code,
        String message,
        T data,
        Integer retryAfter,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, "ok", data, null, System.currentTimeMillis());
    }

    /**
     * 成功但无业务数据时使用。
     *
     * <p>注意：不能命名为 ok()，因为 record 会自动生成 ok() 访问器（boolean）。</p>
     */
    public static <T> Result<T> okVoid() {
        return new Result<>(true, 0, "ok", null, null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message, Integer retryAfter) {
        return new Result<>(false, code, message, null, retryAfter, System.currentTimeMillis());
    }
}
