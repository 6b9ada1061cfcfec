package com.minimember.gateway.remote;

import lombok.Getter;

/**
 * 远端返回的错误：(code, message)。
 *
 * <p>message 是远端的错误文本，少数已知文本（USER_NOT_PARTICIPANT 等）会被翻译成结构化错误。</p>
 */
@Getter
public class RemoteException extends RuntimeException {

    private final int code;

    public RemoteException(int code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * 网络 / 超时 / 服务端内部错误。
     */
    public boolean isTransient() {
        return code <= 0 || code >= 500;
    }

    public boolean hasMessage(String text) {
        return text != null && text.equals(getMessage());
    }

    public boolean messageStartsWith(String prefix) {
        return getMessage() != null && prefix != null && getMessage().startsWith(prefix);
    }
}
