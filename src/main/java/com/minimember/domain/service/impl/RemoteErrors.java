package com.minimember.domain.service.impl;

import com.minimember.common.concurrent.Futures;
import com.minimember.common.exception.MembershipError;
import com.minimember.common.exception.MembershipException;
import com.minimember.gateway.remote.RemoteException;

/**
 * 远端错误文本到结构化错误的翻译。未识别的拒绝保留原文。
 */
final class RemoteErrors {

    static final String USER_NOT_PARTICIPANT = "USER_NOT_PARTICIPANT";
    static final String USER_PRIVACY_RESTRICTED = "USER_PRIVACY_RESTRICTED";

    private static final String[] COOLDOWN_PREFIXES = {"PASSWORD_TOO_FRESH_", "SESSION_TOO_FRESH_", "FLOOD_WAIT_"};

    private RemoteErrors() {
    }

    static boolean is(Throwable t, String message) {
        Throwable cause = Futures.unwrap(t);
        return cause instanceof RemoteException re && re.hasMessage(message);
    }

    static Throwable translate(Throwable t) {
        Throwable cause = Futures.unwrap(t);
        if (!(cause instanceof RemoteException re)) {
            return cause;
        }
        String message = re.getMessage() == null ? "" : re.getMessage();
        if (re.isTransient()) {
            return new MembershipException(MembershipError.REMOTE_UNAVAILABLE, message, null, re);
        }
        if ("PASSWORD_MISSING".equals(message)) {
            return new MembershipException(MembershipError.PASSWORD_NEEDED, message, null, re);
        }
        if ("PASSWORD_HASH_INVALID".equals(message)) {
            return new MembershipException(MembershipError.PASSWORD_INVALID, message, null, re);
        }
        if (USER_PRIVACY_RESTRICTED.equals(message)) {
            return new MembershipException(MembershipError.PRIVACY_RESTRICTED, message, null, re);
        }
        for (String prefix : COOLDOWN_PREFIXES) {
            if (message.startsWith(prefix)) {
                return new MembershipException(MembershipError.COOLDOWN, message, parseSeconds(message.substring(prefix.length())), re);
            }
        }
        return new MembershipException(MembershipError.REMOTE_REJECTED, message, null, re);
    }

    private static Integer parseSeconds(String raw) {
        try {
            int v = Integer.parseInt(raw.trim());
            return Math.max(0, v);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
