package com.minimember.domain.model;

import com.minimember.domain.enums.MemberRefType;

import java.util.Objects;

/**
 * 成员引用：普通用户，或者（仅频道/超级群）以匿名身份出现的另一个会话。
 */
public record MemberRef(MemberRefType type, long id) {

    public MemberRef {
        Objects.requireNonNull(type, "type");
    }

    public static MemberRef user(long userId) {
        return new MemberRef(MemberRefType.USER, userId);
    }

    public static MemberRef conversation(long conversationId) {
        return new MemberRef(MemberRefType.CONVERSATION, conversationId);
    }

    public boolean isUser() {
        return type == MemberRefType.USER;
    }

    public boolean isValid() {
        return id != 0;
    }
}
