package com.minimember.gateway.identity;

import com.minimember.domain.model.ConversationInfo;
import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.UserInfo;

/**
 * 只读的身份查询。未知时返回 null。
 */
public interface IdentityResolver {

    ConversationInfo conversation(long conversationId);

    UserInfo user(long userId);

    /**
     * 成员引用能否解析到已知的用户或会话。
     */
    default boolean isKnown(MemberRef member) {
        if (member == null || !member.isValid()) {
            return false;
        }
        return member.isUser() ? user(member.id()) != null : conversation(member.id()) != null;
    }
}
