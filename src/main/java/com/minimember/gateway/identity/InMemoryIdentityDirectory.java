package com.minimember.gateway.identity;

import com.minimember.domain.model.ConversationInfo;
import com.minimember.domain.model.UserInfo;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认的身份目录，由宿主应用写入。
 */
public class InMemoryIdentityDirectory implements IdentityResolver {

    private final Map<Long, ConversationInfo> conversations = new ConcurrentHashMap<>();
    private final Map<Long, UserInfo> users = new ConcurrentHashMap<>();

    @Override
    public ConversationInfo conversation(long conversationId) {
        return conversations.get(conversationId);
    }

    @Override
    public UserInfo user(long userId) {
        return users.get(userId);
    }

    public void putConversation(ConversationInfo info) {
        conversations.put(info.id(), info);
    }

    public void putUser(UserInfo info) {
        users.put(info.id(), info);
    }

    public void removeConversation(long conversationId) {
        conversations.remove(conversationId);
    }
}
