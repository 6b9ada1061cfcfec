package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

/**
 * 基础群移除成员。
 */
public record DeleteChatMember(long conversationId, long userId, boolean revokeMessages)
        implements RemoteOperation<Void> {
}
