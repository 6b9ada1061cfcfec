package com.minimember.gateway.remote.op;

import com.minimember.domain.model.RejectedInvitees;
import com.minimember.gateway.remote.RemoteOperation;

/**
 * 基础群拉人，一次一个。
 */
public record AddChatMember(long conversationId, long userId, int forwardHistoryLimit)
        implements RemoteOperation<RejectedInvitees> {
}
