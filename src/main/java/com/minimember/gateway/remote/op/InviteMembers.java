package com.minimember.gateway.remote.op;

import com.minimember.domain.model.RejectedInvitees;
import com.minimember.gateway.remote.RemoteOperation;

import java.util.List;

/**
 * 频道/超级群批量邀请。
 */
public record InviteMembers(long conversationId, List<Long> userIds) implements RemoteOperation<RejectedInvitees> {

    public InviteMembers {
        userIds = List.copyOf(userIds);
    }
}
