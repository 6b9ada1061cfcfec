package com.minimember.gateway.remote.op;

import com.minimember.domain.model.JoinRequest;
import com.minimember.domain.model.JoinRequestsPage;
import com.minimember.gateway.remote.RemoteOperation;

/**
 * @param offset 上一页最后一条，首页为 null
 */
public record GetJoinRequests(
        long conversationId,
        String inviteLink,
        String query,
        JoinRequest offset,
        int limit
) implements RemoteOperation<JoinRequestsPage> {
}
