package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

public record HideAllJoinRequests(long conversationId, String inviteLink, boolean approve)
        implements RemoteOperation<Void> {
}
