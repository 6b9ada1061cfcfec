package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

public record HideJoinRequest(long conversationId, long userId, boolean approve) implements RemoteOperation<Void> {
}
