package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

public record GetOnlineCount(long conversationId) implements RemoteOperation<Integer> {
}
