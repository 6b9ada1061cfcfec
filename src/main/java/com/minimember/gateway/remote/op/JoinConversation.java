package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

public record JoinConversation(long conversationId) implements RemoteOperation<Void> {
}
