package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

public record LeaveConversation(long conversationId) implements RemoteOperation<Void> {
}
