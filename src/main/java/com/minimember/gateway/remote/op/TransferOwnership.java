package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

public record TransferOwnership(long conversationId, long userId, String password) implements RemoteOperation<Void> {

    @Override
    public String toString() {
        return "TransferOwnership[conversationId=" + conversationId + ", userId=" + userId + "]";
    }
}
