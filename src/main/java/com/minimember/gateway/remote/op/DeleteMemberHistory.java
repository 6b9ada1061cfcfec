package com.minimember.gateway.remote.op;

import com.minimember.domain.model.MemberRef;
import com.minimember.gateway.remote.RemoteOperation;

public record DeleteMemberHistory(long conversationId, MemberRef member) implements RemoteOperation<Void> {
}
