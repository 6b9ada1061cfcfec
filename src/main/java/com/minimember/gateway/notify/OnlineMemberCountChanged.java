package com.minimember.gateway.notify;

public record OnlineMemberCountChanged(long conversationId, int onlineCount) implements MembershipUpdate {
}
