package com.minimember.gateway.notify;

import java.util.List;

public record AddMembersPrivacyForbidden(long conversationId, List<Long> userIds) implements MembershipUpdate {

    public AddMembersPrivacyForbidden {
        userIds = List.copyOf(userIds);
    }
}
