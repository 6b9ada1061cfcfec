package com.minimember.domain.model;

import java.util.List;

/**
 * 邀请时因隐私设置被拒绝的用户。为空表示全部成功。
 */
public record RejectedInvitees(List<Long> userIds) {

    private static final RejectedInvitees NONE = new RejectedInvitees(List.of());

    public RejectedInvitees {
        userIds = userIds == null ? List.of() : List.copyOf(userIds);
    }

    public static RejectedInvitees none() {
        return NONE;
    }

    public boolean isEmpty() {
        return userIds.isEmpty();
    }
}
