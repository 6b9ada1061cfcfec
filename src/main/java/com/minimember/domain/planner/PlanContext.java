package com.minimember.domain.planner;

import com.minimember.domain.enums.ConversationKind;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.RestrictedRights;

/**
 * 规划时需要的上下文。
 *
 * @param selfTarget      目标就是当前账号
 * @param targetIsUser    目标是用户（否则是以会话身份出现的成员）
 * @param callerStatus    当前账号在会话中的状态
 * @param nowEpochSeconds 当前时间，用于计算临时封禁截止时间
 */
public record PlanContext(
        ConversationKind conversationKind,
        boolean selfTarget,
        boolean targetIsUser,
        MembershipStatus callerStatus,
        boolean membersCanInvite,
        long nowEpochSeconds
) {

    public boolean callerCanInviteUsers() {
        MembershipStatus s = callerStatus;
        if (s == null || !s.isMember()) {
            return false;
        }
        if (s.isAdministrator()) {
            return s.administratorRights().canInviteUsers();
        }
        return membersCanInvite && s.restrictedRights().has(RestrictedRights.CAN_INVITE_USERS);
    }

    public boolean callerCanRestrictMembers() {
        return callerStatus != null && callerStatus.isMember() && callerStatus.canRestrictMembers();
    }

    public boolean callerCanPromoteMembers() {
        return callerStatus != null && callerStatus.isMember() && callerStatus.canPromoteMembers();
    }

    public boolean callerIsMember() {
        return callerStatus != null && callerStatus.isMember();
    }
}
