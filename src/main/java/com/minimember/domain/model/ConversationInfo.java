package com.minimember.domain.model;

import com.minimember.domain.enums.ConversationKind;

/**
 * 身份服务给出的会话快照。
 *
 * @param memberCount     已知成员数，0 表示未知
 * @param callerStatus    当前账号在该会话中的状态
 * @param peerUserId      一对一会话的对方用户，群组为 0
 */
public record ConversationInfo(
        long id,
        ConversationKind kind,
        boolean broadcast,
        int memberCount,
        boolean hiddenParticipants,
        boolean active,
        boolean membersCanInvite,
        MembershipStatus callerStatus,
        long peerUserId
) {

    public ConversationInfo withCallerStatus(MembershipStatus status) {
        return new ConversationInfo(id, kind, broadcast, memberCount, hiddenParticipants, active, membersCanInvite, status, peerUserId);
    }

    public boolean isBroadcastChannel() {
        return kind == ConversationKind.CHANNEL && broadcast;
    }

    public boolean isSupergroup() {
        return kind == ConversationKind.CHANNEL && !broadcast;
    }
}
