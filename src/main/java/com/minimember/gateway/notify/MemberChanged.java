package com.minimember.gateway.notify;

import com.minimember.domain.model.Participant;

/**
 * 成员状态变化广播，只在服务账号模式下发出。
 */
public record MemberChanged(
        long conversationId,
        long actorUserId,
        int date,
        Participant oldParticipant,
        Participant newParticipant
) implements MembershipUpdate {
}
