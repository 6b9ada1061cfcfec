package com.minimember.domain.dto;

import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.Participant;

/**
 * 成员记录的对外形态：状态展开成扁平字段。
 */
public record ParticipantDto(
        String memberType,
        long memberId,
        long inviterUserId,
        int joinedAt,
        String status,
        boolean member,
        String rank,
        int administratorRights,
        int restrictedRights,
        int bannedUntil
) {

    public static ParticipantDto from(Participant p) {
        MembershipStatus s = p.status();
        return new ParticipantDto(
                p.who().type().name(),
                p.who().id(),
                p.inviterUserId(),
                p.joinedAt(),
                s.kind().name(),
                s.isMember(),
                s.rank(),
                s.administratorRights().flags(),
                s.restrictedRights().flags(),
                s.bannedUntil()
        );
    }
}
