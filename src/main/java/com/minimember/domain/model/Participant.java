package com.minimember.domain.model;

/**
 * 一条成员记录。inviterUserId 为 0 表示未知；joinedAt 为 epoch 秒。
 */
public record Participant(MemberRef who, long inviterUserId, int joinedAt, MembershipStatus status) {

    public static Participant of(MemberRef who, MembershipStatus status) {
        return new Participant(who, 0L, 0, status);
    }

    public Participant withStatus(MembershipStatus newStatus) {
        return new Participant(who, inviterUserId, joinedAt, newStatus);
    }

    /**
     * 服务端偶尔会返回字段组合不可能出现的记录，这类记录不能进入缓存。
     * 受限、封禁和非群主管理员必须带上操作者（inviterUserId）。
     */
    public boolean isValid() {
        if (who == null || !who.isValid() || status == null || joinedAt < 0) {
            return false;
        }
        if (!who.isUser() && status.isAdministrator()) {
            return false;
        }
        if (status.isRestricted() || status.isBanned() || (status.isAdministrator() && !status.isCreator())) {
            return inviterUserId > 0;
        }
        return true;
    }
}
