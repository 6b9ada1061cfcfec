package com.minimember.domain.model;

import java.util.Objects;

/**
 * 成员在会话中的状态。
 *
 * <p>每种状态是一个独立的 record，字段只在对应的状态上存在（例如只有群主/管理员带 rank）。
 * 通过下面的静态工厂构造时会做归一化：</p>
 * <ul>
 *   <li>没有任何管理权限的 Administrator 视为 Member；</li>
 *   <li>保留全部受限权限的 Restricted 视为 Member（或 Left，取决于 member 标记）；</li>
 *   <li>负数或 {@link Integer#MAX_VALUE} 的截止时间视为 0（永久）。</li>
 * </ul>
 */
public interface MembershipStatus {

    enum Kind {
        CREATOR,
        ADMINISTRATOR,
        MEMBER,
        RESTRICTED,
        BANNED,
        LEFT
    }

    Kind kind();

    /**
     * 是否仍在会话中（可以收到消息）。
     */
    boolean isMember();

    default boolean isCreator() {
        return kind() == Kind.CREATOR;
    }

    /**
     * 群主或管理员。
     */
    default boolean isAdministrator() {
        return kind() == Kind.CREATOR || kind() == Kind.ADMINISTRATOR;
    }

    default boolean isRestricted() {
        return kind() == Kind.RESTRICTED;
    }

    default boolean isBanned() {
        return kind() == Kind.BANNED;
    }

    default String rank() {
        return "";
    }

    default int bannedUntil() {
        return 0;
    }

    default AdministratorRights administratorRights() {
        return AdministratorRights.none();
    }

    default RestrictedRights restrictedRights() {
        return RestrictedRights.full();
    }

    default boolean canInviteUsers() {
        return isMember() && (administratorRights().canInviteUsers() || restrictedRights().has(RestrictedRights.CAN_INVITE_USERS));
    }

    default boolean canManageInviteLinks() {
        return administratorRights().canManageInviteLinks();
    }

    default boolean canRestrictMembers() {
        return administratorRights().canRestrictMembers();
    }

    default boolean canPromoteMembers() {
        return administratorRights().canPromoteMembers();
    }

    /**
     * 切换在会话中的标记，其余字段保持不变。
     */
    MembershipStatus withMember(boolean member);

    /**
     * 截止时间已过的限制/封禁在这里解除。
     */
    default MembershipStatus withExpiredRestrictionsLifted(long nowEpochSeconds) {
        return this;
    }

    // ---------- factories ----------

    static MembershipStatus creator(String rank, boolean anonymous, boolean member) {
        return new Creator(normalizeRank(rank), anonymous, member);
    }

    static MembershipStatus administrator(AdministratorRights rights, String rank, boolean canBeEdited) {
        if (rights == null || rights.isEmpty()) {
            return Member.INSTANCE;
        }
        return new Administrator(rights, normalizeRank(rank), canBeEdited);
    }

    static MembershipStatus member() {
        return Member.INSTANCE;
    }

    static MembershipStatus restricted(RestrictedRights rights, int bannedUntil, boolean member) {
        RestrictedRights r = rights == null ? RestrictedRights.none() : rights;
        if (r.isFull()) {
            return member ? Member.INSTANCE : Left.INSTANCE;
        }
        return new Restricted(r, fixUntilDate(bannedUntil), member);
    }

    static MembershipStatus banned(int bannedUntil) {
        return new Banned(fixUntilDate(bannedUntil));
    }

    static MembershipStatus left() {
        return Left.INSTANCE;
    }

    static int fixUntilDate(int date) {
        if (date < 0 || date == Integer.MAX_VALUE) {
            return 0;
        }
        return date;
    }

    private static String normalizeRank(String rank) {
        return rank == null ? "" : rank.strip();
    }

    // ---------- variants ----------

    record Creator(String rank, boolean anonymous, boolean member) implements MembershipStatus {

        public Creator {
            Objects.requireNonNull(rank, "rank");
        }

        @Override
        public Kind kind() {
            return Kind.CREATOR;
        }

        @Override
        public boolean isMember() {
            return member;
        }

        @Override
        public AdministratorRights administratorRights() {
            int flags = AdministratorRights.ALL | (anonymous ? AdministratorRights.IS_ANONYMOUS : 0);
            return new AdministratorRights(flags);
        }

        @Override
        public MembershipStatus withMember(boolean newMember) {
            return new Creator(rank, anonymous, newMember);
        }
    }

    record Administrator(AdministratorRights rights, String rank, boolean canBeEdited) implements MembershipStatus {

        public Administrator {
            Objects.requireNonNull(rights, "rights");
            Objects.requireNonNull(rank, "rank");
        }

        @Override
        public Kind kind() {
            return Kind.ADMINISTRATOR;
        }

        @Override
        public boolean isMember() {
            return true;
        }

        @Override
        public AdministratorRights administratorRights() {
            return rights;
        }

        @Override
        public MembershipStatus withMember(boolean newMember) {
            return newMember ? this : Left.INSTANCE;
        }
    }

    record Member() implements MembershipStatus {

        static final Member INSTANCE = new Member();

        @Override
        public Kind kind() {
            return Kind.MEMBER;
        }

        @Override
        public boolean isMember() {
            return true;
        }

        @Override
        public MembershipStatus withMember(boolean newMember) {
            return newMember ? this : Left.INSTANCE;
        }
    }

    record Restricted(RestrictedRights rights, int bannedUntil, boolean member) implements MembershipStatus {

        public Restricted {
            Objects.requireNonNull(rights, "rights");
        }

        @Override
        public Kind kind() {
            return Kind.RESTRICTED;
        }

        @Override
        public boolean isMember() {
            return member;
        }

        @Override
        public RestrictedRights restrictedRights() {
            return rights;
        }

        @Override
        public MembershipStatus withMember(boolean newMember) {
            return new Restricted(rights, bannedUntil, newMember);
        }

        @Override
        public MembershipStatus withExpiredRestrictionsLifted(long nowEpochSeconds) {
            if (bannedUntil != 0 && bannedUntil <= nowEpochSeconds) {
                return member ? Member.INSTANCE : Left.INSTANCE;
            }
            return this;
        }
    }

    record Banned(int bannedUntil) implements MembershipStatus {

        @Override
        public Kind kind() {
            return Kind.BANNED;
        }

        @Override
        public boolean isMember() {
            return false;
        }

        @Override
        public RestrictedRights restrictedRights() {
            return RestrictedRights.none();
        }

        @Override
        public MembershipStatus withMember(boolean newMember) {
            return newMember ? Member.INSTANCE : this;
        }

        @Override
        public MembershipStatus withExpiredRestrictionsLifted(long nowEpochSeconds) {
            if (bannedUntil != 0 && bannedUntil <= nowEpochSeconds) {
                return Left.INSTANCE;
            }
            return this;
        }
    }

    record Left() implements MembershipStatus {

        static final Left INSTANCE = new Left();

        @Override
        public Kind kind() {
            return Kind.LEFT;
        }

        @Override
        public boolean isMember() {
            return false;
        }

        @Override
        public MembershipStatus withMember(boolean newMember) {
            return newMember ? Member.INSTANCE : this;
        }
    }
}
