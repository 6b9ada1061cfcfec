package com.minimember.domain.model;

/**
 * 管理员权限位集合。
 *
 * <p>只在 {@link MembershipStatus.Administrator} 上出现；群主隐含全部权限。</p>
 */
public record AdministratorRights(int flags) {

    public static final int CAN_CHANGE_INFO = 1;
    public static final int CAN_POST_MESSAGES = 1 << 1;
    public static final int CAN_EDIT_MESSAGES = 1 << 2;
    public static final int CAN_DELETE_MESSAGES = 1 << 3;
    public static final int CAN_INVITE_USERS = 1 << 4;
    public static final int CAN_MANAGE_INVITE_LINKS = 1 << 5;
    public static final int CAN_RESTRICT_MEMBERS = 1 << 6;
    public static final int CAN_PIN_MESSAGES = 1 << 7;
    public static final int CAN_PROMOTE_MEMBERS = 1 << 8;
    public static final int CAN_MANAGE_VIDEO_CHATS = 1 << 9;
    public static final int IS_ANONYMOUS = 1 << 10;

    public static final int ALL = CAN_CHANGE_INFO | CAN_POST_MESSAGES | CAN_EDIT_MESSAGES | CAN_DELETE_MESSAGES
            | CAN_INVITE_USERS | CAN_MANAGE_INVITE_LINKS | CAN_RESTRICT_MEMBERS | CAN_PIN_MESSAGES
            | CAN_PROMOTE_MEMBERS | CAN_MANAGE_VIDEO_CHATS;

    private static final AdministratorRights NONE = new AdministratorRights(0);

    public AdministratorRights {
        flags &= ALL | IS_ANONYMOUS;
    }

    public static AdministratorRights none() {
        return NONE;
    }

    public static AdministratorRights of(int... bits) {
        int out = 0;
        for (int b : bits) {
            out |= b;
        }
        return new AdministratorRights(out);
    }

    public boolean has(int bit) {
        return (flags & bit) == bit;
    }

    public boolean isEmpty() {
        return (flags & ALL) == 0;
    }

    public boolean canInviteUsers() {
        return has(CAN_INVITE_USERS);
    }

    public boolean canManageInviteLinks() {
        return has(CAN_MANAGE_INVITE_LINKS) || has(CAN_INVITE_USERS);
    }

    public boolean canRestrictMembers() {
        return has(CAN_RESTRICT_MEMBERS);
    }

    public boolean canPromoteMembers() {
        return has(CAN_PROMOTE_MEMBERS);
    }

    public boolean isAnonymous() {
        return has(IS_ANONYMOUS);
    }
}
