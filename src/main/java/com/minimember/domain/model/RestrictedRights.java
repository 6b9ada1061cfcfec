package com.minimember.domain.model;

/**
 * 受限成员仍保留的权限位。置位 = 允许。
 */
public record RestrictedRights(int flags) {

    public static final int CAN_SEND_MESSAGES = 1;
    public static final int CAN_SEND_MEDIA = 1 << 1;
    public static final int CAN_SEND_STICKERS = 1 << 2;
    public static final int CAN_SEND_ANIMATIONS = 1 << 3;
    public static final int CAN_SEND_GAMES = 1 << 4;
    public static final int CAN_USE_INLINE_BOTS = 1 << 5;
    public static final int CAN_ADD_WEB_PAGE_PREVIEWS = 1 << 6;
    public static final int CAN_SEND_POLLS = 1 << 7;
    public static final int CAN_CHANGE_INFO = 1 << 8;
    public static final int CAN_INVITE_USERS = 1 << 9;
    public static final int CAN_PIN_MESSAGES = 1 << 10;

    public static final int ALL = CAN_SEND_MESSAGES | CAN_SEND_MEDIA | CAN_SEND_STICKERS | CAN_SEND_ANIMATIONS
            | CAN_SEND_GAMES | CAN_USE_INLINE_BOTS | CAN_ADD_WEB_PAGE_PREVIEWS | CAN_SEND_POLLS
            | CAN_CHANGE_INFO | CAN_INVITE_USERS | CAN_PIN_MESSAGES;

    private static final RestrictedRights FULL = new RestrictedRights(ALL);
    private static final RestrictedRights NONE = new RestrictedRights(0);

    public RestrictedRights {
        flags &= ALL;
    }

    public static RestrictedRights full() {
        return FULL;
    }

    public static RestrictedRights none() {
        return NONE;
    }

    public static RestrictedRights of(int... bits) {
        int out = 0;
        for (int b : bits) {
            out |= b;
        }
        return new RestrictedRights(out);
    }

    public boolean has(int bit) {
        return (flags & bit) == bit;
    }

    public boolean isFull() {
        return flags == ALL;
    }
}
