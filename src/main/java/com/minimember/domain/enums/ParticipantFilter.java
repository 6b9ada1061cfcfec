package com.minimember.domain.enums;

/**
 * 成员搜索过滤条件。
 */
public enum ParticipantFilter {
    RECENT,
    CONTACTS,
    ADMINISTRATORS,
    MEMBERS,
    RESTRICTED,
    BANNED,
    BOTS;

    public static ParticipantFilter fromString(String s) {
        if (s == null || s.isBlank()) {
            return RECENT;
        }
        return switch (s.trim().toUpperCase()) {
            case "CONTACTS" -> CONTACTS;
            case "ADMINISTRATORS", "ADMINS" -> ADMINISTRATORS;
            case "MEMBERS" -> MEMBERS;
            case "RESTRICTED" -> RESTRICTED;
            case "BANNED" -> BANNED;
            case "BOTS" -> BOTS;
            default -> RECENT;
        };
    }
}
