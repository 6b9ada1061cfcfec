package com.minimember.domain.enums;

/**
 * 会话类型。
 *
 * <p>PRIVATE/SECRET 只有两个“伪成员”，不会进入状态规划；CHANNEL 同时覆盖广播频道与超级群。</p>
 */
public enum ConversationKind {
    PRIVATE,
    SECRET,
    BASIC_GROUP,
    CHANNEL;

    public boolean isOneToOne() {
        return this == PRIVATE || this == SECRET;
    }

    public static ConversationKind fromString(String s) {
        if (s == null) {
            return null;
        }
        return switch (s.trim().toUpperCase()) {
            case "PRIVATE" -> PRIVATE;
            case "SECRET" -> SECRET;
            case "BASIC_GROUP", "GROUP" -> BASIC_GROUP;
            case "CHANNEL", "SUPERGROUP" -> CHANNEL;
            default -> null;
        };
    }
}
