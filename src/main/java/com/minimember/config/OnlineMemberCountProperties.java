package com.minimember.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "membership.online")
public record OnlineMemberCountProperties(
        Integer updateIntervalSeconds,
        Integer expireSeconds,
        Integer localCountMaxMembers,
        Integer activityWindowSeconds
) {

    public static OnlineMemberCountProperties defaults() {
        return new OnlineMemberCountProperties(null, null, null, null);
    }

    public int updateIntervalSecondsEffective() {
        Integer v = updateIntervalSeconds;
        if (v == null) {
            return 300;
        }
        return Math.max(1, v);
    }

    public int expireSecondsEffective() {
        Integer v = expireSeconds;
        if (v == null) {
            return 1800;
        }
        return Math.max(1, v);
    }

    /**
     * 成员数小于该值的超级群用本地成员缓存估算在线人数。
     */
    public int localCountMaxMembersEffective() {
        Integer v = localCountMaxMembers;
        if (v == null) {
            return 195;
        }
        return Math.max(0, v);
    }

    public int activityWindowSecondsEffective() {
        Integer v = activityWindowSeconds;
        if (v == null) {
            return 120;
        }
        return Math.max(1, v);
    }
}
