package com.minimember.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "membership.plan")
public record MembershipPlanProperties(
        Integer readdDelayMs,
        Integer transientBanSeconds,
        Integer searchLimitMax
) {

    public static MembershipPlanProperties defaults() {
        return new MembershipPlanProperties(null, null, null);
    }

    /**
     * 先踢后加两步之间的等待。远端要求两次操作之间有间隔。
     */
    public int readdDelayMsEffective() {
        Integer v = readdDelayMs;
        if (v == null) {
            return 1000;
        }
        return Math.max(0, v);
    }

    public int transientBanSecondsEffective() {
        Integer v = transientBanSeconds;
        if (v == null) {
            return 60;
        }
        return Math.max(1, v);
    }

    public int searchLimitMaxEffective() {
        Integer v = searchLimitMax;
        if (v == null) {
            return 200;
        }
        return Math.max(1, v);
    }
}
