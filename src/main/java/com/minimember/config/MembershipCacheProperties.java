package com.minimember.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "membership.cache")
public class MembershipCacheProperties {

    /** 成员缓存最后一次访问后的存活时间 */
    private long participantTtlSeconds = 1800;

    /** 管理员列表是否写入持久化存储 */
    private boolean administratorStoreEnabled = true;

    private String storeKeyPrefix = "mm:store:";

    private int localStoreMaxEntries = 10_000;

    public long getParticipantTtlSeconds() {
        return participantTtlSeconds;
    }

    public void setParticipantTtlSeconds(long participantTtlSeconds) {
        this.participantTtlSeconds = participantTtlSeconds;
    }

    public boolean isAdministratorStoreEnabled() {
        return administratorStoreEnabled;
    }

    public void setAdministratorStoreEnabled(boolean administratorStoreEnabled) {
        this.administratorStoreEnabled = administratorStoreEnabled;
    }

    public String getStoreKeyPrefix() {
        return storeKeyPrefix;
    }

    public void setStoreKeyPrefix(String storeKeyPrefix) {
        this.storeKeyPrefix = storeKeyPrefix;
    }

    public int getLocalStoreMaxEntries() {
        return localStoreMaxEntries;
    }

    public void setLocalStoreMaxEntries(int localStoreMaxEntries) {
        this.localStoreMaxEntries = localStoreMaxEntries;
    }
}
