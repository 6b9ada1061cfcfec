package com.minimember.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 当前进程代表的账号。
 */
@ConfigurationProperties(prefix = "membership")
public class MembershipProperties {

    private long selfUserId;

    /** 以服务账号（机器人）身份运行：不能拉人，需要广播成员变更 */
    private boolean serviceAccount;

    public long getSelfUserId() {
        return selfUserId;
    }

    public void setSelfUserId(long selfUserId) {
        this.selfUserId = selfUserId;
    }

    public boolean isServiceAccount() {
        return serviceAccount;
    }

    public void setServiceAccount(boolean serviceAccount) {
        this.serviceAccount = serviceAccount;
    }
}
