package com.minimember.gateway.notify;

/**
 * 推给界面层的更新。
 */
public interface MembershipUpdate {

    long conversationId();
}
