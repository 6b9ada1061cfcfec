package com.minimember.gateway.remote.op;

import com.minimember.domain.model.MembershipStatus;
import com.minimember.gateway.remote.RemoteOperation;

/**
 * 提升 / 降级管理员，也用于群主修改自己的头衔与匿名设置。status 为普通成员时表示撤销管理员。
 */
public record EditAdministrator(long conversationId, long userId, MembershipStatus status)
        implements RemoteOperation<Void> {
}
