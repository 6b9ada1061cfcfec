package com.minimember.gateway.remote.op;

import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.gateway.remote.RemoteOperation;

/**
 * 修改受限 / 封禁状态。status 为 Left 或 Member 时表示解除。
 */
public record EditRestrictions(long conversationId, MemberRef member, MembershipStatus status)
        implements RemoteOperation<Void> {
}
