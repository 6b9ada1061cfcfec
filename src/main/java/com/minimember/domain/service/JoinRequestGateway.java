package com.minimember.domain.service;

import com.minimember.domain.model.JoinRequest;
import com.minimember.domain.model.JoinRequestsPage;

import java.util.concurrent.CompletableFuture;

/**
 * 入群申请：列出、通过、拒绝。需要“管理邀请链接”权限，权限不足时不会发起远端请求。
 */
public interface JoinRequestGateway {

    /**
     * @param inviteLink 只看通过该链接提交的申请，null 表示全部
     * @param offset     上一页最后一条，首页为 null
     */
    CompletableFuture<JoinRequestsPage> list(long conversationId, String inviteLink, String query, JoinRequest offset, int limit);

    CompletableFuture<Void> approve(long conversationId, long userId, boolean approve);

    CompletableFuture<Void> approveAll(long conversationId, String inviteLink, boolean approve);
}
