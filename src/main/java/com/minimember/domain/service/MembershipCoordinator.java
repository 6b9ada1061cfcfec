package com.minimember.domain.service;

import com.minimember.domain.enums.ParticipantFilter;
import com.minimember.domain.model.Administrator;
import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.Participant;
import com.minimember.domain.model.ParticipantsPage;
import com.minimember.domain.model.RejectedInvitees;
import com.minimember.gateway.notify.MembershipUpdate;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 成员子系统的唯一入口。
 *
 * <p>所有操作都在 membershipWorker 线程上执行，每个 future 只会有一个结果。
 * 本地规则拒绝时以 {@link com.minimember.common.exception.MembershipException} 失败，且不会发起远端请求。</p>
 */
public interface MembershipCoordinator {

    CompletableFuture<RejectedInvitees> addMember(long conversationId, long userId, int forwardHistoryLimit);

    CompletableFuture<RejectedInvitees> addMembers(long conversationId, List<Long> userIds);

    CompletableFuture<Void> setStatus(long conversationId, MemberRef member, MembershipStatus status);

    /**
     * @param bannedUntil epoch 秒，0 表示永久
     */
    CompletableFuture<Void> banMember(long conversationId, MemberRef member, int bannedUntil, boolean revokeMessages);

    CompletableFuture<Void> leave(long conversationId);

    CompletableFuture<Void> transferOwnership(long conversationId, long userId, String password);

    CompletableFuture<Participant> getParticipant(long conversationId, MemberRef member);

    CompletableFuture<ParticipantsPage> searchParticipants(long conversationId, String query, ParticipantFilter filter, int limit);

    CompletableFuture<List<Administrator>> getAdministrators(long conversationId);

    /**
     * 当前账号在会话中的状态（包含尚未确认的本地修改）。会话未知时返回 null。
     */
    MembershipStatus callerStatus(long conversationId);

    // ---------- 被动同步 ----------

    void conversationOpened(long conversationId);

    void conversationClosed(long conversationId);

    void onOnlineMemberCount(long conversationId, int count);

    void onParticipantUpdated(long conversationId, long actorUserId, int date, Participant oldParticipant, Participant newParticipant);

    void onAccessLost(long conversationId);

    void onCallerStatusChanged(long conversationId, MembershipStatus status);

    /**
     * 重放打开中会话的在线人数。
     */
    CompletableFuture<List<MembershipUpdate>> currentState();
}
