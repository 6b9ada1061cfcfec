package com.minimember.domain.service.impl;

import com.minimember.common.exception.MembershipError;
import com.minimember.common.exception.MembershipException;
import com.minimember.domain.enums.ConversationKind;
import com.minimember.domain.model.ConversationInfo;
import com.minimember.domain.model.JoinRequest;
import com.minimember.domain.model.JoinRequestsPage;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.service.JoinRequestGateway;
import com.minimember.domain.service.MembershipCoordinator;
import com.minimember.gateway.identity.IdentityResolver;
import com.minimember.gateway.remote.op.GetJoinRequests;
import com.minimember.gateway.remote.op.HideAllJoinRequests;
import com.minimember.gateway.remote.op.HideJoinRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class JoinRequestGatewayImpl implements JoinRequestGateway {

    private final IdentityResolver identity;
    private final MembershipCoordinator coordinator;
    private final RemoteCalls calls;

    @Override
    public CompletableFuture<JoinRequestsPage> list(long conversationId, String inviteLink, String query, JoinRequest offset, int limit) {
        return calls.onWorker(() -> {
            checkCanManage(conversationId);
            if (limit <= 0) {
                throw new IllegalArgumentException("Parameter limit must be positive");
            }
            GetJoinRequests op = new GetJoinRequests(conversationId, blankToNull(inviteLink), query == null ? "" : query, offset, limit);
            return calls.call(op).thenApply(page -> {
                if (page.totalCount() < page.requests().size()) {
                    log.error("receive wrong join request total: conversationId={}, total={}, size={}",
                            conversationId, page.totalCount(), page.requests().size());
                    return new JoinRequestsPage(page.requests().size(), page.requests());
                }
                return page;
            });
        });
    }

    @Override
    public CompletableFuture<Void> approve(long conversationId, long userId, boolean approve) {
        return calls.onWorker(() -> {
            checkCanManage(conversationId);
            if (identity.user(userId) == null) {
                throw MembershipException.policy(MembershipError.MEMBER_NOT_FOUND, "User not found");
            }
            log.info("process join request: conversationId={}, userId={}, approve={}", conversationId, userId, approve);
            return calls.call(new HideJoinRequest(conversationId, userId, approve));
        });
    }

    @Override
    public CompletableFuture<Void> approveAll(long conversationId, String inviteLink, boolean approve) {
        return calls.onWorker(() -> {
            checkCanManage(conversationId);
            log.info("process all join requests: conversationId={}, inviteLink={}, approve={}", conversationId, inviteLink, approve);
            return calls.call(new HideAllJoinRequests(conversationId, blankToNull(inviteLink), approve));
        });
    }

    private void checkCanManage(long conversationId) {
        ConversationInfo info = identity.conversation(conversationId);
        if (info == null) {
            throw MembershipException.policy(MembershipError.CHAT_NOT_FOUND, "Chat not found");
        }
        if (info.kind().isOneToOne()) {
            throw MembershipException.policy(MembershipError.NOT_SUPPORTED, "The chat can't have join requests");
        }
        if (info.kind() == ConversationKind.BASIC_GROUP && !info.active()) {
            throw MembershipException.policy(MembershipError.NOT_SUPPORTED, "Chat is deactivated");
        }
        MembershipStatus caller = coordinator.callerStatus(conversationId);
        if (caller == null || !caller.isMember() || !caller.canManageInviteLinks()) {
            throw MembershipException.policy(MembershipError.NOT_ENOUGH_RIGHTS, "Not enough rights to manage chat join requests");
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
