package com.minimember.domain.service.impl;

import com.minimember.common.concurrent.Futures;
import com.minimember.common.exception.MembershipError;
import com.minimember.common.exception.MembershipException;
import com.minimember.config.MembershipPlanProperties;
import com.minimember.config.MembershipProperties;
import com.minimember.domain.cache.AdministratorRegistry;
import com.minimember.domain.cache.OnlineMemberCounter;
import com.minimember.domain.cache.ParticipantCache;
import com.minimember.domain.enums.ConversationKind;
import com.minimember.domain.enums.ParticipantFilter;
import com.minimember.domain.model.Administrator;
import com.minimember.domain.model.ConversationInfo;
import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.Participant;
import com.minimember.domain.model.ParticipantsPage;
import com.minimember.domain.model.RejectedInvitees;
import com.minimember.domain.model.UserInfo;
import com.minimember.domain.planner.PlanContext;
import com.minimember.domain.planner.PlanExecution;
import com.minimember.domain.planner.PlanStep;
import com.minimember.domain.planner.SpeculativeChange;
import com.minimember.domain.planner.StatusTransitionPlanner;
import com.minimember.domain.planner.TransitionPlan;
import com.minimember.domain.service.MembershipCoordinator;
import com.minimember.domain.service.MembershipLifecycle;
import com.minimember.gateway.identity.IdentityResolver;
import com.minimember.gateway.notify.AddMembersPrivacyForbidden;
import com.minimember.gateway.notify.MemberChanged;
import com.minimember.gateway.notify.MembershipUpdate;
import com.minimember.gateway.notify.MembershipUpdateSink;
import com.minimember.gateway.remote.op.AddChatMember;
import com.minimember.gateway.remote.op.DeleteChatMember;
import com.minimember.gateway.remote.op.DeleteMemberHistory;
import com.minimember.gateway.remote.op.EditAdministrator;
import com.minimember.gateway.remote.op.EditRestrictions;
import com.minimember.gateway.remote.op.GetParticipant;
import com.minimember.gateway.remote.op.InviteMembers;
import com.minimember.gateway.remote.op.JoinConversation;
import com.minimember.gateway.remote.op.LeaveConversation;
import com.minimember.gateway.remote.op.SearchParticipants;
import com.minimember.gateway.remote.op.TransferOwnership;
import com.minimember.gateway.timer.TimerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 成员状态协调器。
 *
 * <p>修改类操作的流程：解析旧状态 -> 规划 -> 每一步先本地预生效再发远端 -> 失败只撤销当前这一步。
 * 管理员列表、成员缓存、在线人数和本人状态只在这里被修改，并且只在 worker 线程上修改。</p>
 */
@Slf4j
@Service
public class MembershipCoordinatorImpl implements MembershipCoordinator {

    private final MembershipProperties props;
    private final MembershipPlanProperties planProps;
    private final StatusTransitionPlanner planner;
    private final ParticipantCache participantCache;
    private final AdministratorRegistry administratorRegistry;
    private final OnlineMemberCounter onlineCounter;
    private final IdentityResolver identity;
    private final MembershipUpdateSink sink;
    private final TimerService timers;
    private final RemoteCalls calls;
    private final MembershipLifecycle lifecycle;
    private final Executor worker;
    private final Clock clock;

    /** 本人状态：本地修改过或收到过推送的会话，优先于身份服务给出的快照 */
    private final Map<Long, MembershipStatus> ownStatuses = new ConcurrentHashMap<>();

    /** 同一会话并发的加入请求合并成一次 */
    private final Map<Long, CompletableFuture<Void>> pendingJoins = new HashMap<>();

    public MembershipCoordinatorImpl(MembershipProperties props,
                                     MembershipPlanProperties planProps,
                                     StatusTransitionPlanner planner,
                                     ParticipantCache participantCache,
                                     AdministratorRegistry administratorRegistry,
                                     OnlineMemberCounter onlineCounter,
                                     IdentityResolver identity,
                                     MembershipUpdateSink sink,
                                     TimerService timers,
                                     RemoteCalls calls,
                                     MembershipLifecycle lifecycle,
                                     @Qualifier("membershipWorker") Executor worker,
                                     Clock clock) {
        this.props = props;
        this.planProps = planProps;
        this.planner = planner;
        this.participantCache = participantCache;
        this.administratorRegistry = administratorRegistry;
        this.onlineCounter = onlineCounter;
        this.identity = identity;
        this.sink = sink;
        this.timers = timers;
        this.calls = calls;
        this.lifecycle = lifecycle;
        this.worker = worker;
        this.clock = clock;
    }

    // ---------- add ----------

    @Override
    public CompletableFuture<RejectedInvitees> addMember(long conversationId, long userId, int forwardHistoryLimit) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                throw notSupported("Can't add members to a private chat");
            }
            requireKnownUser(userId);
            if (info.kind() == ConversationKind.BASIC_GROUP) {
                return addBasicGroupMember(info, userId, forwardHistoryLimit);
            }
            if (userId == selfUserId()) {
                return joinChannel(info).thenApply(v -> RejectedInvitees.none());
            }
            return inviteToChannel(info, List.of(userId));
        });
    }

    @Override
    public CompletableFuture<RejectedInvitees> addMembers(long conversationId, List<Long> userIds) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                throw notSupported("Can't add members to a private chat");
            }
            List<Long> ids = userIds == null ? List.of() : userIds;
            if (info.kind() == ConversationKind.BASIC_GROUP) {
                if (ids.size() != 1) {
                    throw notSupported("Can't add many members at once to a basic group chat");
                }
                requireKnownUser(ids.get(0));
                return addBasicGroupMember(info, ids.get(0), 0);
            }
            List<Long> targets = new ArrayList<>();
            for (Long id : new LinkedHashSet<>(ids)) {
                if (id == null || id == selfUserId()) {
                    // 不能邀请自己
                    continue;
                }
                requireKnownUser(id);
                targets.add(id);
            }
            if (targets.isEmpty()) {
                return CompletableFuture.completedFuture(RejectedInvitees.none());
            }
            return inviteToChannel(info, targets);
        });
    }

    private CompletableFuture<RejectedInvitees> addBasicGroupMember(ConversationInfo info, long userId, int forwardHistoryLimit) {
        if (props.isServiceAccount()) {
            throw notSupported("Bots can't add new chat members");
        }
        if (forwardHistoryLimit < 0) {
            throw new IllegalArgumentException("Can't forward negative number of messages");
        }
        if (!info.active()) {
            throw notSupported("Chat is deactivated");
        }
        MembershipStatus own = ownStatus(info);
        if (userId != selfUserId() && !planContext(info, MemberRef.user(userId)).callerCanInviteUsers()) {
            throw rights("Not enough rights to invite members to the group chat");
        }
        if (userId == selfUserId() && own.isMember()) {
            return CompletableFuture.completedFuture(RejectedInvitees.none());
        }
        long conversationId = info.id();
        return calls.call(new AddChatMember(conversationId, userId, forwardHistoryLimit))
                .handle((rejected, err) -> {
                    if (err == null) {
                        reportPrivacyForbidden(conversationId, rejected);
                        return rejected == null ? RejectedInvitees.none() : rejected;
                    }
                    if (RemoteErrors.is(err, RemoteErrors.USER_PRIVACY_RESTRICTED)) {
                        RejectedInvitees all = new RejectedInvitees(List.of(userId));
                        reportPrivacyForbidden(conversationId, all);
                        return all;
                    }
                    throw new CompletionException(Futures.unwrap(err));
                });
    }

    private CompletableFuture<RejectedInvitees> inviteToChannel(ConversationInfo info, List<Long> userIds) {
        if (props.isServiceAccount()) {
            throw notSupported("Bots can't add new chat members");
        }
        MembershipStatus own = ownStatus(info);
        if (!own.isMember()) {
            throw rights("Not in the chat");
        }
        if (!planContext(info, MemberRef.user(userIds.get(0))).callerCanInviteUsers()) {
            throw rights("Not enough rights to invite members to the supergroup chat");
        }
        long conversationId = info.id();
        Map<Long, SpeculativeChange> changes = new HashMap<>();
        for (Long userId : userIds) {
            MemberRef member = MemberRef.user(userId);
            Participant cached = participantCache.peek(conversationId, member);
            MembershipStatus before = cached == null ? MembershipStatus.left() : cached.status();
            if (!before.isMember()) {
                changes.put(userId, speculate(info, member, before, MembershipStatus.member()));
            }
        }
        log.info("invite members: conversationId={}, userIds={}", conversationId, userIds);
        return calls.call(new InviteMembers(conversationId, userIds))
                .handle((rejected, err) -> {
                    if (err == null) {
                        RejectedInvitees out = rejected == null ? RejectedInvitees.none() : rejected;
                        for (Long userId : out.userIds()) {
                            revertIfPresent(changes.get(userId));
                        }
                        reportPrivacyForbidden(conversationId, out);
                        return out;
                    }
                    changes.values().forEach(this::revert);
                    if (RemoteErrors.is(err, RemoteErrors.USER_PRIVACY_RESTRICTED)) {
                        RejectedInvitees all = new RejectedInvitees(userIds);
                        reportPrivacyForbidden(conversationId, all);
                        return all;
                    }
                    throw new CompletionException(Futures.unwrap(err));
                });
    }

    private CompletableFuture<Void> joinChannel(ConversationInfo info) {
        long conversationId = info.id();
        // 推测状态已是成员，进行中的加入必须先于成员判断返回
        CompletableFuture<Void> pending = pendingJoins.get(conversationId);
        if (pending != null) {
            return pending;
        }
        MembershipStatus own = ownStatus(info);
        if (own.isMember()) {
            return CompletableFuture.completedFuture(null);
        }
        if (own.isBanned()) {
            throw invalid("Can't return to kicked from chat");
        }
        MemberRef self = MemberRef.user(selfUserId());
        MembershipStatus target = own.isCreator() ? own.withMember(true) : MembershipStatus.member();
        SpeculativeChange change = speculate(info, self, own, target);
        log.info("join conversation: conversationId={}", conversationId);
        CompletableFuture<Void> joined = calls.call(new JoinConversation(conversationId))
                .whenComplete((v, err) -> {
                    pendingJoins.remove(conversationId);
                    if (err != null) {
                        revert(change);
                    }
                });
        if (!joined.isDone()) {
            pendingJoins.put(conversationId, joined);
        }
        return joined;
    }

    private void reportPrivacyForbidden(long conversationId, RejectedInvitees rejected) {
        if (rejected != null && !rejected.isEmpty()) {
            sink.notify(new AddMembersPrivacyForbidden(conversationId, rejected.userIds()));
        }
    }

    // ---------- status ----------

    @Override
    public CompletableFuture<Void> setStatus(long conversationId, MemberRef member, MembershipStatus status) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                throw notSupported("Chat member status can't be changed in private chats");
            }
            requireKnownMember(member);
            if (status == null) {
                throw new IllegalArgumentException("Chat member status must be non-empty");
            }
            return changeStatus(info, member, status, false);
        });
    }

    @Override
    public CompletableFuture<Void> banMember(long conversationId, MemberRef member, int bannedUntil, boolean revokeMessages) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                throw notSupported("Can't ban members in private chats");
            }
            requireKnownMember(member);
            if (info.kind() == ConversationKind.BASIC_GROUP) {
                if (!member.isUser()) {
                    throw invalid("Can't ban chats in basic groups");
                }
                // 基础群没有封禁期限，封禁即移除
                return changeStatus(info, member, MembershipStatus.banned(0), revokeMessages);
            }
            return changeStatus(info, member, MembershipStatus.banned(bannedUntil), revokeMessages);
        });
    }

    @Override
    public CompletableFuture<Void> leave(long conversationId) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                throw notSupported("Can't leave private chats");
            }
            MembershipStatus own = ownStatus(info);
            if (!own.isMember()) {
                return CompletableFuture.completedFuture(null);
            }
            MembershipStatus target = own.isCreator() ? own.withMember(false) : MembershipStatus.left();
            return executePlan(info, MemberRef.user(selfUserId()), own, target, false);
        });
    }

    private CompletableFuture<Void> changeStatus(ConversationInfo info, MemberRef member, MembershipStatus status, boolean revokeMessages) {
        return resolveStatus(info, member)
                .thenCompose(old -> executePlan(info, member, old, status, revokeMessages));
    }

    private CompletableFuture<MembershipStatus> resolveStatus(ConversationInfo info, MemberRef member) {
        if (isSelf(member)) {
            return CompletableFuture.completedFuture(ownStatus(info));
        }
        if (!member.isUser()) {
            // 会话身份的成员旧状态不可靠，规划时总是当作有变化
            return CompletableFuture.completedFuture(MembershipStatus.left());
        }
        return fetchParticipant(info, member).thenApply(Participant::status);
    }

    private CompletableFuture<Void> executePlan(ConversationInfo info, MemberRef member, MembershipStatus old,
                                                MembershipStatus target, boolean revokeMessages) {
        TransitionPlan plan = planner.plan(old, target, planContext(info, member));
        if (plan.isNoOp()) {
            log.debug("status unchanged, skip: conversationId={}, member={}, status={}", info.id(), member, target);
            return CompletableFuture.completedFuture(null);
        }
        log.info("change status of {} in {} from {} to {}, steps={}", member, info.id(), old, target, plan.types());

        MembershipStatus[] visible = {old};
        PlanExecution.StepHandler handler = new PlanExecution.StepHandler() {
            @Override
            public SpeculativeChange apply(PlanStep step) {
                SpeculativeChange change = speculate(info, member, visible[0], step.visible());
                visible[0] = step.visible();
                return change;
            }

            @Override
            public CompletableFuture<Void> send(PlanStep step) {
                return sendStep(info, member, step, revokeMessages);
            }

            @Override
            public void revert(SpeculativeChange change) {
                visible[0] = change.before();
                MembershipCoordinatorImpl.this.revert(change);
            }
        };
        CompletableFuture<Void> done = new PlanExecution(plan, handler, timers, worker, lifecycle::isRunning).start();
        if (revokeMessages && info.kind() == ConversationKind.CHANNEL && target.isBanned()) {
            return done.thenCompose(v -> calls.call(new DeleteMemberHistory(info.id(), member)));
        }
        return done;
    }

    private CompletableFuture<Void> sendStep(ConversationInfo info, MemberRef member, PlanStep step, boolean revokeMessages) {
        long conversationId = info.id();
        boolean self = isSelf(member);
        if (info.kind() == ConversationKind.BASIC_GROUP) {
            return switch (step.type()) {
                case ADD -> calls.call(new AddChatMember(conversationId, member.id(), 0)).thenAccept(rejected -> {
                    if (rejected != null && !rejected.isEmpty()) {
                        reportPrivacyForbidden(conversationId, rejected);
                        throw new MembershipException(MembershipError.PRIVACY_RESTRICTED, RemoteErrors.USER_PRIVACY_RESTRICTED);
                    }
                });
                case PROMOTE -> calls.call(new EditAdministrator(conversationId, member.id(), step.sent()));
                case RESTRICT, BAN -> self
                        ? leaveRemote(info)
                        : calls.call(new DeleteChatMember(conversationId, member.id(), revokeMessages));
            };
        }
        return switch (step.type()) {
            case ADD -> self
                    ? calls.call(new JoinConversation(conversationId))
                    : calls.call(new InviteMembers(conversationId, List.of(member.id()))).thenAccept(rejected -> {
                        if (rejected != null && !rejected.isEmpty()) {
                            reportPrivacyForbidden(conversationId, rejected);
                            throw new MembershipException(MembershipError.PRIVACY_RESTRICTED, RemoteErrors.USER_PRIVACY_RESTRICTED);
                        }
                    });
            case PROMOTE -> calls.call(new EditAdministrator(conversationId, member.id(), step.sent()));
            case RESTRICT, BAN -> self
                    ? leaveRemote(info)
                    : calls.call(new EditRestrictions(conversationId, member, step.sent()));
        };
    }

    /**
     * 远端说本人已经不在会话里，按离开成功处理。
     */
    private CompletableFuture<Void> leaveRemote(ConversationInfo info) {
        return calls.call(new LeaveConversation(info.id())).handle((v, err) -> {
            if (err == null) {
                return null;
            }
            if (RemoteErrors.is(err, RemoteErrors.USER_NOT_PARTICIPANT)) {
                log.info("already left conversation: conversationId={}", info.id());
                return null;
            }
            throw new CompletionException(Futures.unwrap(err));
        });
    }

    // ---------- ownership ----------

    @Override
    public CompletableFuture<Void> transferOwnership(long conversationId, long userId, String password) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                throw notSupported("Can't transfer ownership of private chats");
            }
            if (!ownStatus(info).isCreator()) {
                throw rights("Not enough rights to transfer chat ownership");
            }
            if (userId == selfUserId()) {
                throw invalid("Can't transfer chat ownership to self");
            }
            requireKnownUser(userId);
            log.info("transfer ownership: conversationId={}, userId={}", conversationId, userId);
            return calls.call(new TransferOwnership(conversationId, userId, password == null ? "" : password))
                    .thenRun(() -> {
                        ownStatuses.remove(conversationId);
                        participantCache.remove(conversationId, MemberRef.user(userId));
                        participantCache.remove(conversationId, MemberRef.user(selfUserId()));
                        administratorRegistry.revalidate(conversationId).whenComplete((v, err) -> {
                            if (err != null) {
                                log.debug("administrators reload after transfer failed: conversationId={}, err={}",
                                        conversationId, Futures.unwrap(err).toString());
                            }
                        });
                    });
        });
    }

    // ---------- queries ----------

    @Override
    public CompletableFuture<Participant> getParticipant(long conversationId, MemberRef member) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            requireKnownMember(member);
            return fetchParticipant(info, member);
        });
    }

    private CompletableFuture<Participant> fetchParticipant(ConversationInfo info, MemberRef member) {
        long conversationId = info.id();
        if (info.kind().isOneToOne()) {
            return CompletableFuture.completedFuture(privateParticipant(info, member));
        }
        if (isSelf(member)) {
            return CompletableFuture.completedFuture(new Participant(member, 0L, 0, ownStatus(info)));
        }
        if (info.kind() == ConversationKind.BASIC_GROUP && !member.isUser()) {
            return CompletableFuture.completedFuture(Participant.of(member, MembershipStatus.left()));
        }
        boolean cacheEnabled = participantCacheEnabled(info);
        if (cacheEnabled) {
            Participant hit = participantCache.lookup(conversationId, member);
            if (hit != null) {
                return CompletableFuture.completedFuture(hit);
            }
        }
        return calls.call(new GetParticipant(conversationId, member)).handle((p, err) -> {
            if (err != null) {
                if (RemoteErrors.is(err, RemoteErrors.USER_NOT_PARTICIPANT)) {
                    return Participant.of(member, MembershipStatus.left());
                }
                throw new CompletionException(Futures.unwrap(err));
            }
            if (p == null || !p.isValid() || !member.equals(p.who())) {
                log.error("receive invalid chat member: conversationId={}, member={}, participant={}", conversationId, member, p);
                throw MembershipException.dataUnavailable();
            }
            Participant out = p.withStatus(p.status().withExpiredRestrictionsLifted(nowSeconds()));
            if (cacheEnabled) {
                participantCache.insertOrRefresh(conversationId, out, false);
            }
            return out;
        });
    }

    private Participant privateParticipant(ConversationInfo info, MemberRef member) {
        long self = selfUserId();
        long peer = info.peerUserId();
        if (member.isUser() && member.id() == self) {
            return new Participant(member, peer, 0, MembershipStatus.member());
        }
        if (member.isUser() && member.id() == peer) {
            return new Participant(member, self, 0, MembershipStatus.member());
        }
        return Participant.of(member, MembershipStatus.left());
    }

    @Override
    public CompletableFuture<ParticipantsPage> searchParticipants(long conversationId, String query, ParticipantFilter filter, int limit) {
        return calls.onWorker(() -> {
            if (limit <= 0) {
                throw new IllegalArgumentException("Parameter limit must be positive");
            }
            int effectiveLimit = Math.min(limit, planProps.searchLimitMaxEffective());
            ParticipantFilter f = filter == null ? ParticipantFilter.RECENT : filter;
            String q = query == null ? "" : query.trim();
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                return CompletableFuture.completedFuture(searchPrivate(info, f, effectiveLimit));
            }
            return calls.call(new SearchParticipants(conversationId, f, q, 0, effectiveLimit))
                    .thenApply(page -> onParticipantsFound(info, f, q, page));
        });
    }

    private ParticipantsPage onParticipantsFound(ConversationInfo info, ParticipantFilter filter, String query, ParticipantsPage page) {
        long conversationId = info.id();
        boolean cacheEnabled = participantCacheEnabled(info);
        long now = nowSeconds();
        List<Participant> valid = new ArrayList<>(page.participants().size());
        for (Participant p : page.participants()) {
            if (p == null || !p.isValid()) {
                log.error("receive invalid chat member: conversationId={}, participant={}", conversationId, p);
                continue;
            }
            Participant lifted = p.withStatus(p.status().withExpiredRestrictionsLifted(now));
            valid.add(lifted);
            if (cacheEnabled) {
                participantCache.insertOrRefresh(conversationId, lifted, false);
            }
        }
        int total = page.totalCount();
        if (total < valid.size()) {
            log.error("receive wrong participant total: conversationId={}, total={}, size={}", conversationId, total, valid.size());
            total = valid.size();
        }
        if (filter == ParticipantFilter.ADMINISTRATORS && query.isEmpty() && total == valid.size()) {
            List<Administrator> admins = new ArrayList<>();
            for (Participant p : valid) {
                if (p.who().isUser() && p.status().isAdministrator()) {
                    admins.add(new Administrator(p.who().id(), p.status().rank(), p.status().isCreator()));
                }
            }
            administratorRegistry.replace(conversationId, admins, true, false);
        }
        return new ParticipantsPage(total, valid);
    }

    private ParticipantsPage searchPrivate(ConversationInfo info, ParticipantFilter filter, int limit) {
        List<Participant> out = new ArrayList<>();
        for (long userId : new long[]{selfUserId(), info.peerUserId()}) {
            if (userId <= 0 || out.size() >= limit) {
                continue;
            }
            UserInfo user = identity.user(userId);
            boolean include = switch (filter) {
                case ADMINISTRATORS, RESTRICTED, BANNED -> false;
                case BOTS -> user != null && user.bot();
                case CONTACTS -> user != null && user.contact();
                default -> true;
            };
            if (include) {
                out.add(privateParticipant(info, MemberRef.user(userId)));
            }
        }
        return new ParticipantsPage(out.size(), out);
    }

    @Override
    public CompletableFuture<List<Administrator>> getAdministrators(long conversationId) {
        return calls.onWorker(() -> {
            ConversationInfo info = requireConversation(conversationId);
            if (info.kind().isOneToOne()) {
                return CompletableFuture.completedFuture(List.of());
            }
            MembershipStatus own = ownStatus(info);
            if (info.kind() == ConversationKind.BASIC_GROUP && !own.isMember()) {
                return CompletableFuture.completedFuture(List.of());
            }
            if (info.isBroadcastChannel() && !own.isAdministrator()) {
                throw rights("Administrator list is inaccessible");
            }
            return administratorRegistry.get(conversationId);
        });
    }

    @Override
    public MembershipStatus callerStatus(long conversationId) {
        ConversationInfo info = identity.conversation(conversationId);
        return info == null ? null : ownStatus(info);
    }

    // ---------- passive ----------

    @Override
    public void conversationOpened(long conversationId) {
        calls.runOnWorker("conversationOpened", () -> onlineCounter.opened(conversationId));
    }

    @Override
    public void conversationClosed(long conversationId) {
        calls.runOnWorker("conversationClosed", () -> {
            onlineCounter.closed(conversationId);
            participantCache.invalidateConversation(conversationId);
        });
    }

    @Override
    public void onOnlineMemberCount(long conversationId, int count) {
        calls.runOnWorker("onOnlineMemberCount", () -> {
            ConversationInfo info = identity.conversation(conversationId);
            if (info == null) {
                return;
            }
            if (info.isBroadcastChannel() && count != 0) {
                log.error("receive online member count in a broadcast channel: conversationId={}, count={}", conversationId, count);
                return;
            }
            onlineCounter.observe(conversationId, count, true);
        });
    }

    @Override
    public void onParticipantUpdated(long conversationId, long actorUserId, int date, Participant oldParticipant, Participant newParticipant) {
        calls.runOnWorker("onParticipantUpdated", () -> {
            ConversationInfo info = identity.conversation(conversationId);
            if (info == null || info.kind().isOneToOne()) {
                log.debug("participant update for unknown conversation ignored: conversationId={}", conversationId);
                return;
            }
            if (newParticipant == null || !newParticipant.isValid()) {
                log.error("receive invalid chat member update: conversationId={}, participant={}", conversationId, newParticipant);
                return;
            }
            MemberRef who = newParticipant.who();
            MembershipStatus status = newParticipant.status().withExpiredRestrictionsLifted(nowSeconds());
            if (isSelf(who)) {
                applyCallerStatus(info, status);
            } else {
                if (participantCacheEnabled(info)) {
                    participantCache.insertOrRefresh(conversationId, newParticipant.withStatus(status), true);
                }
                if (who.isUser()) {
                    MembershipStatus before = oldParticipant == null ? MembershipStatus.left() : oldParticipant.status();
                    administratorRegistry.speculativeUpdate(conversationId, who.id(), status, before);
                }
            }
            if (props.isServiceAccount()) {
                sink.notify(new MemberChanged(conversationId, actorUserId, date, oldParticipant, newParticipant));
            }
        });
    }

    @Override
    public void onAccessLost(long conversationId) {
        calls.runOnWorker("onAccessLost", () -> {
            log.info("access lost, drop membership caches: conversationId={}", conversationId);
            administratorRegistry.invalidate(conversationId);
            participantCache.invalidateConversation(conversationId);
        });
    }

    @Override
    public void onCallerStatusChanged(long conversationId, MembershipStatus status) {
        calls.runOnWorker("onCallerStatusChanged", () -> {
            ConversationInfo info = identity.conversation(conversationId);
            if (info == null || status == null) {
                return;
            }
            applyCallerStatus(info, status);
        });
    }

    @Override
    public CompletableFuture<List<MembershipUpdate>> currentState() {
        return calls.onWorker(() -> CompletableFuture.completedFuture(onlineCounter.currentUpdates()));
    }

    private void applyCallerStatus(ConversationInfo info, MembershipStatus status) {
        long conversationId = info.id();
        MembershipStatus prev = ownStatus(info);
        ownStatuses.put(conversationId, status);
        if (prev.isAdministrator() && !status.isAdministrator()) {
            participantCache.invalidateConversation(conversationId);
        }
        boolean lostAccess = status.isBanned() || (!status.isMember() && info.kind() == ConversationKind.BASIC_GROUP)
                || (info.isBroadcastChannel() && !status.isAdministrator());
        if (lostAccess) {
            administratorRegistry.invalidate(conversationId);
        } else if (prev.isAdministrator() != status.isAdministrator() && administratorRegistry.cached(conversationId) != null) {
            administratorRegistry.revalidate(conversationId).whenComplete((v, err) -> {
                if (err != null) {
                    log.debug("administrators reload failed: conversationId={}, err={}", conversationId, Futures.unwrap(err).toString());
                }
            });
        }
    }

    // ---------- speculative ----------

    private SpeculativeChange speculate(ConversationInfo info, MemberRef member, MembershipStatus before, MembershipStatus applied) {
        long conversationId = info.id();
        boolean synthesized = false;
        if (participantCacheEnabled(info) && !isSelf(member)) {
            if (participantCache.peek(conversationId, member) != null) {
                participantCache.updateStatus(conversationId, member, applied);
            } else {
                Participant p = new Participant(member, selfUserId(), (int) nowSeconds(), applied);
                if (p.isValid()) {
                    participantCache.insertOrRefresh(conversationId, p, false);
                    synthesized = true;
                }
            }
        }
        if (member.isUser()) {
            administratorRegistry.speculativeUpdate(conversationId, member.id(), applied, before);
        }
        MembershipStatus ownBefore = null;
        if (isSelf(member)) {
            ownBefore = ownStatus(info);
            ownStatuses.put(conversationId, applied);
            if (ownBefore.isAdministrator() && !applied.isAdministrator()) {
                participantCache.invalidateConversation(conversationId);
            }
        }
        return new SpeculativeChange(conversationId, member, before, applied, synthesized, ownBefore);
    }

    /**
     * 尽力撤销：缓存记录已被淘汰或已被更新的值覆盖时跳过。
     */
    private void revert(SpeculativeChange change) {
        long conversationId = change.conversationId();
        MemberRef member = change.member();
        Participant current = participantCache.peek(conversationId, member);
        if (current != null) {
            if (current.status().equals(change.applied())) {
                if (change.synthesized()) {
                    participantCache.remove(conversationId, member);
                } else {
                    participantCache.updateStatus(conversationId, member, change.before());
                }
            } else {
                log.debug("skip revert, cached status overwritten: conversationId={}, member={}", conversationId, member);
            }
        }
        if (member.isUser()) {
            administratorRegistry.speculativeUpdate(conversationId, member.id(), change.before(), change.applied());
        }
        if (change.touchesOwnStatus() && change.applied().equals(ownStatuses.get(conversationId))) {
            ownStatuses.put(conversationId, change.ownStatusBefore());
        }
    }

    private void revertIfPresent(SpeculativeChange change) {
        if (change != null) {
            revert(change);
        }
    }

    // ---------- helpers ----------

    private PlanContext planContext(ConversationInfo info, MemberRef member) {
        return new PlanContext(info.kind(), isSelf(member), member.isUser(), ownStatus(info), info.membersCanInvite(), nowSeconds());
    }

    private MembershipStatus ownStatus(ConversationInfo info) {
        MembershipStatus s = ownStatuses.get(info.id());
        if (s == null) {
            s = info.callerStatus() == null ? MembershipStatus.left() : info.callerStatus();
        }
        return s.withExpiredRestrictionsLifted(nowSeconds());
    }

    /**
     * 只有当前账号是频道/超级群管理员时才缓存成员。
     */
    private boolean participantCacheEnabled(ConversationInfo info) {
        return info.kind() == ConversationKind.CHANNEL && ownStatus(info).isAdministrator();
    }

    private ConversationInfo requireConversation(long conversationId) {
        ConversationInfo info = identity.conversation(conversationId);
        if (info == null) {
            throw MembershipException.policy(MembershipError.CHAT_NOT_FOUND, "Chat not found");
        }
        return info;
    }

    private void requireKnownMember(MemberRef member) {
        if (member == null || !identity.isKnown(member)) {
            throw MembershipException.policy(MembershipError.MEMBER_NOT_FOUND, "Member not found");
        }
    }

    private void requireKnownUser(long userId) {
        if (identity.user(userId) == null) {
            throw MembershipException.policy(MembershipError.MEMBER_NOT_FOUND, "User not found");
        }
    }

    private boolean isSelf(MemberRef member) {
        return member != null && member.isUser() && member.id() == selfUserId();
    }

    private long selfUserId() {
        return props.getSelfUserId();
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    private static MembershipException notSupported(String message) {
        return MembershipException.policy(MembershipError.NOT_SUPPORTED, message);
    }

    private static MembershipException invalid(String message) {
        return MembershipException.policy(MembershipError.INVALID_TRANSITION, message);
    }

    private static MembershipException rights(String message) {
        return MembershipException.policy(MembershipError.NOT_ENOUGH_RIGHTS, message);
    }
}
