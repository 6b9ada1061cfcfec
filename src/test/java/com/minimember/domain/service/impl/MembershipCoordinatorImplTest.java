package com.minimember.domain.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minimember.common.exception.MembershipError;
import com.minimember.common.exception.MembershipException;
import com.minimember.config.MembershipCacheProperties;
import com.minimember.config.MembershipPlanProperties;
import com.minimember.config.MembershipProperties;
import com.minimember.config.OnlineMemberCountProperties;
import com.minimember.domain.cache.AdministratorRegistry;
import com.minimember.domain.cache.OnlineMemberCounter;
import com.minimember.domain.cache.ParticipantCache;
import com.minimember.domain.enums.ConversationKind;
import com.minimember.domain.enums.ParticipantFilter;
import com.minimember.domain.model.Administrator;
import com.minimember.domain.model.AdministratorRights;
import com.minimember.domain.model.ConversationInfo;
import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.Participant;
import com.minimember.domain.model.ParticipantsPage;
import com.minimember.domain.model.RejectedInvitees;
import com.minimember.domain.model.RestrictedRights;
import com.minimember.domain.model.UserInfo;
import com.minimember.domain.planner.StatusTransitionPlanner;
import com.minimember.domain.service.MembershipLifecycle;
import com.minimember.gateway.identity.InMemoryIdentityDirectory;
import com.minimember.gateway.notify.AddMembersPrivacyForbidden;
import com.minimember.gateway.notify.OnlineMemberCountChanged;
import com.minimember.gateway.remote.RemoteException;
import com.minimember.gateway.remote.op.DeleteMemberHistory;
import com.minimember.gateway.remote.op.EditAdministrator;
import com.minimember.gateway.remote.op.EditRestrictions;
import com.minimember.gateway.remote.op.GetParticipant;
import com.minimember.gateway.remote.op.InviteMembers;
import com.minimember.gateway.remote.op.JoinConversation;
import com.minimember.gateway.remote.op.LeaveConversation;
import com.minimember.gateway.remote.op.SearchParticipants;
import com.minimember.gateway.remote.op.TransferOwnership;
import com.minimember.support.InMemoryKeyValueStore;
import com.minimember.support.ManualTimerService;
import com.minimember.support.MutableClock;
import com.minimember.support.RecordingUpdateSink;
import com.minimember.support.ScriptedRemoteTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class MembershipCoordinatorImplTest {

    private static final long SELF = 1;
    private static final long CHANNEL = 100;
    private static final long ADMIN_CHANNEL = 103;
    private static final long MEMBER_CHANNEL = 102;
    private static final long BROADCAST = 104;
    private static final long PRIVATE = 10;
    private static final long BASIC = 20;
    private static final long LEFT_CHANNEL = 105;
    private static final long KICKED_CHANNEL = 106;

    private static final MembershipStatus OWNER = MembershipStatus.creator("", false, true);
    private static final MembershipStatus MODERATOR =
            MembershipStatus.administrator(AdministratorRights.of(AdministratorRights.CAN_DELETE_MESSAGES), "mod", true);
    private static final MembershipStatus RESTRICTOR =
            MembershipStatus.administrator(AdministratorRights.of(AdministratorRights.CAN_RESTRICT_MEMBERS), "", true);
    private static final MembershipStatus READ_ONLY =
            MembershipStatus.restricted(RestrictedRights.of(RestrictedRights.CAN_SEND_MESSAGES), 0, true);

    private MutableClock clock;
    private ManualTimerService timers;
    private ScriptedRemoteTransport remote;
    private RecordingUpdateSink sink;
    private InMemoryIdentityDirectory identity;
    private MembershipLifecycle lifecycle;
    private MembershipProperties props;
    private ParticipantCache cache;
    private AdministratorRegistry registry;
    private MembershipCoordinatorImpl coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        timers = new ManualTimerService(clock);
        remote = new ScriptedRemoteTransport();
        sink = new RecordingUpdateSink();
        identity = new InMemoryIdentityDirectory();
        lifecycle = new MembershipLifecycle();
        lifecycle.start();
        props = new MembershipProperties();
        props.setSelfUserId(SELF);
        Executor worker = Runnable::run;

        MembershipCacheProperties cacheProps = new MembershipCacheProperties();
        MembershipPlanProperties planProps = MembershipPlanProperties.defaults();
        cache = new ParticipantCache(timers, clock, cacheProps);
        registry = new AdministratorRegistry(remote, new InMemoryKeyValueStore(), sink, new ObjectMapper(), cacheProps, lifecycle, worker);
        OnlineMemberCounter counter = new OnlineMemberCounter(timers, clock, sink, remote, identity, cache,
                OnlineMemberCountProperties.defaults(), props, lifecycle, worker);
        coordinator = new MembershipCoordinatorImpl(props, planProps, new StatusTransitionPlanner(planProps), cache, registry,
                counter, identity, sink, timers, new RemoteCalls(remote, lifecycle, worker), lifecycle, worker, clock);

        identity.putConversation(group(CHANNEL, ConversationKind.CHANNEL, false, OWNER));
        identity.putConversation(group(ADMIN_CHANNEL, ConversationKind.CHANNEL, false, RESTRICTOR));
        identity.putConversation(group(MEMBER_CHANNEL, ConversationKind.CHANNEL, false, MembershipStatus.member()));
        identity.putConversation(group(BROADCAST, ConversationKind.CHANNEL, true, MembershipStatus.member()));
        identity.putConversation(group(BASIC, ConversationKind.BASIC_GROUP, false, OWNER));
        identity.putConversation(group(LEFT_CHANNEL, ConversationKind.CHANNEL, false, MembershipStatus.left()));
        identity.putConversation(group(KICKED_CHANNEL, ConversationKind.CHANNEL, false, MembershipStatus.banned(0)));
        identity.putConversation(new ConversationInfo(PRIVATE, ConversationKind.PRIVATE, false, 2, false, true, false,
                MembershipStatus.member(), 2));
        for (long userId = 1; userId <= 9; userId++) {
            identity.putUser(new UserInfo(userId, false, false, false, null));
        }
    }

    private static ConversationInfo group(long id, ConversationKind kind, boolean broadcast, MembershipStatus caller) {
        return new ConversationInfo(id, kind, broadcast, 100, false, true, false, caller, 0);
    }

    private void remoteMember(MembershipStatus status) {
        remote.reply(GetParticipant.class, op -> new Participant(op.member(), SELF, 0, status));
    }

    private static MembershipException failure(CompletableFuture<?> f) {
        Throwable t = catchThrowable(f::join);
        assertThat(t).isInstanceOf(CompletionException.class);
        assertThat(t.getCause()).isInstanceOf(MembershipException.class);
        return (MembershipException) t.getCause();
    }

    @Test
    void setStatus_ShouldSendNothing_WhenStatusAlreadyApplied() {
        remoteMember(MembershipStatus.member());

        coordinator.setStatus(CHANNEL, MemberRef.user(5), MembershipStatus.member()).join();
        coordinator.setStatus(CHANNEL, MemberRef.user(5), MembershipStatus.member()).join();

        assertThat(remote.sent()).hasSize(1).allMatch(op -> op instanceof GetParticipant);
    }

    @Test
    void setStatus_ShouldKickBrieflyThenSettle_WhenMemberLeavesWithoutBan() {
        remoteMember(MembershipStatus.member());
        remote.reply(EditRestrictions.class, op -> null);
        long now = clock.epochSeconds();

        CompletableFuture<Void> done = coordinator.setStatus(CHANNEL, MemberRef.user(5), MembershipStatus.left());

        assertThat(done).isNotDone();
        assertThat(remote.sent(EditRestrictions.class)).extracting(EditRestrictions::status)
                .containsExactly(MembershipStatus.banned((int) (now + 60)));
        assertThat(cache.peek(CHANNEL, MemberRef.user(5)).status()).isEqualTo(MembershipStatus.left());

        timers.advance(Duration.ofSeconds(1));

        assertThat(done).isCompleted();
        assertThat(remote.sent(EditRestrictions.class)).extracting(EditRestrictions::status)
                .containsExactly(MembershipStatus.banned((int) (now + 60)), MembershipStatus.left());
        assertThat(cache.peek(CHANNEL, MemberRef.user(5)).status()).isEqualTo(MembershipStatus.left());
    }

    @Test
    void setStatus_ShouldRestrictOutsideThenInvite_WhenTargetWasNotMember() {
        remote.fail(GetParticipant.class, 400, "USER_NOT_PARTICIPANT");
        remote.reply(EditRestrictions.class, op -> null);
        remote.reply(InviteMembers.class, op -> RejectedInvitees.none());

        CompletableFuture<Void> done = coordinator.setStatus(CHANNEL, MemberRef.user(6), READ_ONLY);
        assertThat(remote.sent(EditRestrictions.class)).extracting(EditRestrictions::status)
                .containsExactly(READ_ONLY.withMember(false));
        assertThat(remote.sent(InviteMembers.class)).isEmpty();

        timers.advance(Duration.ofSeconds(1));

        done.join();
        assertThat(remote.sent(InviteMembers.class)).extracting(InviteMembers::userIds).containsExactly(List.of(6L));
        assertThat(cache.peek(CHANNEL, MemberRef.user(6)).status()).isEqualTo(READ_ONLY);
    }

    @Test
    void setStatus_ShouldRollBack_WhenRemoteRejects() {
        registry.replace(CHANNEL, List.of(new Administrator(SELF, "", true)), true, false);
        remoteMember(MembershipStatus.member());
        remote.fail(EditAdministrator.class, 400, "USER_ADMIN_INVALID");

        MembershipException e = failure(coordinator.setStatus(CHANNEL, MemberRef.user(7), MODERATOR));

        assertThat(e.getError()).isEqualTo(MembershipError.REMOTE_REJECTED);
        assertThat(e.getMessage()).isEqualTo("USER_ADMIN_INVALID");
        assertThat(cache.peek(CHANNEL, MemberRef.user(7)).status()).isEqualTo(MembershipStatus.member());
        assertThat(registry.cached(CHANNEL)).containsExactly(new Administrator(SELF, "", true));
    }

    @Test
    void setStatus_ShouldPromoteThenDemote() {
        registry.replace(CHANNEL, List.of(new Administrator(SELF, "", true)), true, false);
        remoteMember(MembershipStatus.member());
        remote.reply(EditAdministrator.class, op -> null);

        coordinator.setStatus(CHANNEL, MemberRef.user(7), MODERATOR).join();
        assertThat(registry.cached(CHANNEL)).containsExactly(new Administrator(SELF, "", true), new Administrator(7, "mod", false));

        coordinator.setStatus(CHANNEL, MemberRef.user(7), MembershipStatus.member()).join();

        assertThat(remote.sent(EditAdministrator.class)).extracting(EditAdministrator::status)
                .containsExactly(MODERATOR, MembershipStatus.member());
        assertThat(registry.cached(CHANNEL)).containsExactly(new Administrator(SELF, "", true));
        assertThat(remote.sent(GetParticipant.class)).hasSize(1);
    }

    @Test
    void banMember_ShouldDeleteHistory_WhenRevokeRequested() {
        remoteMember(MembershipStatus.member());
        remote.reply(EditRestrictions.class, op -> null);
        remote.reply(DeleteMemberHistory.class, op -> null);

        coordinator.banMember(CHANNEL, MemberRef.user(5), 0, true).join();

        assertThat(remote.sent(EditRestrictions.class)).extracting(EditRestrictions::status)
                .containsExactly(MembershipStatus.banned(0));
        assertThat(remote.sent(DeleteMemberHistory.class)).hasSize(1);
    }

    @Test
    void addMembers_ShouldReportPrivacyRejectedUsers() {
        remote.reply(InviteMembers.class, op -> new RejectedInvitees(List.of(9L)));

        RejectedInvitees rejected = coordinator.addMembers(CHANNEL, List.of(8L, 9L, SELF)).join();

        assertThat(rejected.userIds()).containsExactly(9L);
        assertThat(remote.sent(InviteMembers.class).get(0).userIds()).containsExactly(8L, 9L);
        assertThat(sink.of(AddMembersPrivacyForbidden.class))
                .containsExactly(new AddMembersPrivacyForbidden(CHANNEL, List.of(9L)));
        assertThat(cache.peek(CHANNEL, MemberRef.user(8)).status()).isEqualTo(MembershipStatus.member());
        assertThat(cache.peek(CHANNEL, MemberRef.user(9))).isNull();
    }

    @Test
    void addMembers_ShouldRejectEveryone_WhenWholeInviteIsPrivacyRestricted() {
        remote.fail(InviteMembers.class, 400, "USER_PRIVACY_RESTRICTED");

        RejectedInvitees rejected = coordinator.addMembers(CHANNEL, List.of(8L)).join();

        assertThat(rejected.userIds()).containsExactly(8L);
        assertThat(cache.peek(CHANNEL, MemberRef.user(8))).isNull();
    }

    @Test
    void addMembers_ShouldRejectManyUsersInBasicGroup() {
        MembershipException e = failure(coordinator.addMembers(BASIC, List.of(5L, 6L)));

        assertThat(e.getMessage()).isEqualTo("Can't add many members at once to a basic group chat");
        assertThat(remote.sent()).isEmpty();
    }

    @Test
    void transferOwnership_ShouldTranslatePasswordErrors() {
        remote.fail(TransferOwnership.class, 400, "PASSWORD_MISSING");
        assertThat(failure(coordinator.transferOwnership(CHANNEL, 5, "")).getError()).isEqualTo(MembershipError.PASSWORD_NEEDED);

        remote.fail(TransferOwnership.class, 400, "PASSWORD_HASH_INVALID");
        assertThat(failure(coordinator.transferOwnership(CHANNEL, 5, "nope")).getError()).isEqualTo(MembershipError.PASSWORD_INVALID);

        remote.fail(TransferOwnership.class, 400, "PASSWORD_TOO_FRESH_3600");
        MembershipException cooldown = failure(coordinator.transferOwnership(CHANNEL, 5, "secret"));
        assertThat(cooldown.getError()).isEqualTo(MembershipError.COOLDOWN);
        assertThat(cooldown.getRetryAfterSeconds()).isEqualTo(3600);
    }

    @Test
    void transferOwnership_ShouldNeedOwner() {
        MembershipException e = failure(coordinator.transferOwnership(ADMIN_CHANNEL, 5, "secret"));

        assertThat(e.getError()).isEqualTo(MembershipError.NOT_ENOUGH_RIGHTS);
        assertThat(remote.sent()).isEmpty();
    }

    @Test
    void policyRejections_ShouldNotReachRemote() {
        assertThat(failure(coordinator.setStatus(PRIVATE, MemberRef.user(2), MembershipStatus.left())).getError())
                .isEqualTo(MembershipError.NOT_SUPPORTED);
        assertThat(failure(coordinator.setStatus(999, MemberRef.user(2), MembershipStatus.left())).getError())
                .isEqualTo(MembershipError.CHAT_NOT_FOUND);
        assertThat(failure(coordinator.setStatus(CHANNEL, MemberRef.user(404), MembershipStatus.left())).getError())
                .isEqualTo(MembershipError.MEMBER_NOT_FOUND);
        assertThat(remote.sent()).isEmpty();
    }

    @Test
    void leave_ShouldSucceed_WhenRemoteSaysAlreadyGone() {
        remote.fail(LeaveConversation.class, 400, "USER_NOT_PARTICIPANT");

        coordinator.leave(MEMBER_CHANNEL).join();
        coordinator.leave(MEMBER_CHANNEL).join();

        assertThat(remote.sent(LeaveConversation.class)).hasSize(1);
        assertThat(coordinator.callerStatus(MEMBER_CHANNEL)).isEqualTo(MembershipStatus.left());
    }

    @Test
    void operations_ShouldFailClosing_AfterStop() {
        lifecycle.stop();

        assertThat(failure(coordinator.setStatus(CHANNEL, MemberRef.user(5), MembershipStatus.left())).getError())
                .isEqualTo(MembershipError.CLOSING);
        assertThat(remote.sent()).isEmpty();
    }

    @Test
    void getParticipant_ShouldReturnLeft_WhenNotParticipant() {
        remote.fail(GetParticipant.class, 400, "USER_NOT_PARTICIPANT");

        Participant p = coordinator.getParticipant(CHANNEL, MemberRef.user(5)).join();

        assertThat(p.status()).isEqualTo(MembershipStatus.left());
    }

    @Test
    void getParticipant_ShouldSynthesizePrivateChatMembers() {
        Participant peer = coordinator.getParticipant(PRIVATE, MemberRef.user(2)).join();
        Participant stranger = coordinator.getParticipant(PRIVATE, MemberRef.user(5)).join();

        assertThat(peer.status()).isEqualTo(MembershipStatus.member());
        assertThat(peer.inviterUserId()).isEqualTo(SELF);
        assertThat(stranger.status()).isEqualTo(MembershipStatus.left());
        assertThat(remote.sent()).isEmpty();
    }

    @Test
    void searchParticipants_ShouldDropInvalidRecordsAndRefreshAdministrators() {
        remote.reply(SearchParticipants.class, op -> new ParticipantsPage(2, List.of(
                new Participant(MemberRef.user(SELF), 0, 0, OWNER),
                new Participant(MemberRef.user(7), SELF, 0, MODERATOR),
                new Participant(MemberRef.user(8), 0, 0, MembershipStatus.banned(0)))));

        ParticipantsPage page = coordinator.searchParticipants(CHANNEL, "", ParticipantFilter.ADMINISTRATORS, 50).join();

        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.participants()).extracting(Participant::who).containsExactly(MemberRef.user(SELF), MemberRef.user(7));
        assertThat(registry.cached(CHANNEL)).containsExactly(new Administrator(SELF, "", true), new Administrator(7, "mod", false));
    }

    @Test
    void searchParticipants_ShouldRejectNonPositiveLimit() {
        Throwable t = catchThrowable(() -> coordinator.searchParticipants(CHANNEL, "", ParticipantFilter.RECENT, 0).join());

        assertThat(t).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(remote.sent()).isEmpty();
    }

    @Test
    void getAdministrators_ShouldBeInaccessibleInBroadcastForNonAdmins() {
        MembershipException e = failure(coordinator.getAdministrators(BROADCAST));

        assertThat(e.getMessage()).isEqualTo("Administrator list is inaccessible");
    }

    @Test
    void onParticipantUpdated_ShouldRefreshCacheAndAdministrators() {
        registry.replace(CHANNEL, List.of(new Administrator(SELF, "", true)), true, false);

        coordinator.onParticipantUpdated(CHANNEL, SELF, 0,
                Participant.of(MemberRef.user(7), MembershipStatus.member()),
                new Participant(MemberRef.user(7), SELF, 0, MODERATOR));

        assertThat(cache.peek(CHANNEL, MemberRef.user(7)).status()).isEqualTo(MODERATOR);
        assertThat(registry.cached(CHANNEL)).extracting(Administrator::userId).containsExactly(SELF, 7L);
    }

    @Test
    void onCallerStatusChanged_ShouldDropParticipantCache_WhenAdminRightsLost() {
        cache.insertOrRefresh(ADMIN_CHANNEL, Participant.of(MemberRef.user(5), MembershipStatus.member()), false);

        coordinator.onCallerStatusChanged(ADMIN_CHANNEL, MembershipStatus.member());

        assertThat(cache.isEmpty(ADMIN_CHANNEL)).isTrue();
        assertThat(coordinator.callerStatus(ADMIN_CHANNEL)).isEqualTo(MembershipStatus.member());
    }

    @Test
    void onOnlineMemberCount_ShouldIgnoreNonZeroCountInBroadcastChannel() {
        coordinator.conversationOpened(BROADCAST);
        sink.clear();

        coordinator.onOnlineMemberCount(BROADCAST, 5);
        coordinator.onOnlineMemberCount(CHANNEL, 5);

        assertThat(sink.of(OnlineMemberCountChanged.class)).isEmpty();
        assertThat(coordinator.currentState().join()).containsExactly(new OnlineMemberCountChanged(BROADCAST, 0));
    }

    @Test
    void setStatus_ShouldLiftBanThenInvite_WhenBannedUserIsReturnedAsMember() {
        remoteMember(MembershipStatus.banned(0));
        remote.reply(EditRestrictions.class, op -> null);
        remote.reply(InviteMembers.class, op -> RejectedInvitees.none());

        CompletableFuture<Void> done = coordinator.setStatus(CHANNEL, MemberRef.user(5), MembershipStatus.member());

        assertThat(remote.sent(EditRestrictions.class)).extracting(EditRestrictions::status)
                .containsExactly(MembershipStatus.left());
        assertThat(remote.sent(InviteMembers.class)).isEmpty();

        timers.advance(Duration.ofSeconds(1));

        done.join();
        assertThat(remote.sent(InviteMembers.class)).extracting(InviteMembers::userIds).containsExactly(List.of(5L));
        assertThat(cache.peek(CHANNEL, MemberRef.user(5)).status()).isEqualTo(MembershipStatus.member());
    }

    @Test
    void setStatus_ShouldKeepFirstStep_WhenSecondStepIsRejected() {
        remoteMember(MembershipStatus.member());
        AtomicInteger edits = new AtomicInteger();
        remote.reply(EditRestrictions.class, op -> {
            if (edits.incrementAndGet() > 1) {
                throw new RemoteException(400, "USER_ADMIN_INVALID");
            }
            return null;
        });

        CompletableFuture<Void> done = coordinator.setStatus(CHANNEL, MemberRef.user(5), MembershipStatus.left());
        timers.advance(Duration.ofSeconds(1));

        MembershipException e = failure(done);
        assertThat(e.getError()).isEqualTo(MembershipError.REMOTE_REJECTED);
        assertThat(remote.sent(EditRestrictions.class)).hasSize(2);
        assertThat(cache.peek(CHANNEL, MemberRef.user(5)).status()).isEqualTo(MembershipStatus.left());
    }

    @Test
    void addMember_ShouldJoinChannel_WhenCallerAddsSelf() {
        remote.reply(JoinConversation.class, op -> null);

        assertThat(coordinator.addMember(LEFT_CHANNEL, SELF, 0).join().isEmpty()).isTrue();

        assertThat(remote.sent(JoinConversation.class)).containsExactly(new JoinConversation(LEFT_CHANNEL));
        assertThat(remote.sent(InviteMembers.class)).isEmpty();
        assertThat(coordinator.getParticipant(LEFT_CHANNEL, MemberRef.user(SELF)).join().status())
                .isEqualTo(MembershipStatus.member());
    }

    @Test
    void addMember_ShouldShareOneJoin_WhenSelfJoinIsRequestedTwice() {
        CompletableFuture<Void> reply = new CompletableFuture<>();
        remote.replyAsync(JoinConversation.class, op -> reply);

        CompletableFuture<RejectedInvitees> first = coordinator.addMember(LEFT_CHANNEL, SELF, 0);
        CompletableFuture<RejectedInvitees> second = coordinator.addMember(LEFT_CHANNEL, SELF, 0);

        assertThat(remote.sent(JoinConversation.class)).hasSize(1);
        assertThat(first).isNotDone();
        assertThat(second).isNotDone();

        reply.complete(null);

        assertThat(first).isCompleted();
        assertThat(second).isCompleted();
        assertThat(coordinator.getParticipant(LEFT_CHANNEL, MemberRef.user(SELF)).join().status())
                .isEqualTo(MembershipStatus.member());
    }

    @Test
    void addMember_ShouldRevertSelfStatus_WhenJoinFails() {
        remote.fail(JoinConversation.class, 400, "CHANNELS_TOO_MUCH");

        failure(coordinator.addMember(LEFT_CHANNEL, SELF, 0));

        assertThat(coordinator.getParticipant(LEFT_CHANNEL, MemberRef.user(SELF)).join().status())
                .isEqualTo(MembershipStatus.left());

        remote.reply(JoinConversation.class, op -> null);
        coordinator.addMember(LEFT_CHANNEL, SELF, 0).join();
        assertThat(remote.sent(JoinConversation.class)).hasSize(2);
    }

    @Test
    void addMember_ShouldRejectRejoin_WhenCallerIsBanned() {
        MembershipException e = failure(coordinator.addMember(KICKED_CHANNEL, SELF, 0));

        assertThat(e.getError()).isEqualTo(MembershipError.INVALID_TRANSITION);
        assertThat(remote.sent()).isEmpty();
    }

    @Test
    void conversationClosed_ShouldDropParticipantBucket() {
        cache.insertOrRefresh(CHANNEL, new Participant(MemberRef.user(5), SELF, 0, MembershipStatus.member()), true);
        assertThat(cache.isEmpty(CHANNEL)).isFalse();

        coordinator.conversationClosed(CHANNEL);

        assertThat(cache.isEmpty(CHANNEL)).isTrue();
        assertThat(cache.peek(CHANNEL, MemberRef.user(5))).isNull();
    }
}
