package com.minimember.domain.cache;

import com.minimember.common.concurrent.Futures;
import com.minimember.config.MembershipProperties;
import com.minimember.config.OnlineMemberCountProperties;
import com.minimember.domain.enums.ConversationKind;
import com.minimember.domain.model.ConversationInfo;
import com.minimember.domain.model.OnlineCountInfo;
import com.minimember.domain.model.Participant;
import com.minimember.domain.model.UserInfo;
import com.minimember.domain.service.MembershipLifecycle;
import com.minimember.gateway.identity.IdentityResolver;
import com.minimember.gateway.notify.MembershipUpdate;
import com.minimember.gateway.notify.MembershipUpdateSink;
import com.minimember.gateway.notify.OnlineMemberCountChanged;
import com.minimember.gateway.remote.RemoteTransport;
import com.minimember.gateway.remote.op.GetOnlineCount;
import com.minimember.gateway.timer.TimerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 会话在线人数。只在内存里，不持久化。
 *
 * <p>会话打开期间每隔 update-interval 重新计算一次：大群、基础群、广播频道、隐藏成员的群走远端查询，
 * 其余小超级群用成员缓存里最近活跃的用户估算。会话关闭后不再通知，缓存值在 expire 之后静默失效。</p>
 */
@Slf4j
@Component
public class OnlineMemberCounter {

    private static final String TIMER_KEY_PREFIX = "online:";

    private final TimerService timers;
    private final Clock clock;
    private final MembershipUpdateSink sink;
    private final RemoteTransport transport;
    private final IdentityResolver identity;
    private final ParticipantCache participantCache;
    private final OnlineMemberCountProperties props;
    private final MembershipProperties membershipProps;
    private final MembershipLifecycle lifecycle;
    private final Executor worker;

    private final Map<Long, OnlineCountInfo> counts = new HashMap<>();
    private final Set<Long> opened = new HashSet<>();

    public OnlineMemberCounter(TimerService timers,
                               Clock clock,
                               MembershipUpdateSink sink,
                               RemoteTransport transport,
                               IdentityResolver identity,
                               ParticipantCache participantCache,
                               OnlineMemberCountProperties props,
                               MembershipProperties membershipProps,
                               MembershipLifecycle lifecycle,
                               @Qualifier("membershipWorker") Executor worker) {
        this.timers = timers;
        this.clock = clock;
        this.sink = sink;
        this.transport = transport;
        this.identity = identity;
        this.participantCache = participantCache;
        this.props = props;
        this.membershipProps = membershipProps;
        this.lifecycle = lifecycle;
        this.worker = worker;
    }

    public void observe(long conversationId, int count, boolean fromServer) {
        if (membershipProps.isServiceAccount()) {
            return;
        }
        ConversationInfo info = identity.conversation(conversationId);
        if (info == null || info.kind().isOneToOne()) {
            return;
        }
        if (count < 0) {
            log.error("receive negative online member count: conversationId={}, count={}", conversationId, count);
            count = 0;
        }
        if (info.memberCount() > 0 && count > info.memberCount()) {
            count = info.memberCount();
        }

        Instant now = clock.instant();
        OnlineCountInfo prev = counts.get(conversationId);
        boolean open = opened.contains(conversationId);
        boolean changed = prev == null || prev.count() != count;
        boolean needSend = open && (changed || !prev.updateSent());
        boolean sent = needSend || (!changed && prev.updateSent());
        counts.put(conversationId, new OnlineCountInfo(count, now, sent));
        if (needSend) {
            sink.notify(new OnlineMemberCountChanged(conversationId, count));
        }

        if (!open) {
            if (timers.keyedDeadline(timerKey(conversationId)) == null) {
                Instant lapseAt = now.plus(Duration.ofSeconds(props.expireSecondsEffective()));
                timers.scheduleKeyed(timerKey(conversationId), lapseAt, () -> onTimer(conversationId));
            }
            return;
        }
        Instant next = now.plus(Duration.ofSeconds(props.updateIntervalSecondsEffective()));
        String key = timerKey(conversationId);
        if (fromServer || timers.keyedDeadline(key) == null) {
            timers.scheduleKeyed(key, next, () -> onTimer(conversationId));
        }
    }

    public void opened(long conversationId) {
        if (!opened.add(conversationId)) {
            return;
        }
        OnlineCountInfo info = counts.get(conversationId);
        if (info != null) {
            if (isFresh(info, clock.instant())) {
                counts.put(conversationId, info.withUpdateSent(true));
                sink.notify(new OnlineMemberCountChanged(conversationId, info.count()));
            } else {
                counts.remove(conversationId);
            }
        }
        refresh(conversationId);
    }

    public void closed(long conversationId) {
        if (!opened.remove(conversationId)) {
            return;
        }
        OnlineCountInfo info = counts.get(conversationId);
        if (info == null) {
            timers.cancelKeyed(timerKey(conversationId));
            return;
        }
        counts.put(conversationId, info.withUpdateSent(false));
        Instant lapseAt = info.updatedAt().plus(Duration.ofSeconds(props.expireSecondsEffective()));
        timers.scheduleKeyed(timerKey(conversationId), lapseAt, () -> onTimer(conversationId));
    }

    public OnlineCountInfo get(long conversationId) {
        return counts.get(conversationId);
    }

    public boolean isOpened(long conversationId) {
        return opened.contains(conversationId);
    }

    /**
     * 打开中的会话已经发出过的在线人数，用于状态重放。
     */
    public List<MembershipUpdate> currentUpdates() {
        List<MembershipUpdate> out = new ArrayList<>();
        for (Long conversationId : opened) {
            OnlineCountInfo info = counts.get(conversationId);
            if (info != null && info.updateSent()) {
                out.add(new OnlineMemberCountChanged(conversationId, info.count()));
            }
        }
        return out;
    }

    private void onTimer(long conversationId) {
        if (!opened.contains(conversationId)) {
            OnlineCountInfo info = counts.get(conversationId);
            if (info == null) {
                return;
            }
            if (isFresh(info, clock.instant())) {
                // 关闭期间又收到过新值
                Instant lapseAt = info.updatedAt().plus(Duration.ofSeconds(props.expireSecondsEffective()));
                timers.scheduleKeyed(timerKey(conversationId), lapseAt, () -> onTimer(conversationId));
                return;
            }
            counts.remove(conversationId);
            log.debug("online member count lapsed: conversationId={}", conversationId);
            return;
        }
        refresh(conversationId);
    }

    private void refresh(long conversationId) {
        ConversationInfo info = identity.conversation(conversationId);
        if (info == null || info.kind().isOneToOne()) {
            return;
        }
        if (!needsRemoteQuery(info)) {
            observe(conversationId, countLocally(conversationId), false);
            return;
        }
        CompletableFuture<Integer> sent;
        try {
            sent = transport.send(new GetOnlineCount(conversationId));
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        sent.whenCompleteAsync((count, err) -> {
            if (!lifecycle.isRunning()) {
                return;
            }
            if (err != null) {
                log.warn("get online member count failed: conversationId={}, err={}", conversationId, Futures.unwrap(err).toString());
                observe(conversationId, 0, true);
                return;
            }
            observe(conversationId, count == null ? 0 : count, true);
        }, worker);
    }

    private boolean needsRemoteQuery(ConversationInfo info) {
        if (info.kind() != ConversationKind.CHANNEL || info.broadcast() || info.hiddenParticipants()) {
            return true;
        }
        int members = info.memberCount();
        if (members <= 0 || members >= props.localCountMaxMembersEffective()) {
            return true;
        }
        return participantCache.isEmpty(info.id());
    }

    private int countLocally(long conversationId) {
        Instant since = clock.instant().minus(Duration.ofSeconds(props.activityWindowSecondsEffective()));
        int online = 0;
        for (Participant p : participantCache.snapshot(conversationId)) {
            if (!p.who().isUser() || !p.status().isMember()) {
                continue;
            }
            UserInfo user = identity.user(p.who().id());
            if (user != null && !user.deleted() && user.lastActivityAt() != null && user.lastActivityAt().isAfter(since)) {
                online++;
            }
        }
        return online;
    }

    private boolean isFresh(OnlineCountInfo info, Instant now) {
        return info.updatedAt().plus(Duration.ofSeconds(props.expireSecondsEffective())).isAfter(now);
    }

    private static String timerKey(long conversationId) {
        return TIMER_KEY_PREFIX + conversationId;
    }
}
