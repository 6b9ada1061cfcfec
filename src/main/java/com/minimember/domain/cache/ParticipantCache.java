package com.minimember.domain.cache;

import com.minimember.config.MembershipCacheProperties;
import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.Participant;
import com.minimember.gateway.timer.TimerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 按会话分桶的成员缓存。
 *
 * <p>只在当前账号是频道/超级群管理员时启用（由协调器判断）。每条记录按最后访问时间过期；
 * 每个会话一个 keyed 定时器，触发时间始终是桶内最早的 lastAccess + TTL，桶清空后整体删除。</p>
 *
 * <p>只在 worker 线程上访问，不加锁。</p>
 */
@Slf4j
@Component
public class ParticipantCache {

    private static final String TIMER_KEY_PREFIX = "participants:";

    private final TimerService timers;
    private final Clock clock;
    private final MembershipCacheProperties props;

    private final Map<Long, Map<MemberRef, CacheEntry>> buckets = new HashMap<>();

    public ParticipantCache(TimerService timers, Clock clock, MembershipCacheProperties props) {
        this.timers = timers;
        this.clock = clock;
        this.props = props;
    }

    /**
     * 命中时刷新 lastAccess，并解除已过期的限制；不会发起远端请求。
     */
    public Participant lookup(long conversationId, MemberRef member) {
        Map<MemberRef, CacheEntry> bucket = buckets.get(conversationId);
        if (bucket == null) {
            return null;
        }
        CacheEntry entry = bucket.get(member);
        if (entry == null) {
            return null;
        }
        Instant now = clock.instant();
        if (isExpired(entry, now)) {
            bucket.remove(member);
            if (bucket.isEmpty()) {
                dropBucket(conversationId);
            }
            return null;
        }
        MembershipStatus lifted = entry.participant.status().withExpiredRestrictionsLifted(now.getEpochSecond());
        if (!lifted.equals(entry.participant.status())) {
            entry.participant = entry.participant.withStatus(lifted);
        }
        entry.lastAccess = now;
        return entry.participant;
    }

    /**
     * 不刷新 lastAccess 的读取。
     */
    public Participant peek(long conversationId, MemberRef member) {
        Map<MemberRef, CacheEntry> bucket = buckets.get(conversationId);
        if (bucket == null) {
            return null;
        }
        CacheEntry entry = bucket.get(member);
        if (entry == null || isExpired(entry, clock.instant())) {
            return null;
        }
        return entry.participant;
    }

    /**
     * 已存在时只有 allowReplace 才覆盖，避免一次主动查询覆盖掉更新的值。
     */
    public void insertOrRefresh(long conversationId, Participant participant, boolean allowReplace) {
        if (participant == null || !participant.isValid()) {
            log.error("refuse to cache invalid participant: conversationId={}, participant={}", conversationId, participant);
            return;
        }
        Map<MemberRef, CacheEntry> bucket = buckets.computeIfAbsent(conversationId, k -> new HashMap<>());
        Instant now = clock.instant();
        CacheEntry existing = bucket.get(participant.who());
        if (existing != null && !isExpired(existing, now)) {
            if (!allowReplace) {
                return;
            }
            existing.participant = participant;
            existing.lastAccess = now;
        } else {
            bucket.put(participant.who(), new CacheEntry(participant, now));
        }
        scheduleSweep(conversationId, now.plus(ttl()));
    }

    /**
     * 修改已缓存记录的状态。记录不存在时返回 false。
     */
    public boolean updateStatus(long conversationId, MemberRef member, MembershipStatus status) {
        Map<MemberRef, CacheEntry> bucket = buckets.get(conversationId);
        if (bucket == null) {
            return false;
        }
        CacheEntry entry = bucket.get(member);
        if (entry == null) {
            return false;
        }
        entry.participant = entry.participant.withStatus(status);
        return true;
    }

    public void remove(long conversationId, MemberRef member) {
        Map<MemberRef, CacheEntry> bucket = buckets.get(conversationId);
        if (bucket == null) {
            return;
        }
        bucket.remove(member);
        if (bucket.isEmpty()) {
            dropBucket(conversationId);
        }
    }

    public void invalidateConversation(long conversationId) {
        if (buckets.containsKey(conversationId)) {
            log.debug("drop participant cache: conversationId={}", conversationId);
        }
        dropBucket(conversationId);
    }

    /**
     * 未过期记录的快照，不刷新访问时间。用于本地估算在线人数。
     */
    public List<Participant> snapshot(long conversationId) {
        Map<MemberRef, CacheEntry> bucket = buckets.get(conversationId);
        if (bucket == null) {
            return List.of();
        }
        Instant now = clock.instant();
        List<Participant> out = new ArrayList<>(bucket.size());
        for (CacheEntry e : bucket.values()) {
            if (!isExpired(e, now)) {
                out.add(e.participant);
            }
        }
        return out;
    }

    public boolean isEmpty(long conversationId) {
        return !buckets.containsKey(conversationId);
    }

    void sweep(long conversationId) {
        Map<MemberRef, CacheEntry> bucket = buckets.get(conversationId);
        if (bucket == null) {
            return;
        }
        Instant now = clock.instant();
        Instant nextDeadline = null;
        int removed = 0;
        Iterator<CacheEntry> it = bucket.values().iterator();
        while (it.hasNext()) {
            CacheEntry e = it.next();
            if (isExpired(e, now)) {
                it.remove();
                removed++;
                continue;
            }
            Instant deadline = e.lastAccess.plus(ttl());
            if (nextDeadline == null || deadline.isBefore(nextDeadline)) {
                nextDeadline = deadline;
            }
        }
        if (removed > 0) {
            log.debug("participant cache sweep: conversationId={}, removed={}, left={}", conversationId, removed, bucket.size());
        }
        if (nextDeadline == null) {
            buckets.remove(conversationId);
            return;
        }
        timers.scheduleKeyed(timerKey(conversationId), nextDeadline, () -> sweep(conversationId));
    }

    private void scheduleSweep(long conversationId, Instant deadline) {
        String key = timerKey(conversationId);
        Instant current = timers.keyedDeadline(key);
        if (current == null || deadline.isBefore(current)) {
            timers.scheduleKeyed(key, deadline, () -> sweep(conversationId));
        }
    }

    private void dropBucket(long conversationId) {
        buckets.remove(conversationId);
        timers.cancelKeyed(timerKey(conversationId));
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return !entry.lastAccess.plus(ttl()).isAfter(now);
    }

    private Duration ttl() {
        return Duration.ofSeconds(Math.max(1, props.getParticipantTtlSeconds()));
    }

    private static String timerKey(long conversationId) {
        return TIMER_KEY_PREFIX + conversationId;
    }

    private static final class CacheEntry {
        private Participant participant;
        private Instant lastAccess;

        private CacheEntry(Participant participant, Instant lastAccess) {
            this.participant = participant;
            this.lastAccess = lastAccess;
        }
    }
}
