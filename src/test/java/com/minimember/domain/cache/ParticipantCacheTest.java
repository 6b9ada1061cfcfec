package com.minimember.domain.cache;

import com.minimember.config.MembershipCacheProperties;
import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.Participant;
import com.minimember.domain.model.RestrictedRights;
import com.minimember.support.ManualTimerService;
import com.minimember.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ParticipantCacheTest {

    private static final long CONV = 100;
    private static final MemberRef ALICE = MemberRef.user(11);
    private static final MemberRef BOB = MemberRef.user(12);

    private MutableClock clock;
    private ManualTimerService timers;
    private ParticipantCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        timers = new ManualTimerService(clock);
        cache = new ParticipantCache(timers, clock, new MembershipCacheProperties());
    }

    @Test
    void lookup_ShouldExpireAfterTtlWithoutAccess() {
        cache.insertOrRefresh(CONV, Participant.of(ALICE, MembershipStatus.member()), false);

        clock.advance(Duration.ofSeconds(1799));
        assertThat(cache.peek(CONV, ALICE)).isNotNull();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.lookup(CONV, ALICE)).isNull();
        assertThat(cache.isEmpty(CONV)).isTrue();
    }

    @Test
    void lookup_ShouldRefreshLastAccess() {
        cache.insertOrRefresh(CONV, Participant.of(ALICE, MembershipStatus.member()), false);

        clock.advance(Duration.ofSeconds(1000));
        assertThat(cache.lookup(CONV, ALICE)).isNotNull();
        clock.advance(Duration.ofSeconds(1000));

        assertThat(cache.lookup(CONV, ALICE)).isNotNull();
    }

    @Test
    void sweep_ShouldDropBucketWhenEveryEntryExpired() {
        cache.insertOrRefresh(CONV, Participant.of(ALICE, MembershipStatus.member()), false);
        timers.advance(Duration.ofSeconds(600));
        cache.insertOrRefresh(CONV, Participant.of(BOB, MembershipStatus.member()), false);

        timers.advance(Duration.ofSeconds(1200));
        assertThat(cache.snapshot(CONV)).extracting(Participant::who).containsExactly(BOB);

        timers.advance(Duration.ofSeconds(600));
        assertThat(cache.isEmpty(CONV)).isTrue();
        assertThat(timers.keyedDeadline("participants:" + CONV)).isNull();
    }

    @Test
    void insert_ShouldRefuseInvalidRecords() {
        Participant bannedWithoutActor = Participant.of(ALICE, MembershipStatus.banned(0));
        cache.insertOrRefresh(CONV, bannedWithoutActor, true);

        assertThat(cache.peek(CONV, ALICE)).isNull();
    }

    @Test
    void insert_ShouldKeepExisting_UnlessReplaceAllowed() {
        cache.insertOrRefresh(CONV, Participant.of(ALICE, MembershipStatus.member()), false);
        Participant banned = new Participant(ALICE, 1, 0, MembershipStatus.banned(0));

        cache.insertOrRefresh(CONV, banned, false);
        assertThat(cache.peek(CONV, ALICE).status()).isEqualTo(MembershipStatus.member());

        cache.insertOrRefresh(CONV, banned, true);
        assertThat(cache.peek(CONV, ALICE).status()).isEqualTo(MembershipStatus.banned(0));
    }

    @Test
    void lookup_ShouldLiftExpiredRestriction() {
        int until = (int) (clock.epochSeconds() + 10);
        MembershipStatus restricted = MembershipStatus.restricted(RestrictedRights.none(), until, true);
        cache.insertOrRefresh(CONV, new Participant(ALICE, 1, 0, restricted), false);

        clock.advance(Duration.ofSeconds(20));

        assertThat(cache.lookup(CONV, ALICE).status()).isEqualTo(MembershipStatus.member());
    }

    @Test
    void invalidateConversation_ShouldDropBucketAndTimer() {
        cache.insertOrRefresh(CONV, Participant.of(ALICE, MembershipStatus.member()), false);
        cache.invalidateConversation(CONV);

        assertThat(cache.isEmpty(CONV)).isTrue();
        assertThat(timers.keyedDeadline("participants:" + CONV)).isNull();
    }
}
