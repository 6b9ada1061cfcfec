package com.minimember.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MembershipStatusTest {

    @Test
    void administrator_ShouldNormalizeToMember_WhenNoRights() {
        assertThat(MembershipStatus.administrator(AdministratorRights.none(), "boss", true))
                .isEqualTo(MembershipStatus.member());
    }

    @Test
    void restricted_ShouldNormalize_WhenAllRightsKept() {
        assertThat(MembershipStatus.restricted(RestrictedRights.full(), 0, true)).isEqualTo(MembershipStatus.member());
        assertThat(MembershipStatus.restricted(RestrictedRights.full(), 0, false)).isEqualTo(MembershipStatus.left());
    }

    @Test
    void untilDate_ShouldTreatNegativeAndMaxAsForever() {
        assertThat(MembershipStatus.banned(-5).bannedUntil()).isZero();
        assertThat(MembershipStatus.banned(Integer.MAX_VALUE).bannedUntil()).isZero();
        assertThat(MembershipStatus.banned(1_700_000_000).bannedUntil()).isEqualTo(1_700_000_000);
    }

    @Test
    void expiredRestrictions_ShouldBeLifted() {
        MembershipStatus restricted = MembershipStatus.restricted(RestrictedRights.none(), 1000, true);
        assertThat(restricted.withExpiredRestrictionsLifted(999)).isSameAs(restricted);
        assertThat(restricted.withExpiredRestrictionsLifted(1000)).isEqualTo(MembershipStatus.member());

        MembershipStatus banned = MembershipStatus.banned(1000);
        assertThat(banned.withExpiredRestrictionsLifted(2000)).isEqualTo(MembershipStatus.left());
        assertThat(MembershipStatus.banned(0).withExpiredRestrictionsLifted(Long.MAX_VALUE).isBanned()).isTrue();
    }

    @Test
    void creator_ShouldKeepRankAndToggleMembership() {
        MembershipStatus creator = MembershipStatus.creator(" owner ", false, true);
        MembershipStatus away = creator.withMember(false);

        assertThat(away.isCreator()).isTrue();
        assertThat(away.isMember()).isFalse();
        assertThat(away.rank()).isEqualTo("owner");
        assertThat(creator.canPromoteMembers()).isTrue();
    }

    @Test
    void canInviteUsers_ShouldDependOnRestrictedBits() {
        MembershipStatus mayInvite = MembershipStatus.restricted(RestrictedRights.of(RestrictedRights.CAN_INVITE_USERS), 0, true);
        MembershipStatus mayNot = MembershipStatus.restricted(RestrictedRights.of(RestrictedRights.CAN_SEND_MESSAGES), 0, true);

        assertThat(mayInvite.canInviteUsers()).isTrue();
        assertThat(mayNot.canInviteUsers()).isFalse();
        assertThat(MembershipStatus.banned(0).canInviteUsers()).isFalse();
    }

    @Test
    void participant_ShouldBeInvalid_WhenRestrictedWithoutActor() {
        Participant p = new Participant(MemberRef.user(5), 0, 0,
                MembershipStatus.restricted(RestrictedRights.none(), 0, true));
        assertThat(p.isValid()).isFalse();
        assertThat(p.withStatus(MembershipStatus.member()).isValid()).isTrue();
        assertThat(Participant.of(MemberRef.conversation(-100),
                MembershipStatus.administrator(AdministratorRights.of(AdministratorRights.CAN_CHANGE_INFO), "", true)).isValid())
                .isFalse();
    }
}
