package com.minimember.domain.planner;

import com.minimember.domain.model.MembershipStatus;

import java.time.Duration;

/**
 * 计划中的一步。
 *
 * @param sent        发给远端的状态
 * @param visible     这一步期间本地对外展示的状态（先踢后加时展示最终目标，而不是临时封禁）
 * @param delayBefore 上一步确认后到这一步发出之间的等待
 */
public record PlanStep(PlanStepType type, MembershipStatus sent, MembershipStatus visible, Duration delayBefore) {

    public static PlanStep of(PlanStepType type, MembershipStatus status) {
        return new PlanStep(type, status, status, Duration.ZERO);
    }

    public boolean delayed() {
        return delayBefore != null && !delayBefore.isZero() && !delayBefore.isNegative();
    }
}
