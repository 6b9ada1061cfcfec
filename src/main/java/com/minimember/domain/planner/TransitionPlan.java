package com.minimember.domain.planner;

import java.util.List;

/**
 * 有序的步骤列表；空列表表示无需任何远端调用。
 */
public record TransitionPlan(List<PlanStep> steps) {

    private static final TransitionPlan NO_OP = new TransitionPlan(List.of());

    public TransitionPlan {
        steps = List.copyOf(steps);
    }

    public static TransitionPlan noOp() {
        return NO_OP;
    }

    public static TransitionPlan of(PlanStep... steps) {
        return new TransitionPlan(List.of(steps));
    }

    public boolean isNoOp() {
        return steps.isEmpty();
    }

    public boolean isTwoPhase() {
        return steps.size() > 1;
    }

    public List<PlanStepType> types() {
        return steps.stream().map(PlanStep::type).toList();
    }
}
