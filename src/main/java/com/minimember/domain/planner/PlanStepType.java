package com.minimember.domain.planner;

public enum PlanStepType {
    ADD,
    PROMOTE,
    RESTRICT,
    BAN
}
