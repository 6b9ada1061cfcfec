package com.minimember.domain.dto;

import jakarta.validation.constraints.NotNull;

/**
 * @param inviteLink 只处理经该链接提交的申请；单条处理时忽略
 */
public record JoinRequestDecision(
        @NotNull Boolean approve,
        String inviteLink
) {
}
