package com.minimember.domain.dto;

/**
 * @param bannedUntil epoch 秒，空或 0 为永久
 */
public record BanMemberRequest(Integer bannedUntil, Boolean revokeMessages) {
}
