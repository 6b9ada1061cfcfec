package com.minimember.domain.model;

import java.time.Instant;

/**
 * @param lastActivityAt 最近一次在线时间，未知为 null
 */
public record UserInfo(long id, boolean bot, boolean deleted, boolean contact, Instant lastActivityAt) {
}
