package com.minimember.domain.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * @param forwardHistoryLimit 只对基础群生效：新成员能看到的最近消息条数
 */
public record AddMembersRequest(
        @NotEmpty List<@NotNull Long> userIds,
        @PositiveOrZero Integer forwardHistoryLimit
) {
}
