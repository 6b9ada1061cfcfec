package com.minimember.domain.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record TransferOwnershipRequest(
        @NotNull @Positive Long userId,
        String password
) {
}
