package com.minimember.domain.model;

import java.time.Instant;

public record OnlineCountInfo(int count, Instant updatedAt, boolean updateSent) {

    public OnlineCountInfo withUpdateSent(boolean sent) {
        return new OnlineCountInfo(count, updatedAt, sent);
    }
}
