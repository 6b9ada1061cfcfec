package com.minimember.gateway.remote.op;

import com.minimember.domain.enums.ParticipantFilter;
import com.minimember.domain.model.ParticipantsPage;
import com.minimember.gateway.remote.RemoteOperation;

public record SearchParticipants(
        long conversationId,
        ParticipantFilter filter,
        String query,
        int offset,
        int limit
) implements RemoteOperation<ParticipantsPage> {
}
