package com.minimember.gateway.remote.op;

import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.Participant;
import com.minimember.gateway.remote.RemoteOperation;

public record GetParticipant(long conversationId, MemberRef member) implements RemoteOperation<Participant> {
}
