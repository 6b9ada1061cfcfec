package com.minimember.domain.model;

import java.util.List;

public record ParticipantsPage(int totalCount, List<Participant> participants) {

    public ParticipantsPage {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
