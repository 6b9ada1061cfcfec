package com.minimember.domain.dto;

import com.minimember.domain.model.ParticipantsPage;

import java.util.List;

public record ParticipantsPageDto(int totalCount, List<ParticipantDto> participants) {

    public static ParticipantsPageDto from(ParticipantsPage page) {
        return new ParticipantsPageDto(page.totalCount(), page.participants().stream().map(ParticipantDto::from).toList());
    }
}
