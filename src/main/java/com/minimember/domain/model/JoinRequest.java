package com.minimember.domain.model;

public record JoinRequest(long userId, int date, String bio) {
}
