package com.minimember.gateway.notify;

import com.minimember.domain.model.Administrator;

import java.util.List;

public record AdministratorsChanged(long conversationId, List<Administrator> administrators) implements MembershipUpdate {

    public AdministratorsChanged {
        administrators = List.copyOf(administrators);
    }
}
