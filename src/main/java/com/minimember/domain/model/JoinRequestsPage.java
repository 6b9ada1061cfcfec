package com.minimember.domain.model;

import java.util.List;

public record JoinRequestsPage(int totalCount, List<JoinRequest> requests) {

    public JoinRequestsPage {
        requests = requests == null ? List.of() : List.copyOf(requests);
    }
}
