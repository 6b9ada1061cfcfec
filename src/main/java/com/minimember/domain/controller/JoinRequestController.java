package com.minimember.domain.controller;

import com.minimember.common.api.Result;
import com.minimember.domain.dto.JoinRequestDecision;
import com.minimember.domain.model.JoinRequest;
import com.minimember.domain.model.JoinRequestsPage;
import com.minimember.domain.service.JoinRequestGateway;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/conversations/{conversationId}/join-requests")
public class JoinRequestController {

    private final JoinRequestGateway joinRequestGateway;

    /**
     * 翻页游标是上一页最后一条的 (offsetUserId, offsetDate)，首页都不传。
     */
    @GetMapping
    public CompletableFuture<Result<JoinRequestsPage>> list(
            @PathVariable long conversationId,
            @RequestParam(required = false) String inviteLink,
            @RequestParam(required = false) String query,
            @RequestParam(required = false) Long offsetUserId,
            @RequestParam(required = false) Integer offsetDate,
            @RequestParam(defaultValue = "20") int limit
    ) {
        JoinRequest offset = offsetUserId == null ? null
                : new JoinRequest(offsetUserId, offsetDate == null ? 0 : offsetDate, "");
        return joinRequestGateway.list(conversationId, inviteLink, query, offset, limit).thenApply(Result::ok);
    }

    @PostMapping("/{userId}/decide")
    public CompletableFuture<Result<Void>> decide(
            @PathVariable long conversationId,
            @PathVariable long userId,
            @Valid @RequestBody JoinRequestDecision req
    ) {
        return joinRequestGateway.approve(conversationId, userId, req.approve()).thenApply(v -> Result.okVoid());
    }

    @PostMapping("/decide-all")
    public CompletableFuture<Result<Void>> decideAll(
            @PathVariable long conversationId,
            @Valid @RequestBody JoinRequestDecision req
    ) {
        return joinRequestGateway.approveAll(conversationId, req.inviteLink(), req.approve()).thenApply(v -> Result.okVoid());
    }
}
