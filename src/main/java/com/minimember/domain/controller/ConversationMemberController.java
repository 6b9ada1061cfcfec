package com.minimember.domain.controller;

import com.minimember.common.api.Result;
import com.minimember.domain.dto.AddMembersRequest;
import com.minimember.domain.dto.BanMemberRequest;
import com.minimember.domain.dto.MemberStatusRequest;
import com.minimember.domain.dto.ParticipantDto;
import com.minimember.domain.dto.ParticipantsPageDto;
import com.minimember.domain.dto.TransferOwnershipRequest;
import com.minimember.domain.enums.MemberRefType;
import com.minimember.domain.enums.ParticipantFilter;
import com.minimember.domain.model.Administrator;
import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.RejectedInvitees;
import com.minimember.domain.service.MembershipCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 会话成员接口。失败统一由 GlobalExceptionHandler 翻译。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/conversations/{conversationId}")
public class ConversationMemberController {

    private final MembershipCoordinator coordinator;

    @GetMapping("/members/{memberId}")
    public CompletableFuture<Result<ParticipantDto>> get(
            @PathVariable long conversationId,
            @PathVariable long memberId,
            @RequestParam(defaultValue = "USER") String memberType
    ) {
        return coordinator.getParticipant(conversationId, memberRef(memberType, memberId))
                .thenApply(p -> Result.ok(ParticipantDto.from(p)));
    }

    @GetMapping("/members")
    public CompletableFuture<Result<ParticipantsPageDto>> search(
            @PathVariable long conversationId,
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String filter,
            @RequestParam(defaultValue = "50") int limit
    ) {
        return coordinator.searchParticipants(conversationId, query, ParticipantFilter.fromString(filter), limit)
                .thenApply(page -> Result.ok(ParticipantsPageDto.from(page)));
    }

    @PostMapping("/members")
    public CompletableFuture<Result<RejectedInvitees>> add(
            @PathVariable long conversationId,
            @Valid @RequestBody AddMembersRequest req
    ) {
        if (req.userIds().size() == 1) {
            int forward = req.forwardHistoryLimit() == null ? 0 : req.forwardHistoryLimit();
            return coordinator.addMember(conversationId, req.userIds().get(0), forward).thenApply(Result::ok);
        }
        return coordinator.addMembers(conversationId, req.userIds()).thenApply(Result::ok);
    }

    @PutMapping("/members/{memberId}/status")
    public CompletableFuture<Result<Void>> setStatus(
            @PathVariable long conversationId,
            @PathVariable long memberId,
            @RequestParam(defaultValue = "USER") String memberType,
            @Valid @RequestBody MemberStatusRequest req
    ) {
        return coordinator.setStatus(conversationId, memberRef(memberType, memberId), req.toStatus())
                .thenApply(v -> Result.okVoid());
    }

    @PostMapping("/members/{memberId}/ban")
    public CompletableFuture<Result<Void>> ban(
            @PathVariable long conversationId,
            @PathVariable long memberId,
            @RequestParam(defaultValue = "USER") String memberType,
            @RequestBody(required = false) BanMemberRequest req
    ) {
        int until = req == null || req.bannedUntil() == null ? 0 : req.bannedUntil();
        boolean revoke = req != null && Boolean.TRUE.equals(req.revokeMessages());
        return coordinator.banMember(conversationId, memberRef(memberType, memberId), until, revoke)
                .thenApply(v -> Result.okVoid());
    }

    @PostMapping("/leave")
    public CompletableFuture<Result<Void>> leave(@PathVariable long conversationId) {
        return coordinator.leave(conversationId).thenApply(v -> Result.okVoid());
    }

    @PostMapping("/owner/transfer")
    public CompletableFuture<Result<Void>> transferOwnership(
            @PathVariable long conversationId,
            @Valid @RequestBody TransferOwnershipRequest req
    ) {
        return coordinator.transferOwnership(conversationId, req.userId(), req.password())
                .thenApply(v -> Result.okVoid());
    }

    @GetMapping("/administrators")
    public CompletableFuture<Result<List<Administrator>>> administrators(@PathVariable long conversationId) {
        return coordinator.getAdministrators(conversationId).thenApply(Result::ok);
    }

    /**
     * 界面打开会话：开始推送在线人数。
     */
    @PostMapping("/opened")
    public Result<Void> opened(@PathVariable long conversationId) {
        coordinator.conversationOpened(conversationId);
        return Result.okVoid();
    }

    @PostMapping("/closed")
    public Result<Void> closed(@PathVariable long conversationId) {
        coordinator.conversationClosed(conversationId);
        return Result.okVoid();
    }

    private static MemberRef memberRef(String memberType, long memberId) {
        if (memberId <= 0 && "USER".equalsIgnoreCase(memberType)) {
            throw new IllegalArgumentException("bad_member_id");
        }
        if ("CONVERSATION".equalsIgnoreCase(memberType) || "CHAT".equalsIgnoreCase(memberType)) {
            return new MemberRef(MemberRefType.CONVERSATION, memberId);
        }
        if (!"USER".equalsIgnoreCase(memberType)) {
            throw new IllegalArgumentException("bad_member_type");
        }
        return MemberRef.user(memberId);
    }
}
