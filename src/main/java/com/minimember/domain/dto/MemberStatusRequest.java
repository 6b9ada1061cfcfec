package com.minimember.domain.dto;

import com.minimember.domain.model.AdministratorRights;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.model.RestrictedRights;
import jakarta.validation.constraints.NotBlank;

/**
 * 修改成员状态的请求体。
 *
 * <p>type 取 creator / administrator / member / restricted / banned / left，其余字段按 type 取用：</p>
 * <ul>
 *   <li>creator：rank、anonymous、member；</li>
 *   <li>administrator：rights（{@link AdministratorRights} 位）、rank、canBeEdited；</li>
 *   <li>restricted：rights（{@link RestrictedRights} 位）、bannedUntil、member；</li>
 *   <li>banned：bannedUntil（epoch 秒，0 为永久）。</li>
 * </ul>
 */
public record MemberStatusRequest(
        @NotBlank String type,
        String rank,
        Boolean anonymous,
        Boolean member,
        Integer rights,
        Boolean canBeEdited,
        Integer bannedUntil
) {

    public MembershipStatus toStatus() {
        String t = type == null ? "" : type.trim().toLowerCase();
        return switch (t) {
            case "creator", "owner" -> MembershipStatus.creator(rank, Boolean.TRUE.equals(anonymous), member == null || member);
            case "administrator", "admin" -> MembershipStatus.administrator(
                    new AdministratorRights(rights == null ? 0 : rights), rank, canBeEdited == null || canBeEdited);
            case "member" -> MembershipStatus.member();
            case "restricted" -> MembershipStatus.restricted(
                    new RestrictedRights(rights == null ? 0 : rights), bannedUntil == null ? 0 : bannedUntil, member == null || member);
            case "banned" -> MembershipStatus.banned(bannedUntil == null ? 0 : bannedUntil);
            case "left" -> MembershipStatus.left();
            default -> throw new IllegalArgumentException("Unsupported chat member status: " + type);
        };
    }
}
