package com.minimember.domain.planner;

import com.minimember.common.exception.MembershipError;
import com.minimember.common.exception.MembershipException;
import com.minimember.config.MembershipPlanProperties;
import com.minimember.domain.enums.ConversationKind;
import com.minimember.domain.model.MembershipStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 成员状态迁移规划：给定旧状态和目标状态，决定需要哪些远端操作、以什么顺序执行。
 *
 * <p>纯函数，不持有状态，不发起远端调用。规则按优先级依次判断：</p>
 * <ol>
 *   <li>状态相同（且不是群主）：空计划；</li>
 *   <li>只有一侧是群主：拒绝，群主身份不能通过这里授予或撤销；</li>
 *   <li>两侧都是群主：只允许本人修改头衔/匿名或切换是否在群；</li>
 *   <li>目标是管理员：PROMOTE，不能提升自己；</li>
 *   <li>目标不在群、或受限/封禁：RESTRICT/BAN，必要时拆成两步；</li>
 *   <li>目标是普通成员：降级用 PROMOTE，解除限制走上一条，原本不在群用 ADD。</li>
 * </ol>
 *
 * <p>远端没有“带限制邀请”的操作，所以“目标在群且受限、原本不在群”拆成：先以不在群身份 RESTRICT，再 ADD。
 * 远端也没有“移出但不封禁”的操作，所以在群成员变成不在群（非封禁）时先临时封禁，确认后等待一小段时间再下发目标状态。</p>
 *
 * @throws MembershipException 以 POLICY 类别拒绝，调用方不应再发起远端请求
 */
@Component
@RequiredArgsConstructor
public class StatusTransitionPlanner {

    private final MembershipPlanProperties props;

    public TransitionPlan plan(MembershipStatus oldStatus, MembershipStatus newStatus, PlanContext ctx) {
        ConversationKind kind = ctx.conversationKind();
        if (kind == null || kind.isOneToOne()) {
            throw MembershipException.policy(MembershipError.NOT_SUPPORTED, "Chat member status can't be changed in private chats");
        }
        if (kind == ConversationKind.BASIC_GROUP) {
            return planBasicGroup(oldStatus, newStatus, ctx);
        }
        return planChannel(oldStatus, newStatus, ctx);
    }

    private TransitionPlan planChannel(MembershipStatus oldStatus, MembershipStatus newStatus, PlanContext ctx) {
        if (!ctx.targetIsUser()) {
            if (newStatus.isAdministrator() || newStatus.isMember() || newStatus.isRestricted()) {
                throw invalid("Other chats can be only banned or unbanned");
            }
            requireRestrictRights(ctx);
            // 会话身份的成员拿不到可靠的旧状态，总是按“有变化”下发
            return TransitionPlan.of(PlanStep.of(newStatus.isBanned() ? PlanStepType.BAN : PlanStepType.RESTRICT, newStatus));
        }

        if (oldStatus.equals(newStatus) && !newStatus.isCreator()) {
            return TransitionPlan.noOp();
        }

        TransitionPlan creatorPlan = planCreator(oldStatus, newStatus, ctx);
        if (creatorPlan != null) {
            return creatorPlan;
        }

        if (newStatus.kind() == MembershipStatus.Kind.ADMINISTRATOR) {
            if (ctx.selfTarget()) {
                throw invalid("Can't promote self");
            }
            requirePromoteRights(ctx);
            return TransitionPlan.of(PlanStep.of(PlanStepType.PROMOTE, newStatus));
        }

        if (!newStatus.isMember() || newStatus.isRestricted() || newStatus.isBanned()) {
            return planRestrict(oldStatus, newStatus, ctx);
        }

        // 目标是普通成员
        if (oldStatus.kind() == MembershipStatus.Kind.ADMINISTRATOR) {
            if (!ctx.selfTarget()) {
                requirePromoteRights(ctx);
            }
            return TransitionPlan.of(PlanStep.of(PlanStepType.PROMOTE, newStatus));
        }
        if (oldStatus.isRestricted() || oldStatus.isBanned()) {
            return planRestrict(oldStatus, newStatus, ctx);
        }
        if (!oldStatus.isMember()) {
            if (!ctx.selfTarget() && !ctx.callerCanInviteUsers()) {
                throw rights("Not enough rights to invite members to the chat");
            }
            return TransitionPlan.of(PlanStep.of(PlanStepType.ADD, newStatus));
        }
        return TransitionPlan.noOp();
    }

    private TransitionPlan planRestrict(MembershipStatus oldStatus, MembershipStatus newStatus, PlanContext ctx) {
        if (ctx.selfTarget()) {
            if (newStatus.isRestricted() || newStatus.isBanned()) {
                throw invalid("Can't restrict self");
            }
            if (newStatus.isMember() || !oldStatus.isMember()) {
                throw invalid("Can't unrestrict self");
            }
            // 本人变成 Left：由协调器按“退出会话”发送
            return TransitionPlan.of(PlanStep.of(PlanStepType.RESTRICT, MembershipStatus.left()));
        }
        requireRestrictRights(ctx);

        if (newStatus.isMember() && !oldStatus.isMember()) {
            // 只有原本就是同样限制、只差是否在群时才能直接 ADD；封禁必须先解除
            if (oldStatus.isRestricted() && oldStatus.withMember(true).equals(newStatus)) {
                return TransitionPlan.of(PlanStep.of(PlanStepType.ADD, newStatus));
            }
            MembershipStatus outside = newStatus.withMember(false);
            return TransitionPlan.of(
                    PlanStep.of(PlanStepType.RESTRICT, outside),
                    new PlanStep(PlanStepType.ADD, newStatus, newStatus, readdDelay()));
        }

        if (oldStatus.isMember() && !newStatus.isMember() && !newStatus.isBanned()) {
            int until = (int) (ctx.nowEpochSeconds() + props.transientBanSecondsEffective());
            PlanStep kick = new PlanStep(PlanStepType.BAN, MembershipStatus.banned(until), newStatus, Duration.ZERO);
            PlanStepType secondType = newStatus.isRestricted() ? PlanStepType.RESTRICT : PlanStepType.BAN;
            PlanStep readd = new PlanStep(secondType, newStatus, newStatus, readdDelay());
            return TransitionPlan.of(kick, readd);
        }

        return TransitionPlan.of(PlanStep.of(newStatus.isBanned() ? PlanStepType.BAN : PlanStepType.RESTRICT, newStatus));
    }

    private TransitionPlan planBasicGroup(MembershipStatus oldStatus, MembershipStatus newStatus, PlanContext ctx) {
        if (!ctx.targetIsUser()) {
            throw invalid("Other chats can't be members of basic groups");
        }
        if (newStatus.isRestricted()) {
            throw invalid("Chat member can't be restricted in basic groups");
        }
        if (oldStatus.equals(newStatus) && !newStatus.isCreator()) {
            return TransitionPlan.noOp();
        }
        if (oldStatus.isCreator() && newStatus.isCreator()) {
            if (!ctx.selfTarget()) {
                throw rights("Not enough rights to edit chat owner rights");
            }
            if (oldStatus.isMember() == newStatus.isMember()) {
                throw invalid("Can't change chat owner rank in basic groups");
            }
            return TransitionPlan.of(PlanStep.of(newStatus.isMember() ? PlanStepType.ADD : PlanStepType.BAN, newStatus));
        }
        TransitionPlan creatorPlan = planCreator(oldStatus, newStatus, ctx);
        if (creatorPlan != null) {
            return creatorPlan;
        }

        if (newStatus.kind() == MembershipStatus.Kind.ADMINISTRATOR) {
            if (ctx.selfTarget()) {
                throw invalid("Can't promote self");
            }
            requireOwner(ctx);
            return TransitionPlan.of(PlanStep.of(PlanStepType.PROMOTE, newStatus));
        }

        if (newStatus.isMember()) {
            if (oldStatus.kind() == MembershipStatus.Kind.ADMINISTRATOR) {
                if (!ctx.selfTarget()) {
                    requireOwner(ctx);
                }
                return TransitionPlan.of(PlanStep.of(PlanStepType.PROMOTE, newStatus));
            }
            if (oldStatus.isMember()) {
                return TransitionPlan.noOp();
            }
            if (!ctx.selfTarget() && !ctx.callerCanInviteUsers()) {
                throw rights("Not enough rights to invite members to the chat");
            }
            return TransitionPlan.of(PlanStep.of(PlanStepType.ADD, newStatus));
        }

        // Left / Banned：基础群只能移除成员
        if (ctx.selfTarget()) {
            if (newStatus.isBanned()) {
                throw invalid("Can't restrict self");
            }
            return TransitionPlan.of(PlanStep.of(PlanStepType.BAN, MembershipStatus.left()));
        }
        if (!oldStatus.isMember() && !newStatus.isBanned()) {
            return TransitionPlan.noOp();
        }
        requireRestrictRights(ctx);
        return TransitionPlan.of(PlanStep.of(PlanStepType.BAN, newStatus));
    }

    /**
     * 群主相关的规则；与群主无关时返回 null。
     */
    private TransitionPlan planCreator(MembershipStatus oldStatus, MembershipStatus newStatus, PlanContext ctx) {
        if (oldStatus.isCreator() != newStatus.isCreator()) {
            if (oldStatus.isCreator()) {
                throw invalid("Can't remove chat owner");
            }
            throw invalid("Can't add another owner to the chat");
        }
        if (!newStatus.isCreator()) {
            return null;
        }
        if (!ctx.selfTarget()) {
            throw rights("Not enough rights to edit chat owner rights");
        }
        if (oldStatus.isMember() == newStatus.isMember()) {
            if (oldStatus.equals(newStatus)) {
                return TransitionPlan.noOp();
            }
            return TransitionPlan.of(PlanStep.of(PlanStepType.PROMOTE, newStatus));
        }
        return TransitionPlan.of(PlanStep.of(newStatus.isMember() ? PlanStepType.ADD : PlanStepType.RESTRICT, newStatus));
    }

    private Duration readdDelay() {
        return Duration.ofMillis(props.readdDelayMsEffective());
    }

    private static void requireRestrictRights(PlanContext ctx) {
        if (!ctx.callerIsMember()) {
            throw rights("Not in the chat");
        }
        if (!ctx.callerCanRestrictMembers()) {
            throw rights("Not enough rights to restrict/unrestrict chat member");
        }
    }

    private static void requirePromoteRights(PlanContext ctx) {
        if (!ctx.callerIsMember()) {
            throw rights("Not in the chat");
        }
        if (!ctx.callerCanPromoteMembers()) {
            throw rights("Not enough rights to promote chat members");
        }
    }

    private static void requireOwner(PlanContext ctx) {
        if (ctx.callerStatus() == null || !ctx.callerStatus().isCreator()) {
            throw rights("Need owner rights to edit administrator rights");
        }
    }

    private static MembershipException invalid(String message) {
        return MembershipException.policy(MembershipError.INVALID_TRANSITION, message);
    }

    private static MembershipException rights(String message) {
        return MembershipException.policy(MembershipError.NOT_ENOUGH_RIGHTS, message);
    }
}
