package com.minimember.domain.planner;

import com.minimember.domain.model.MemberRef;
import com.minimember.domain.model.MembershipStatus;

/**
 * 一次本地预先生效的状态修改，同时记下撤销所需的原状态。
 *
 * @param before          修改前对外可见的状态
 * @param applied         修改后对外可见的状态
 * @param synthesized     缓存里原本没有这条记录，是这次修改新建的
 * @param ownStatusBefore 目标是本人时，修改前的本人状态；否则为 null
 */
public record SpeculativeChange(
        long conversationId,
        MemberRef member,
        MembershipStatus before,
        MembershipStatus applied,
        boolean synthesized,
        MembershipStatus ownStatusBefore
) {

    public boolean touchesOwnStatus() {
        return ownStatusBefore != null;
    }
}
