package com.minimember.domain.model;

/**
 * 管理员列表中的一项（投影）。列表按 userId 升序保存。
 */
public record Administrator(long userId, String rank, boolean creator) {

    public Administrator {
        rank = rank == null ? "" : rank;
    }
}
