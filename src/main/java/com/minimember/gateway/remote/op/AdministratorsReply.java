package com.minimember.gateway.remote.op;

import com.minimember.domain.model.Administrator;

import java.util.List;

/**
 * notModified=true 时 administrators 为空，表示本地哈希仍然有效。
 */
public record AdministratorsReply(boolean notModified, List<Administrator> administrators) {

    public AdministratorsReply {
        administrators = administrators == null ? List.of() : List.copyOf(administrators);
    }

    public static AdministratorsReply unchanged() {
        return new AdministratorsReply(true, List.of());
    }

    public static AdministratorsReply of(List<Administrator> administrators) {
        return new AdministratorsReply(false, administrators);
    }
}
