package com.minimember.gateway.remote.op;

import com.minimember.gateway.remote.RemoteOperation;

/**
 * @param hash 本地列表的向量哈希，没有本地列表时为 0
 */
public record GetAdministrators(long conversationId, long hash) implements RemoteOperation<AdministratorsReply> {
}
