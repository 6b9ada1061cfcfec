package com.minimember.domain.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minimember.common.concurrent.Futures;
import com.minimember.common.exception.MembershipException;
import com.minimember.config.MembershipCacheProperties;
import com.minimember.domain.model.Administrator;
import com.minimember.domain.model.MembershipStatus;
import com.minimember.domain.service.MembershipLifecycle;
import com.minimember.gateway.notify.AdministratorsChanged;
import com.minimember.gateway.notify.MembershipUpdateSink;
import com.minimember.gateway.remote.RemoteException;
import com.minimember.gateway.remote.RemoteTransport;
import com.minimember.gateway.remote.op.AdministratorsReply;
import com.minimember.gateway.remote.op.GetAdministrators;
import com.minimember.gateway.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 管理员列表。
 *
 * <p>内存命中直接返回并在后台用哈希向远端校验；内存未命中先读持久化，再不行才去远端拉。
 * 列表始终按 userId 升序，所以相同内容的两个列表 equals 相同、哈希也相同。</p>
 */
@Slf4j
@Component
public class AdministratorRegistry {

    private static final String STORE_KEY_PREFIX = "adm";

    /** 远端返回这些错误说明已经没有权限查看 */
    private static final Set<String> ACCESS_LOST_ERRORS = Set.of("CHANNEL_PRIVATE", "CHAT_ADMIN_REQUIRED", "CHAT_FORBIDDEN");

    private static final TypeReference<List<Administrator>> LIST_TYPE = new TypeReference<>() {
    };

    private final RemoteTransport transport;
    private final KeyValueStore store;
    private final MembershipUpdateSink sink;
    private final ObjectMapper objectMapper;
    private final MembershipCacheProperties props;
    private final MembershipLifecycle lifecycle;
    private final Executor worker;

    private final Map<Long, List<Administrator>> lists = new HashMap<>();
    private final Map<Long, CompletableFuture<List<Administrator>>> reloads = new HashMap<>();

    public AdministratorRegistry(RemoteTransport transport,
                                 KeyValueStore store,
                                 MembershipUpdateSink sink,
                                 ObjectMapper objectMapper,
                                 MembershipCacheProperties props,
                                 MembershipLifecycle lifecycle,
                                 @Qualifier("membershipWorker") Executor worker) {
        this.transport = transport;
        this.store = store;
        this.sink = sink;
        this.objectMapper = objectMapper;
        this.props = props;
        this.lifecycle = lifecycle;
        this.worker = worker;
    }

    public CompletableFuture<List<Administrator>> get(long conversationId) {
        List<Administrator> hit = lists.get(conversationId);
        if (hit != null) {
            revalidateInBackground(conversationId);
            return CompletableFuture.completedFuture(hit);
        }
        List<Administrator> stored = loadFromStore(conversationId);
        if (stored != null) {
            replace(conversationId, stored, true, true);
            revalidateInBackground(conversationId);
            return CompletableFuture.completedFuture(lists.getOrDefault(conversationId, List.of()));
        }
        return revalidate(conversationId);
    }

    /**
     * 只读内存，不触发任何加载。
     */
    public List<Administrator> cached(long conversationId) {
        return lists.get(conversationId);
    }

    /**
     * 带着本地哈希向远端确认；同一会话并发的校验合并成一次请求。
     */
    public CompletableFuture<List<Administrator>> revalidate(long conversationId) {
        CompletableFuture<List<Administrator>> pending = reloads.get(conversationId);
        if (pending != null) {
            return pending;
        }
        List<Administrator> current = lists.get(conversationId);
        long hash = current == null ? 0L : hash(current);
        CompletableFuture<AdministratorsReply> sent;
        try {
            sent = transport.send(new GetAdministrators(conversationId, hash));
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<List<Administrator>> out = new CompletableFuture<>();
        reloads.put(conversationId, out);
        sent.whenCompleteAsync((reply, err) -> {
            reloads.remove(conversationId, out);
            if (!lifecycle.isRunning()) {
                out.completeExceptionally(MembershipException.closing());
                return;
            }
            if (err != null) {
                Throwable cause = Futures.unwrap(err);
                if (cause instanceof RemoteException re && ACCESS_LOST_ERRORS.contains(re.getMessage())) {
                    replace(conversationId, List.of(), false, false);
                }
                out.completeExceptionally(cause);
                return;
            }
            List<Administrator> known = lists.get(conversationId);
            if (reply.notModified() && known != null) {
                out.complete(known);
                return;
            }
            replace(conversationId, reply.administrators(), true, false);
            out.complete(lists.getOrDefault(conversationId, List.of()));
        }, worker);
        return out;
    }

    /**
     * 整体替换。haveAccess=false 时清空内存与持久化；fromPersistence=true 时不再回写。
     */
    public void replace(long conversationId, List<Administrator> administrators, boolean haveAccess, boolean fromPersistence) {
        if (!haveAccess) {
            List<Administrator> prev = lists.remove(conversationId);
            eraseFromStore(conversationId);
            if (prev != null && !prev.isEmpty()) {
                sink.notify(new AdministratorsChanged(conversationId, List.of()));
            }
            return;
        }
        List<Administrator> sorted = sorted(administrators);
        List<Administrator> prev = lists.get(conversationId);
        if (sorted.equals(prev)) {
            return;
        }
        lists.put(conversationId, sorted);
        if (!fromPersistence) {
            saveToStore(conversationId, sorted);
        }
        log.debug("administrators replaced: conversationId={}, size={}, fromPersistence={}", conversationId, sorted.size(), fromPersistence);
        sink.notify(new AdministratorsChanged(conversationId, sorted));
    }

    /**
     * 本地发起的状态变化直接改写列表：只在“是否管理员 / 头衔 / 是否群主”变化时生效。没有已加载列表时什么都不做。
     */
    public void speculativeUpdate(long conversationId, long userId, MembershipStatus newStatus, MembershipStatus oldStatus) {
        List<Administrator> current = lists.get(conversationId);
        if (current == null) {
            return;
        }
        if (newStatus.isAdministrator() == oldStatus.isAdministrator()
                && newStatus.rank().equals(oldStatus.rank())
                && newStatus.isCreator() == oldStatus.isCreator()) {
            return;
        }
        List<Administrator> next = new ArrayList<>(current);
        next.removeIf(a -> a.userId() == userId);
        if (newStatus.isAdministrator()) {
            next.add(new Administrator(userId, newStatus.rank(), newStatus.isCreator()));
        }
        replace(conversationId, next, true, false);
    }

    public void invalidate(long conversationId) {
        replace(conversationId, List.of(), false, false);
    }

    /**
     * 与远端一致的向量哈希：按排好序的 userId 逐个混入。
     */
    public static long hash(List<Administrator> administrators) {
        long acc = 0;
        for (Administrator a : sorted(administrators)) {
            acc ^= acc >>> 21;
            acc ^= acc << 35;
            acc ^= acc >>> 4;
            acc += a.userId();
        }
        return acc;
    }

    public static List<Administrator> sorted(List<Administrator> administrators) {
        if (administrators == null || administrators.isEmpty()) {
            return List.of();
        }
        List<Administrator> copy = new ArrayList<>(administrators);
        copy.sort(Comparator.comparingLong(Administrator::userId));
        return List.copyOf(copy);
    }

    static String storeKey(long conversationId) {
        return STORE_KEY_PREFIX + (-conversationId);
    }

    private void revalidateInBackground(long conversationId) {
        revalidate(conversationId).whenComplete((v, err) -> {
            if (err != null) {
                log.debug("administrators background revalidate failed: conversationId={}, err={}",
                        conversationId, Futures.unwrap(err).toString());
            }
        });
    }

    private List<Administrator> loadFromStore(long conversationId) {
        if (!props.isAdministratorStoreEnabled()) {
            return null;
        }
        byte[] raw = store.get(storeKey(conversationId));
        if (raw == null || raw.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, LIST_TYPE);
        } catch (Exception e) {
            log.warn("stored administrators corrupt, dropped: conversationId={}, err={}", conversationId, e.toString());
            store.erase(storeKey(conversationId));
            return null;
        }
    }

    private void saveToStore(long conversationId, List<Administrator> administrators) {
        if (!props.isAdministratorStoreEnabled()) {
            return;
        }
        try {
            store.set(storeKey(conversationId), objectMapper.writeValueAsBytes(administrators));
        } catch (Exception e) {
            log.warn("persist administrators failed: conversationId={}, err={}", conversationId, e.toString());
        }
    }

    private void eraseFromStore(long conversationId) {
        if (!props.isAdministratorStoreEnabled()) {
            return;
        }
        store.erase(storeKey(conversationId));
    }
}
