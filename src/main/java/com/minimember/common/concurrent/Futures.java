package com.minimember.common.concurrent;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Futures {

    private Futures() {
    }

    /**
     * 剥掉 CompletableFuture 包装的 CompletionException / ExecutionException。
     */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
