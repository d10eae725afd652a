package io.liquidenergy.infrastructure.hummingbot;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Correlation table: request id → single-resolution response handle.
 *
 * Request threads insert, the receive loop resolves, timeout cleanup and
 * teardown remove. All of them go through this monitor, so an entry leaves
 * the table exactly once.
 */
final class PendingRequests {

    private final Map<String, CompletableFuture<EngineResponse>> pending = new HashMap<>();

    synchronized CompletableFuture<EngineResponse> register(String requestId) {
        if (pending.containsKey(requestId)) {
            throw new IllegalStateException("Request id already in flight: " + requestId);
        }
        CompletableFuture<EngineResponse> handle = new CompletableFuture<>();
        pending.put(requestId, handle);
        return handle;
    }

    /**
     * Resolve and remove the entry for {@code requestId}.
     *
     * @return false if no request with that id is waiting
     */
    synchronized boolean complete(String requestId, EngineResponse response) {
        CompletableFuture<EngineResponse> handle = pending.remove(requestId);
        if (handle == null) {
            return false;
        }
        handle.complete(response);
        return true;
    }

    synchronized boolean remove(String requestId) {
        return pending.remove(requestId) != null;
    }

    /**
     * Fail every waiting request and clear the table.
     *
     * @return number of requests failed
     */
    synchronized int failAll(Throwable cause) {
        int count = pending.size();
        for (CompletableFuture<EngineResponse> handle : pending.values()) {
            handle.completeExceptionally(cause);
        }
        pending.clear();
        return count;
    }

    synchronized boolean contains(String requestId) {
        return pending.containsKey(requestId);
    }

    synchronized int size() {
        return pending.size();
    }
}
