package com.animaframework.core.queue;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;

/**
 * 请求 id 到待完成结果的映射。
 * <p>
 * register 可在任意线程调用；complete/completeExceptionally 只由工作线程调用，每个 id 恰好一次。
 * 关闭后（队列销毁开始）找不到 id 属于正常竞争，不再视为重复完成。
 */
@Slf4j
public class CompletionCorrelator {

    private final String name;
    private final Map<Long, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();
    private final AtomicLong nextRequestId = new AtomicLong(1);
    private volatile boolean closed;

    public CompletionCorrelator(String name) {
        this.name = name;
    }

    /**
     * 分配一个不需要回复的请求 id
     */
    public long nextRequestId() {
        return nextRequestId.getAndIncrement();
    }

    /**
     * 分配请求 id 并登记待完成结果
     */
    @SuppressWarnings("unchecked")
    public <T> Pending<T> register() {
        long requestId = nextRequestId();
        CompletableFuture<T> future = new CompletableFuture<>();
        pending.put(requestId, (CompletableFuture<Object>) future);
        return new Pending<>(requestId, future);
    }

    /**
     * 以结果完成请求
     *
     * @throws CommandQueueException DUPLICATE_COMPLETION，id 未登记或已被完成且队列未关闭时
     */
    public void complete(long requestId, Object value) {
        CompletableFuture<Object> future = take(requestId);
        if (future != null) {
            future.complete(value);
        }
    }

    public void completeExceptionally(long requestId, Throwable cause) {
        CompletableFuture<Object> future = take(requestId);
        if (future != null) {
            future.completeExceptionally(cause);
        }
    }

    /**
     * 宽松版本：用于入队与销毁竞争时由调用方自己让请求失败，id 不存在时返回 false
     */
    public boolean fail(long requestId, Throwable cause) {
        CompletableFuture<Object> future = pending.remove(requestId);
        if (future == null) {
            return false;
        }
        future.completeExceptionally(cause);
        return true;
    }

    /**
     * 进入关闭状态，此后缺失的 id 不再报告为重复完成
     */
    public void close() {
        closed = true;
    }

    /**
     * 关闭并让所有未完成的请求失败
     *
     * @return 被失败的请求数
     */
    public int failAll(Supplier<? extends Throwable> cause) {
        closed = true;
        int failed = 0;
        for (Long requestId : pending.keySet()) {
            if (fail(requestId, cause.get())) {
                failed++;
            }
        }
        if (failed > 0) {
            log.info("Correlator {}: {} 个未完成请求以 DISPOSED 结束", name, failed);
        }
        return failed;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isClosed() {
        return closed;
    }

    private CompletableFuture<Object> take(long requestId) {
        CompletableFuture<Object> future = pending.remove(requestId);
        if (future == null && !closed) {
            throw new CommandQueueException(ErrorCode.DUPLICATE_COMPLETION,
                    "Request %d on queue '%s' completed twice or was never registered".formatted(requestId, name));
        }
        return future;
    }

    /**
     * 已登记的请求
     */
    public record Pending<T>(long requestId, CompletableFuture<T> future) {
    }
}
