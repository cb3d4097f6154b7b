package com.animaframework.core.queue;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;

/**
 * 原子引用计数，初始值为 1。
 * 计数只通过 CAS 修改，所以并发 acquire/release 不会丢失更新；只有把计数从 1 改为 0 的那一次 release 执行销毁。
 */
@Slf4j
public class RefCount implements RefCounted {

    private final String name;
    private final AtomicInteger count = new AtomicInteger(1);
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final Map<String, AtomicInteger> owners = new ConcurrentHashMap<>();
    private final Runnable onDispose;
    private final BooleanSupplier mayDisposeHere;

    public RefCount(String name, String initialOwner, Runnable onDispose) {
        this(name, initialOwner, onDispose, () -> true);
    }

    /**
     * @param name           资源名称，用于日志和异常信息
     * @param initialOwner   构造者的持有者标签
     * @param onDispose      计数归零时执行的销毁动作
     * @param mayDisposeHere 在把计数从 1 改为 0 之前、于同一次 CAS 尝试中在释放线程上求值；
     *                       返回 false 时该次 release 以 IllegalStateException 失败，计数不变
     */
    public RefCount(String name, String initialOwner, Runnable onDispose, BooleanSupplier mayDisposeHere) {
        this.name = name;
        this.onDispose = onDispose;
        this.mayDisposeHere = mayDisposeHere;
        owners.computeIfAbsent(initialOwner, k -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public int acquire(String owner) {
        while (true) {
            int current = count.get();
            if (current <= 0) {
                throw new CommandQueueException(ErrorCode.DISPOSED,
                        "Cannot acquire '%s' for %s: already disposed".formatted(name, owner));
            }
            if (count.compareAndSet(current, current + 1)) {
                owners.computeIfAbsent(owner, k -> new AtomicInteger()).incrementAndGet();
                log.debug("{} acquired by {} (count={})", name, owner, current + 1);
                return current + 1;
            }
        }
    }

    @Override
    public int release(String owner) {
        while (true) {
            int current = count.get();
            if (current <= 0) {
                throw new CommandQueueException(ErrorCode.DOUBLE_RELEASE,
                        "'%s' released by %s more times than acquired".formatted(name, owner));
            }
            if (current == 1 && !mayDisposeHere.getAsBoolean()) {
                throw new IllegalStateException(
                        "'%s' cannot be disposed from this thread (released by %s)".formatted(name, owner));
            }
            if (count.compareAndSet(current, current - 1)) {
                decrementOwner(owner);
                int next = current - 1;
                log.debug("{} released by {} (count={})", name, owner, next);
                if (next == 0) {
                    dispose();
                }
                return next;
            }
        }
    }

    @Override
    public int refCount() {
        return count.get();
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }

    @Override
    public Map<String, Integer> ownerCounts() {
        Map<String, Integer> snapshot = new TreeMap<>();
        owners.forEach((owner, n) -> {
            if (n.get() > 0) {
                snapshot.put(owner, n.get());
            }
        });
        return snapshot;
    }

    private void decrementOwner(String owner) {
        AtomicInteger n = owners.get(owner);
        if (n == null || n.getAndUpdate(v -> Math.max(0, v - 1)) <= 0) {
            log.warn("{} released by {} which holds no reference", name, owner);
        }
    }

    private void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        log.info("{} reference count reached zero, disposing", name);
        onDispose.run();
    }
}
