package com.animaframework.core.handle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.agrona.collections.Long2ObjectHashMap;

/**
 * 句柄注册表：分配单调递增的句柄，并维护句柄到原生对象的映射。
 * <p>
 * 只能在队列的工作线程上访问（{@link #bindToCurrentThread()} 之后会校验调用线程）。
 * 句柄释放后不会被复用，所以过期句柄总能被检测出来，而不会悄悄指向一个新对象。
 */
@Slf4j
public class HandleRegistry {

    private final Long2ObjectHashMap<Entry> entries = new Long2ObjectHashMap<>();
    // 原生对象 -> 句柄，用于把后端回报的属性变化翻译回调用方可见的句柄
    private final Map<Object, Handle> reverse = new IdentityHashMap<>();
    private final AtomicInteger liveCount = new AtomicInteger();
    private long nextId = 1;
    private volatile Thread ownerThread;

    /**
     * 将注册表绑定到当前线程，此后其他线程的访问都会失败
     */
    public void bindToCurrentThread() {
        ownerThread = Thread.currentThread();
        log.debug("HandleRegistry 绑定到线程 {}", ownerThread.getName());
    }

    public <H extends Handle> H allocate(HandleKind kind, Object nativeObject) {
        checkThread();
        if (kind == null || nativeObject == null) {
            throw new IllegalArgumentException("kind and nativeObject must not be null");
        }
        long id = nextId++;
        H handle = Handle.of(kind, id);
        entries.put(id, new Entry(handle, nativeObject));
        reverse.put(nativeObject, handle);
        liveCount.incrementAndGet();
        log.debug("分配句柄 {} -> {}", handle, nativeObject.getClass().getSimpleName());
        return handle;
    }

    /**
     * 解析句柄。未分配、已释放或类型不符的句柄都会得到 INVALID_HANDLE 错误。
     */
    public Object resolve(Handle handle) {
        checkThread();
        if (handle == null) {
            throw new CommandQueueException(ErrorCode.INVALID_HANDLE, "null handle");
        }
        Entry entry = entries.get(handle.id());
        if (entry == null || entry.handle().kind() != handle.kind()) {
            throw CommandQueueException.invalidHandle(handle);
        }
        return entry.nativeObject();
    }

    public <T> T resolve(Handle handle, Class<T> type) {
        return type.cast(resolve(handle));
    }

    public boolean contains(Handle handle) {
        checkThread();
        if (handle == null) {
            return false;
        }
        Entry entry = entries.get(handle.id());
        return entry != null && entry.handle().kind() == handle.kind();
    }

    /**
     * 释放句柄并返回其原生对象，由调用方负责销毁原生对象
     */
    public Object free(Handle handle) {
        Object nativeObject = resolve(handle);
        entries.remove(handle.id());
        reverse.remove(nativeObject);
        liveCount.decrementAndGet();
        log.debug("释放句柄 {}", handle);
        return nativeObject;
    }

    public Optional<Handle> handleOf(Object nativeObject) {
        checkThread();
        return Optional.ofNullable(reverse.get(nativeObject));
    }

    /**
     * 清空注册表，按分配顺序的逆序返回所有存活的原生对象（后创建的子对象先销毁）
     */
    public List<Object> drainAll() {
        checkThread();
        List<Long> ids = new ArrayList<>(entries.keySet());
        ids.sort(Comparator.reverseOrder());
        List<Object> natives = new ArrayList<>(ids.size());
        for (Long id : ids) {
            natives.add(entries.get(id).nativeObject());
        }
        entries.clear();
        reverse.clear();
        liveCount.set(0);
        return natives;
    }

    /**
     * 存活句柄数量，可从任意线程读取
     */
    public int liveCount() {
        return liveCount.get();
    }

    /**
     * 最近一次分配的句柄值，尚未分配时为 0
     */
    public long lastAllocatedId() {
        checkThread();
        return nextId - 1;
    }

    private void checkThread() {
        Thread owner = ownerThread;
        if (owner != null && owner != Thread.currentThread()) {
            throw new IllegalStateException("HandleRegistry accessed from " + Thread.currentThread().getName()
                    + " but is confined to " + owner.getName());
        }
    }

    private record Entry(Handle handle, Object nativeObject) {
    }
}
