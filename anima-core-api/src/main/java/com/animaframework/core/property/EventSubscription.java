package com.animaframework.core.property;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 单个订阅者的有界事件流。
 * <p>
 * 发布方调用 {@link #publish(Object)}，永不阻塞；缓冲区满时按 {@link OverflowPolicy} 丢弃。
 * 订阅方可以在任意线程上 poll/drain。close() 即取消订阅。
 */
@Slf4j
public class EventSubscription<T> implements AutoCloseable {

    @Getter
    private final long id;
    private final ArrayBlockingQueue<T> buffer;
    private final OverflowPolicy policy;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Consumer<EventSubscription<T>> onClose;
    private volatile Throwable failure;

    public EventSubscription(long id, int capacity, OverflowPolicy policy, Consumer<EventSubscription<T>> onClose) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.id = id;
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.policy = policy;
        this.onClose = onClose;
    }

    /**
     * 投递一个事件
     *
     * @return 如果有事件因缓冲区满被丢弃则返回 false
     */
    public boolean publish(T event) {
        if (closed.get()) {
            return false;
        }
        if (buffer.offer(event)) {
            return true;
        }
        if (policy == OverflowPolicy.DROP_LATEST) {
            dropped.incrementAndGet();
            return false;
        }
        // DROP_OLDEST：订阅方可能同时在 poll，循环直到放入为止
        while (!buffer.offer(event)) {
            if (buffer.poll() != null) {
                dropped.incrementAndGet();
            }
        }
        return false;
    }

    public T poll() {
        return buffer.poll();
    }

    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return buffer.poll(timeout, unit);
    }

    /**
     * 取出当前缓冲区中的全部事件
     */
    public List<T> drain() {
        List<T> events = new ArrayList<>(buffer.size());
        buffer.drainTo(events);
        return events;
    }

    public int size() {
        return buffer.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 订阅因错误被关闭时的原因，例如订阅了无效的句柄
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    void fail(Throwable cause) {
        failure = cause;
        close();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (onClose != null) {
                onClose.accept(this);
            }
            log.debug("订阅 {} 已关闭，丢弃事件数 {}", id, dropped.get());
        }
    }
}
