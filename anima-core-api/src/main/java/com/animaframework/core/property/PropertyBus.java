package com.animaframework.core.property;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

import com.animaframework.core.handle.ViewModelInstanceHandle;
import lombok.extern.slf4j.Slf4j;

/**
 * 属性订阅总线。
 * <p>
 * subscribe/unsubscribe 可以在任意线程调用；publish 只在工作线程上调用，
 * 所以同一个键的更新天然有序。每个订阅者有自己的有界缓冲区，慢订阅者不会拖住发布方或其他订阅者。
 */
@Slf4j
public class PropertyBus {

    private final Map<PropertyKey, List<PropertySubscription<?>>> subscriptionsByKey = new ConcurrentHashMap<>();
    private final Map<Long, PropertySubscription<?>> subscriptionsById = new ConcurrentHashMap<>();
    private final AtomicLong nextSubscriptionId = new AtomicLong(1);
    private final int capacity;
    private final OverflowPolicy policy;
    private final LongConsumer dropListener;
    // 只在工作线程上递增
    private long sequence;
    private volatile boolean closed;

    /**
     * @param capacity     每个订阅者的缓冲区容量
     * @param policy       缓冲区满时的策略
     * @param dropListener 有更新被丢弃时回调（参数为丢弃数量），用于统计
     */
    public PropertyBus(int capacity, OverflowPolicy policy, LongConsumer dropListener) {
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.dropListener = dropListener != null ? dropListener : n -> {
        };
    }

    public <T> PropertySubscription<T> subscribe(PropertyKey key, Class<T> valueType) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(valueType, "valueType");
        long id = nextSubscriptionId.getAndIncrement();
        PropertySubscription<T> subscription = new PropertySubscription<>(id, key, valueType, capacity, policy,
                s -> detach((PropertySubscription<?>) s));
        if (closed) {
            subscription.close();
            return subscription;
        }
        subscriptionsById.put(id, subscription);
        subscriptionsByKey.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(subscription);
        if (closed) {
            // 与 closeAll 并发时补一次关闭
            subscription.close();
            return subscription;
        }
        log.debug("新增订阅 {} -> {}", id, key);
        return subscription;
    }

    /**
     * 按订阅标识取消订阅
     *
     * @return 标识存在且此前未取消时返回 true
     */
    public boolean unsubscribe(long subscriptionId) {
        PropertySubscription<?> subscription = subscriptionsById.get(subscriptionId);
        if (subscription == null) {
            return false;
        }
        subscription.close();
        return true;
    }

    public boolean hasSubscribers(PropertyKey key) {
        List<PropertySubscription<?>> subscriptions = subscriptionsByKey.get(key);
        return subscriptions != null && !subscriptions.isEmpty();
    }

    public int subscriptionCount() {
        return subscriptionsById.size();
    }

    /**
     * 向某个键的全部订阅者发布一次更新，只能在工作线程上调用。
     *
     * @return 实际收到更新的订阅者数量
     */
    public int publish(PropertyKey key, Object value) {
        List<PropertySubscription<?>> subscriptions = subscriptionsByKey.get(key);
        if (subscriptions == null || subscriptions.isEmpty()) {
            return 0;
        }
        long seq = ++sequence;
        long now = System.nanoTime();
        int delivered = 0;
        for (PropertySubscription<?> subscription : subscriptions) {
            if (deliver(subscription, key, value, seq, now)) {
                delivered++;
            }
        }
        return delivered;
    }

    private <T> boolean deliver(PropertySubscription<T> subscription, PropertyKey key, Object value, long seq,
            long now) {
        if (value != null && !subscription.getValueType().isInstance(value)) {
            log.warn("订阅 {} 期望 {} 类型，收到 {}，更新被忽略", subscription.getId(),
                    subscription.getValueType().getSimpleName(), value.getClass().getSimpleName());
            return false;
        }
        T typed = subscription.getValueType().cast(value);
        long droppedBefore = subscription.droppedCount();
        subscription.publish(new PropertyUpdate<>(key.handle(), key.propertyPath(), typed, seq, now));
        long droppedNow = subscription.droppedCount() - droppedBefore;
        if (droppedNow > 0) {
            log.debug("订阅 {} 缓冲区已满，丢弃 {} 条更新", subscription.getId(), droppedNow);
            dropListener.accept(droppedNow);
        }
        return true;
    }

    /**
     * 以错误关闭某个键上的全部订阅，例如订阅的句柄或属性不存在
     */
    public void failKey(PropertyKey key, Throwable cause) {
        List<PropertySubscription<?>> subscriptions = subscriptionsByKey.get(key);
        if (subscriptions == null) {
            return;
        }
        for (PropertySubscription<?> subscription : subscriptions) {
            subscription.fail(cause);
        }
    }

    /**
     * 单个订阅失败，不影响同一个键上的其他订阅
     */
    public void failSubscription(long subscriptionId, Throwable cause) {
        PropertySubscription<?> subscription = subscriptionsById.get(subscriptionId);
        if (subscription != null) {
            log.warn("订阅 {} 失败: {}", subscriptionId, cause.getMessage());
            subscription.fail(cause);
        }
    }

    /**
     * 视图模型实例被删除时关闭其全部订阅
     */
    public void closeHandle(ViewModelInstanceHandle handle) {
        subscriptionsByKey.keySet().stream()
                .filter(key -> key.handle().equals(handle))
                .toList()
                .forEach(key -> {
                    List<PropertySubscription<?>> subscriptions = subscriptionsByKey.get(key);
                    if (subscriptions != null) {
                        subscriptions.forEach(PropertySubscription::close);
                    }
                });
    }

    /**
     * 关闭全部订阅，此后的 subscribe 得到的订阅直接处于关闭状态
     */
    public void closeAll() {
        closed = true;
        subscriptionsById.values().forEach(PropertySubscription::close);
        subscriptionsById.clear();
        subscriptionsByKey.clear();
    }

    private void detach(PropertySubscription<?> subscription) {
        subscriptionsById.remove(subscription.getId());
        subscriptionsByKey.computeIfPresent(subscription.getKey(), (k, list) -> {
            list.remove(subscription);
            return list.isEmpty() ? null : list;
        });
    }
}
