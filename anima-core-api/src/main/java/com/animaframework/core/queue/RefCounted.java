package com.animaframework.core.queue;

import java.util.Map;

/**
 * 显式引用计数的共享资源。
 * 构造即持有一次引用；计数归零时恰好执行一次销毁。
 */
public interface RefCounted {

    /**
     * @param owner 持有者标签，仅用于调试
     * @return 新的计数
     */
    int acquire(String owner);

    /**
     * @param owner 持有者标签
     * @return 新的计数
     */
    int release(String owner);

    int refCount();

    boolean isDisposed();

    /**
     * 各持有者标签当前的持有次数
     */
    Map<String, Integer> ownerCounts();
}
