package com.animaframework.core.property;

import com.animaframework.core.handle.ViewModelInstanceHandle;

/**
 * 一次属性变化通知。
 * 同一个键的更新按工作线程产生的顺序投递，{@code sequence} 在队列内全局递增。
 *
 * @param handle          属性所属的视图模型实例
 * @param propertyPath    属性路径
 * @param value           新值
 * @param sequence        工作线程分配的序号
 * @param timestampNanos  产生时的 System.nanoTime()
 */
public record PropertyUpdate<T>(ViewModelInstanceHandle handle, String propertyPath, T value, long sequence,
                                long timestampNanos) {

    public PropertyKey key() {
        return new PropertyKey(handle, propertyPath);
    }
}
