package com.animaframework.core.property;

import java.util.Objects;

import com.animaframework.core.handle.ViewModelInstanceHandle;

/**
 * 订阅键：视图模型实例句柄 + 属性路径
 */
public record PropertyKey(ViewModelInstanceHandle handle, String propertyPath) {

    public PropertyKey {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(propertyPath, "propertyPath");
    }
}
