package com.animaframework.core.backend;

/**
 * 后端回报属性变化的回调，在工作线程上调用
 */
@FunctionalInterface
public interface PropertyChangeSink {

    void propertyChanged(Object nativeInstance, String propertyPath, Object value);
}
