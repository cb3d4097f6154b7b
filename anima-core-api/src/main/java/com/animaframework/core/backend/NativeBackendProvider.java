package com.animaframework.core.backend;

/**
 * 通过 {@link java.util.ServiceLoader} 发现的后端提供者，每个平台一个实现
 */
public interface NativeBackendProvider {

    String name();

    /**
     * 多个提供者同时存在时优先级高者胜出
     */
    default int priority() {
        return 0;
    }

    NativeBackend create();
}
