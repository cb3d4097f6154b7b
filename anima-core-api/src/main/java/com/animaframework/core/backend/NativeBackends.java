package com.animaframework.core.backend;

import java.util.Comparator;
import java.util.ServiceLoader;

import lombok.extern.slf4j.Slf4j;

/**
 * 后端选择：在构造队列时确定，核心代码不区分平台
 */
@Slf4j
public final class NativeBackends {

    private NativeBackends() {
    }

    /**
     * 创建 classpath 上优先级最高的后端
     *
     * @throws IllegalStateException 没有任何提供者时
     */
    public static NativeBackend loadDefault() {
        NativeBackendProvider provider = ServiceLoader.load(NativeBackendProvider.class).stream()
                .map(ServiceLoader.Provider::get)
                .max(Comparator.comparingInt(NativeBackendProvider::priority))
                .orElseThrow(() -> new IllegalStateException("No NativeBackendProvider found on the classpath"));
        log.info("使用后端提供者 {} (priority={})", provider.name(), provider.priority());
        return provider.create();
    }

    /**
     * 按名称创建后端
     */
    public static NativeBackend load(String name) {
        return ServiceLoader.load(NativeBackendProvider.class).stream()
                .map(ServiceLoader.Provider::get)
                .filter(p -> p.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No NativeBackendProvider named " + name))
                .create();
    }
}
