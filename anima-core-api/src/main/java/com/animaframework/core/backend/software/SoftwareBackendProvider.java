package com.animaframework.core.backend.software;

import com.animaframework.core.backend.NativeBackend;
import com.animaframework.core.backend.NativeBackendProvider;

/**
 * 通过 ServiceLoader 注册的参考后端
 */
public class SoftwareBackendProvider implements NativeBackendProvider {

    @Override
    public String name() {
        return SoftwareBackend.NAME;
    }

    @Override
    public NativeBackend create() {
        return new SoftwareBackend();
    }
}
