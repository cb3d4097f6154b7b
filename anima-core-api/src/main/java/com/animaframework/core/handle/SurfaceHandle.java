package com.animaframework.core.handle;

/**
 * 渲染表面句柄
 */
public record SurfaceHandle(long id) implements Handle {

    @Override
    public HandleKind kind() {
        return HandleKind.SURFACE;
    }

    @Override
    public String toString() {
        return "SurfaceHandle(" + id + ")";
    }
}
