package com.animaframework.core.handle;

/**
 * 画板实例句柄
 */
public record ArtboardHandle(long id) implements Handle {

    @Override
    public HandleKind kind() {
        return HandleKind.ARTBOARD;
    }

    @Override
    public String toString() {
        return "ArtboardHandle(" + id + ")";
    }
}
