package com.animaframework.core.handle;

/**
 * 视图模型实例句柄
 */
public record ViewModelInstanceHandle(long id) implements Handle {

    @Override
    public HandleKind kind() {
        return HandleKind.VIEW_MODEL_INSTANCE;
    }

    @Override
    public String toString() {
        return "ViewModelInstanceHandle(" + id + ")";
    }
}
