package com.animaframework.core.handle;

/**
 * 状态机实例句柄
 */
public record StateMachineHandle(long id) implements Handle {

    @Override
    public HandleKind kind() {
        return HandleKind.STATE_MACHINE;
    }

    @Override
    public String toString() {
        return "StateMachineHandle(" + id + ")";
    }
}
