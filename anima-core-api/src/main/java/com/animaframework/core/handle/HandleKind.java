package com.animaframework.core.handle;

/**
 * 句柄所引用的引擎对象类型
 */
public enum HandleKind {
    FILE("File"),
    ARTBOARD("Artboard"),
    STATE_MACHINE("StateMachine"),
    VIEW_MODEL_INSTANCE("ViewModelInstance"),
    SURFACE("Surface");

    private final String displayName;

    HandleKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
