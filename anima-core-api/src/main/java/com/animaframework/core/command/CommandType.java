package com.animaframework.core.command;

/**
 * 工作线程支持的命令类型。
 * mutating 表示命令可能改变可观察的属性，执行后需要收集属性变化。
 */
public enum CommandType {
    LOAD_FILE(false),
    DELETE_FILE(false),
    LIST_ARTBOARDS(false),
    LIST_VIEW_MODELS(false),
    LIST_VIEW_MODEL_INSTANCES(false),

    CREATE_ARTBOARD(false),
    DELETE_ARTBOARD(false),
    LIST_STATE_MACHINES(false),
    GET_ARTBOARD_SIZE(false),
    RESIZE_ARTBOARD(false),
    RESET_ARTBOARD_SIZE(false),

    CREATE_STATE_MACHINE(false),
    DELETE_STATE_MACHINE(false),
    ADVANCE_STATE_MACHINE(true),
    LIST_INPUTS(false),
    GET_INPUT(false),
    SET_INPUT(true),
    BIND_VIEW_MODEL_INSTANCE(true),

    POINTER_DOWN(true),
    POINTER_MOVE(true),
    POINTER_UP(true),
    POINTER_EXIT(true),

    CREATE_VIEW_MODEL_INSTANCE(false),
    DELETE_VIEW_MODEL_INSTANCE(false),
    GET_PROPERTY(false),
    SET_PROPERTY(true),
    SUBSCRIBE_PROPERTY(false),

    CREATE_SURFACE(false),
    DELETE_SURFACE(false),
    DRAW(false),
    DRAW_BATCH(false),

    RUN_ON_WORKER(true);

    private final boolean mutating;

    CommandType(boolean mutating) {
        this.mutating = mutating;
    }

    public boolean isMutating() {
        return mutating;
    }
}
