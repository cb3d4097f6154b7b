package com.animaframework.core.handle;

/**
 * 不透明的引擎对象句柄。
 * 调用方只持有整数标识，可以自由复制和共享；标识到原生对象的映射只存在于工作线程的 {@link HandleRegistry} 中。
 * 句柄在同一个队列实例内严格递增且永不复用。
 */
public sealed interface Handle
        permits FileHandle, ArtboardHandle, StateMachineHandle, ViewModelInstanceHandle, SurfaceHandle {

    long id();

    HandleKind kind();

    /**
     * 按类型创建句柄，供工作线程在分配后包装返回值
     */
    @SuppressWarnings("unchecked")
    static <H extends Handle> H of(HandleKind kind, long id) {
        return (H) switch (kind) {
            case FILE -> new FileHandle(id);
            case ARTBOARD -> new ArtboardHandle(id);
            case STATE_MACHINE -> new StateMachineHandle(id);
            case VIEW_MODEL_INSTANCE -> new ViewModelInstanceHandle(id);
            case SURFACE -> new SurfaceHandle(id);
        };
    }
}
