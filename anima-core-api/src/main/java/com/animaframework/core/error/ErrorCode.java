package com.animaframework.core.error;

/**
 * 命令队列错误码。
 * 可恢复错误通过查询结果通道返回；DOUBLE_RELEASE 与 DUPLICATE_COMPLETION 属于编程错误，在调用点直接抛出。
 */
public enum ErrorCode {

    /**
     * 句柄未分配、已释放或类型不匹配
     */
    INVALID_HANDLE(true),

    /**
     * 队列已销毁或正在销毁
     */
    DISPOSED(true),

    /**
     * 引擎拒绝加载的资源内容
     */
    MALFORMED_RESOURCE(true),

    /**
     * 资源格式版本高于引擎支持的版本
     */
    UNSUPPORTED_VERSION(true),

    /**
     * 按名称查找的子资源不存在（画板、状态机、输入、属性等）
     */
    NOT_FOUND(true),

    /**
     * 其他后端执行失败
     */
    COMMAND_FAILED(true),

    /**
     * release 次数超过 acquire 次数
     */
    DOUBLE_RELEASE(false),

    /**
     * 同一个请求被完成两次，说明内部存在 bug
     */
    DUPLICATE_COMPLETION(false);

    private final boolean recoverable;

    ErrorCode(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
