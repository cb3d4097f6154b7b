package com.animaframework.core.error;

import com.animaframework.core.handle.Handle;
import lombok.Getter;

/**
 * 命令队列的统一异常类型，携带 {@link ErrorCode}。
 * 查询命令的失败以该异常完成调用方的 Future，不会越过工作线程边界。
 */
@Getter
public class CommandQueueException extends RuntimeException {

    private final ErrorCode code;

    public CommandQueueException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CommandQueueException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static CommandQueueException invalidHandle(Handle handle) {
        return new CommandQueueException(ErrorCode.INVALID_HANDLE, "Invalid handle: " + handle);
    }

    public static CommandQueueException disposed(String queueName) {
        return new CommandQueueException(ErrorCode.DISPOSED,
                "CommandQueue '%s' was disposed before the operation could complete".formatted(queueName));
    }

    public static CommandQueueException malformed(String detail, Throwable cause) {
        return new CommandQueueException(ErrorCode.MALFORMED_RESOURCE, "Malformed resource: " + detail, cause);
    }

    public static CommandQueueException unsupportedVersion(int version, int supported) {
        return new CommandQueueException(ErrorCode.UNSUPPORTED_VERSION,
                "Resource format version %d is newer than supported version %d".formatted(version, supported));
    }

    public static CommandQueueException notFound(String what, String name) {
        return new CommandQueueException(ErrorCode.NOT_FOUND, "%s '%s' not found".formatted(what, name));
    }

    @Override
    public String toString() {
        return "CommandQueueException[" + code + "]: " + getMessage();
    }
}
