package com.animaframework.core.handle;

/**
 * 文件句柄
 */
public record FileHandle(long id) implements Handle {

    @Override
    public HandleKind kind() {
        return HandleKind.FILE;
    }

    @Override
    public String toString() {
        return "FileHandle(" + id + ")";
    }
}
