package com.animaframework.core.queue;

import com.animaframework.core.command.Command;

/**
 * 接收不需要回复的命令的执行失败，在工作线程上回调，不应阻塞
 */
@FunctionalInterface
public interface CommandErrorListener {

    void onCommandFailed(Command command, Throwable error);
}
