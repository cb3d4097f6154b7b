package com.animaframework.core.command;

import java.util.EnumSet;
import java.util.Set;

import com.animaframework.core.queue.CommandServer;

/**
 * 在工作线程上执行调用方提交的任意任务
 */
public class WorkerTaskCommandHandler implements CommandHandler {

    @Override
    public Set<CommandType> supportedTypes() {
        return EnumSet.of(CommandType.RUN_ON_WORKER);
    }

    @Override
    public Object handle(CommandServer server, Command command) throws Exception {
        return ((Command.RunOnWorker) command).task().call();
    }
}
