package com.animaframework.core.command;

import java.util.Set;

import com.animaframework.core.queue.CommandServer;

/**
 * 工作线程上的命令处理器，按领域划分，每个处理器声明自己负责的命令类型。
 */
public interface CommandHandler {

    /**
     * 此处理器可以处理的命令类型
     */
    Set<CommandType> supportedTypes();

    /**
     * 在工作线程上执行命令
     *
     * @param server  命令服务器，提供句柄注册表和后端
     * @param command 要执行的命令
     * @return 查询结果，不需要回复的命令返回 null
     */
    Object handle(CommandServer server, Command command) throws Exception;
}
