package com.animaframework.core.queue;

import com.animaframework.core.command.Command;

/**
 * 通道中的命令信封
 *
 * @param requestId 请求 id；不需要回复的命令也分配 id，便于日志关联
 * @param command   命令
 * @param query     是否需要在 {@link CompletionCorrelator} 中完成结果
 */
record QueuedCommand(long requestId, Command command, boolean query) {
}
