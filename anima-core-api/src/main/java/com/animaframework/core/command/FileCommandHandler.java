package com.animaframework.core.command;

import java.util.EnumSet;
import java.util.Set;

import com.animaframework.core.handle.FileHandle;
import com.animaframework.core.handle.HandleKind;
import com.animaframework.core.queue.CommandServer;
import lombok.extern.slf4j.Slf4j;

/**
 * 文件的加载、删除和内容枚举
 */
@Slf4j
public class FileCommandHandler implements CommandHandler {

    @Override
    public Set<CommandType> supportedTypes() {
        return EnumSet.of(CommandType.LOAD_FILE, CommandType.DELETE_FILE, CommandType.LIST_ARTBOARDS,
                CommandType.LIST_VIEW_MODELS, CommandType.LIST_VIEW_MODEL_INSTANCES);
    }

    @Override
    public Object handle(CommandServer server, Command command) {
        return switch (command.type()) {
            case LOAD_FILE -> {
                Command.LoadFile load = (Command.LoadFile) command;
                Object file = server.getBackend().loadFile(load.bytes());
                FileHandle handle = server.getRegistry().allocate(HandleKind.FILE, file);
                log.debug("文件已加载 {} ({} bytes)", handle, load.bytes().length);
                yield handle;
            }
            case DELETE_FILE -> {
                server.deleteHandle(((Command.DeleteFile) command).file());
                yield null;
            }
            case LIST_ARTBOARDS -> server.getBackend().artboardNames(
                    server.getRegistry().resolve(((Command.ListArtboards) command).file()));
            case LIST_VIEW_MODELS -> server.getBackend().viewModelNames(
                    server.getRegistry().resolve(((Command.ListViewModels) command).file()));
            case LIST_VIEW_MODEL_INSTANCES -> {
                Command.ListViewModelInstances list = (Command.ListViewModelInstances) command;
                yield server.getBackend().viewModelInstanceNames(server.getRegistry().resolve(list.file()),
                        list.viewModelName());
            }
            default -> throw new IllegalArgumentException("Unsupported command " + command.type());
        };
    }
}
