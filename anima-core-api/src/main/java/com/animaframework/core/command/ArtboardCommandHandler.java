package com.animaframework.core.command;

import java.util.EnumSet;
import java.util.Set;

import com.animaframework.core.handle.HandleKind;
import com.animaframework.core.queue.CommandServer;

/**
 * 画板的创建、删除和尺寸
 */
public class ArtboardCommandHandler implements CommandHandler {

    @Override
    public Set<CommandType> supportedTypes() {
        return EnumSet.of(CommandType.CREATE_ARTBOARD, CommandType.DELETE_ARTBOARD, CommandType.LIST_STATE_MACHINES,
                CommandType.GET_ARTBOARD_SIZE, CommandType.RESIZE_ARTBOARD, CommandType.RESET_ARTBOARD_SIZE);
    }

    @Override
    public Object handle(CommandServer server, Command command) {
        return switch (command.type()) {
            case CREATE_ARTBOARD -> {
                Command.CreateArtboard create = (Command.CreateArtboard) command;
                Object file = server.getRegistry().resolve(create.file());
                yield server.getRegistry().allocate(HandleKind.ARTBOARD,
                        server.getBackend().createArtboard(file, create.name()));
            }
            case DELETE_ARTBOARD -> {
                server.deleteHandle(((Command.DeleteArtboard) command).artboard());
                yield null;
            }
            case LIST_STATE_MACHINES -> server.getBackend().stateMachineNames(
                    server.getRegistry().resolve(((Command.ListStateMachines) command).artboard()));
            case GET_ARTBOARD_SIZE -> server.getBackend().artboardSize(
                    server.getRegistry().resolve(((Command.GetArtboardSize) command).artboard()));
            case RESIZE_ARTBOARD -> {
                Command.ResizeArtboard resize = (Command.ResizeArtboard) command;
                server.getBackend().resizeArtboard(server.getRegistry().resolve(resize.artboard()), resize.width(),
                        resize.height());
                yield null;
            }
            case RESET_ARTBOARD_SIZE -> {
                server.getBackend().resetArtboardSize(
                        server.getRegistry().resolve(((Command.ResetArtboardSize) command).artboard()));
                yield null;
            }
            default -> throw new IllegalArgumentException("Unsupported command " + command.type());
        };
    }
}
