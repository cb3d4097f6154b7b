package com.animaframework.core.command;

import java.util.EnumSet;
import java.util.Set;

import com.animaframework.core.handle.HandleKind;
import com.animaframework.core.queue.CommandServer;
import lombok.extern.slf4j.Slf4j;

/**
 * 状态机的创建、推进、输入以及视图模型绑定
 */
@Slf4j
public class StateMachineCommandHandler implements CommandHandler {

    @Override
    public Set<CommandType> supportedTypes() {
        return EnumSet.of(CommandType.CREATE_STATE_MACHINE, CommandType.DELETE_STATE_MACHINE,
                CommandType.ADVANCE_STATE_MACHINE, CommandType.LIST_INPUTS, CommandType.GET_INPUT,
                CommandType.SET_INPUT, CommandType.BIND_VIEW_MODEL_INSTANCE);
    }

    @Override
    public Object handle(CommandServer server, Command command) {
        return switch (command.type()) {
            case CREATE_STATE_MACHINE -> {
                Command.CreateStateMachine create = (Command.CreateStateMachine) command;
                Object artboard = server.getRegistry().resolve(create.artboard());
                yield server.getRegistry().allocate(HandleKind.STATE_MACHINE,
                        server.getBackend().createStateMachine(artboard, create.name()));
            }
            case DELETE_STATE_MACHINE -> {
                server.deleteHandle(((Command.DeleteStateMachine) command).stateMachine());
                yield null;
            }
            case ADVANCE_STATE_MACHINE -> {
                Command.AdvanceStateMachine advance = (Command.AdvanceStateMachine) command;
                boolean settled = server.getBackend().advance(
                        server.getRegistry().resolve(advance.stateMachine()), advance.deltaSeconds());
                if (settled) {
                    log.debug("状态机 {} 已稳定", advance.stateMachine());
                    server.publishSettled(advance.stateMachine());
                }
                yield settled;
            }
            case LIST_INPUTS -> server.getBackend().inputs(
                    server.getRegistry().resolve(((Command.ListInputs) command).stateMachine()));
            case GET_INPUT -> {
                Command.GetInput get = (Command.GetInput) command;
                yield server.getBackend().getInput(server.getRegistry().resolve(get.stateMachine()), get.name(),
                        get.inputType());
            }
            case SET_INPUT -> {
                Command.SetInput set = (Command.SetInput) command;
                server.getBackend().setInput(server.getRegistry().resolve(set.stateMachine()), set.name(),
                        set.inputType(), set.value());
                yield null;
            }
            case BIND_VIEW_MODEL_INSTANCE -> {
                Command.BindViewModelInstance bind = (Command.BindViewModelInstance) command;
                server.getBackend().bindViewModelInstance(server.getRegistry().resolve(bind.stateMachine()),
                        server.getRegistry().resolve(bind.instance()));
                yield null;
            }
            default -> throw new IllegalArgumentException("Unsupported command " + command.type());
        };
    }
}
