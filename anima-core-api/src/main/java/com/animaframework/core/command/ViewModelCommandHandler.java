package com.animaframework.core.command;

import java.util.EnumSet;
import java.util.Set;

import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.handle.HandleKind;
import com.animaframework.core.property.PropertyKey;
import com.animaframework.core.queue.CommandServer;

/**
 * 视图模型实例的创建、删除、属性读写以及订阅校验
 */
public class ViewModelCommandHandler implements CommandHandler {

    @Override
    public Set<CommandType> supportedTypes() {
        return EnumSet.of(CommandType.CREATE_VIEW_MODEL_INSTANCE, CommandType.DELETE_VIEW_MODEL_INSTANCE,
                CommandType.GET_PROPERTY, CommandType.SET_PROPERTY, CommandType.SUBSCRIBE_PROPERTY);
    }

    @Override
    public Object handle(CommandServer server, Command command) {
        return switch (command.type()) {
            case CREATE_VIEW_MODEL_INSTANCE -> {
                Command.CreateViewModelInstance create = (Command.CreateViewModelInstance) command;
                Object file = server.getRegistry().resolve(create.file());
                Object instance = server.getBackend().createViewModelInstance(file, create.viewModelName(),
                        create.instanceName(), create.source());
                yield server.getRegistry().allocate(HandleKind.VIEW_MODEL_INSTANCE, instance);
            }
            case DELETE_VIEW_MODEL_INSTANCE -> {
                server.deleteHandle(((Command.DeleteViewModelInstance) command).instance());
                yield null;
            }
            case GET_PROPERTY -> {
                Command.GetProperty get = (Command.GetProperty) command;
                yield server.getBackend().getProperty(server.getRegistry().resolve(get.instance()), get.path(),
                        get.propertyType());
            }
            case SET_PROPERTY -> {
                Command.SetProperty set = (Command.SetProperty) command;
                server.getBackend().setProperty(server.getRegistry().resolve(set.instance()), set.path(),
                        set.propertyType(), set.value());
                yield null;
            }
            case SUBSCRIBE_PROPERTY -> {
                subscribe(server, (Command.SubscribeProperty) command);
                yield null;
            }
            default -> throw new IllegalArgumentException("Unsupported command " + command.type());
        };
    }

    private void subscribe(CommandServer server, Command.SubscribeProperty subscribe) {
        PropertyKey key = subscribe.key();
        try {
            Object instance = server.getRegistry().resolve(key.handle());
            if (server.getBackend().propertyType(instance, key.propertyPath()).isEmpty()) {
                throw CommandQueueException.notFound("Property", key.propertyPath());
            }
        } catch (CommandQueueException e) {
            server.getPropertyBus().failSubscription(subscribe.subscriptionId(), e);
            throw e;
        }
    }
}
