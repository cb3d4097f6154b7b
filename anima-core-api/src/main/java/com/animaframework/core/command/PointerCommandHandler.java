package com.animaframework.core.command;

import java.util.EnumSet;
import java.util.Set;

import com.animaframework.core.backend.ArtboardSize;
import com.animaframework.core.backend.NativeBackend;
import com.animaframework.core.handle.HandleRegistry;
import com.animaframework.core.queue.CommandServer;
import com.animaframework.core.render.FitTransforms;
import com.animaframework.core.render.PointerTarget;
import lombok.extern.slf4j.Slf4j;

/**
 * 指针事件：表面坐标按目标的 fit/alignment 映射回画板坐标后交给状态机
 */
@Slf4j
public class PointerCommandHandler implements CommandHandler {

    private final float[] artboardPoint = new float[2];

    @Override
    public Set<CommandType> supportedTypes() {
        return EnumSet.of(CommandType.POINTER_DOWN, CommandType.POINTER_MOVE, CommandType.POINTER_UP,
                CommandType.POINTER_EXIT);
    }

    @Override
    public Object handle(CommandServer server, Command command) {
        Command.Pointer pointer = (Command.Pointer) command;
        PointerTarget target = pointer.target();
        HandleRegistry registry = server.getRegistry();
        NativeBackend backend = server.getBackend();
        Object stateMachine = registry.resolve(target.stateMachine());
        if (command.type() == CommandType.POINTER_EXIT) {
            backend.pointerExit(stateMachine, pointer.pointerId());
            return null;
        }
        ArtboardSize size = backend.artboardSize(registry.resolve(target.artboard()));
        float[] transform = FitTransforms.compute(target.fit(), target.alignment(), target.surfaceWidth(),
                target.surfaceHeight(), size.width(), size.height());
        FitTransforms.toContent(transform, pointer.x(), pointer.y(), artboardPoint);
        float x = artboardPoint[0];
        float y = artboardPoint[1];
        log.trace("指针 {} #{} ({}, {}) -> 画板 ({}, {})", command.type(), pointer.pointerId(), pointer.x(),
                pointer.y(), x, y);
        switch (command.type()) {
            case POINTER_DOWN -> backend.pointerDown(stateMachine, pointer.pointerId(), x, y);
            case POINTER_MOVE -> backend.pointerMove(stateMachine, pointer.pointerId(), x, y);
            case POINTER_UP -> backend.pointerUp(stateMachine, pointer.pointerId(), x, y);
            default -> throw new IllegalArgumentException("Unsupported command " + command.type());
        }
        return null;
    }
}
