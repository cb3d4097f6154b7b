package com.animaframework.core.command;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.animaframework.core.backend.ArtboardSize;
import com.animaframework.core.backend.ResolvedDraw;
import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import com.animaframework.core.handle.HandleKind;
import com.animaframework.core.handle.HandleRegistry;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.queue.CommandServer;
import com.animaframework.core.render.FitTransforms;
import com.animaframework.core.render.ImageSurface;
import lombok.extern.slf4j.Slf4j;

/**
 * 表面管理以及单画板/批量绘制。
 * <p>
 * 只在工作线程上使用，解析结果放在按帧复用的 {@link ResolvedDraw} 池里。
 */
@Slf4j
public class RenderCommandHandler implements CommandHandler {

    private final List<ResolvedDraw> pool = new ArrayList<>();
    private final List<ResolvedDraw> resolved = new ArrayList<>();

    @Override
    public Set<CommandType> supportedTypes() {
        return EnumSet.of(CommandType.CREATE_SURFACE, CommandType.DELETE_SURFACE, CommandType.DRAW,
                CommandType.DRAW_BATCH);
    }

    @Override
    public Object handle(CommandServer server, Command command) {
        return switch (command.type()) {
            case CREATE_SURFACE -> {
                Command.CreateSurface create = (Command.CreateSurface) command;
                yield server.getRegistry().allocate(HandleKind.SURFACE,
                        server.getBackend().createSurface(create.width(), create.height()));
            }
            case DELETE_SURFACE -> {
                server.deleteHandle(((Command.DeleteSurface) command).surface());
                yield null;
            }
            case DRAW -> draw(server, (Command.Draw) command);
            case DRAW_BATCH -> drawBatch(server, (Command.DrawBatch) command);
            default -> throw new IllegalArgumentException("Unsupported command " + command.type());
        };
    }

    private byte[] draw(CommandServer server, Command.Draw draw) {
        HandleRegistry registry = server.getRegistry();
        ImageSurface surface = draw.surface();
        Object nativeSurface = registry.resolve(surface.handle());
        Object artboard = registry.resolve(draw.artboard());
        Object stateMachine = draw.stateMachine() != null ? registry.resolve(draw.stateMachine()) : null;
        ArtboardSize size = server.getBackend().artboardSize(artboard);
        float[] transform = FitTransforms.compute(draw.fit(), draw.alignment(), surface.width(), surface.height(),
                size.width(), size.height());
        try {
            resolved.add(slot(0).set(artboard, stateMachine, transform, 0, size.width(), size.height()));
            server.getBackend().drawBatch(nativeSurface, resolved, draw.clearColor());
        } finally {
            release();
        }
        return readback(server, nativeSurface, draw.readback());
    }

    private byte[] drawBatch(CommandServer server, Command.DrawBatch batch) {
        HandleRegistry registry = server.getRegistry();
        Object nativeSurface = registry.resolve(batch.surface().handle());
        PackedDrawList draws = batch.draws();
        try {
            float[] transforms = draws.transforms();
            for (int i = 0; i < draws.size(); i++) {
                try {
                    StateMachineHandle stateMachine = draws.stateMachine(i);
                    Object artboard = registry.resolve(draws.artboard(i));
                    Object nativeStateMachine = stateMachine != null ? registry.resolve(stateMachine) : null;
                    resolved.add(slot(resolved.size()).set(artboard, nativeStateMachine, transforms,
                            draws.transformOffset(i), draws.width(i), draws.height(i)));
                } catch (CommandQueueException e) {
                    if (e.getCode() != ErrorCode.INVALID_HANDLE) {
                        throw e;
                    }
                    log.warn("批量绘制跳过第 {} 条记录: {}", i, e.getMessage());
                    server.getMetrics().getSkippedDrawCommands().inc();
                }
            }
            server.getBackend().drawBatch(nativeSurface, resolved, batch.clearColor());
        } finally {
            release();
        }
        server.getMetrics().getDrawBatches().mark();
        return readback(server, nativeSurface, batch.readback());
    }

    private ResolvedDraw slot(int index) {
        while (pool.size() <= index) {
            pool.add(new ResolvedDraw());
        }
        return pool.get(index);
    }

    private void release() {
        for (ResolvedDraw draw : resolved) {
            draw.clear();
        }
        resolved.clear();
    }

    private byte[] readback(CommandServer server, Object nativeSurface, byte[] dest) {
        if (dest == null) {
            return null;
        }
        server.getBackend().readPixels(nativeSurface, dest);
        return dest;
    }
}
