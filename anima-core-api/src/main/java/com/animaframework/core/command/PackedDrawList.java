package com.animaframework.core.command;

import java.util.List;
import java.util.Objects;

import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.render.DrawCommand;

/**
 * 入队时对 {@link DrawCommand} 列表的扁平化快照。
 * 调用方复用的 DrawCommand 和变换缓冲区在入队后可以立即改写，不影响工作线程。
 */
public final class PackedDrawList {

    // 0 表示没有状态机，合法句柄从 1 开始
    private static final long NO_STATE_MACHINE = 0L;

    private final int count;
    private final long[] artboards;
    private final long[] stateMachines;
    private final float[] transforms;
    private final float[] sizes;

    private PackedDrawList(int count) {
        this.count = count;
        this.artboards = new long[count];
        this.stateMachines = new long[count];
        this.transforms = new float[count * DrawCommand.TRANSFORM_LENGTH];
        this.sizes = new float[count * 2];
    }

    public static PackedDrawList of(List<DrawCommand> commands) {
        PackedDrawList packed = new PackedDrawList(commands.size());
        for (int i = 0; i < commands.size(); i++) {
            DrawCommand command = commands.get(i);
            if (command == null) {
                throw new NullPointerException("draw command " + i + " is null");
            }
            packed.artboards[i] = command.artboard().id();
            packed.stateMachines[i] = command.stateMachine() != null ? command.stateMachine().id() : NO_STATE_MACHINE;
            System.arraycopy(command.transform(), 0, packed.transforms, i * DrawCommand.TRANSFORM_LENGTH,
                    DrawCommand.TRANSFORM_LENGTH);
            packed.sizes[i * 2] = command.width();
            packed.sizes[i * 2 + 1] = command.height();
        }
        return packed;
    }

    public int size() {
        return count;
    }

    public ArtboardHandle artboard(int index) {
        return new ArtboardHandle(artboards[index]);
    }

    /**
     * 可能为 null
     */
    public StateMachineHandle stateMachine(int index) {
        long id = stateMachines[index];
        return id == NO_STATE_MACHINE ? null : new StateMachineHandle(id);
    }

    /**
     * 全部记录的变换，第 index 条从 {@link #transformOffset(int)} 开始，共 6 个元素。只读
     */
    public float[] transforms() {
        return transforms;
    }

    public int transformOffset(int index) {
        Objects.checkIndex(index, count);
        return index * DrawCommand.TRANSFORM_LENGTH;
    }

    public float width(int index) {
        return sizes[index * 2];
    }

    public float height(int index) {
        return sizes[index * 2 + 1];
    }
}
