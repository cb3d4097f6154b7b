package com.animaframework.core.render;

import java.util.Objects;

import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.StateMachineHandle;

/**
 * 一条批量绘制记录：画板/状态机句柄、6 元素仿射变换以及显示尺寸。
 * <p>
 * 可变且可复用：精灵场景每帧改写同一批实例，变换数组直接引用精灵预分配的缓冲区。
 * 队列在入队时会复制内容，所以提交后可以立即改写。
 */
public final class DrawCommand {

    public static final int TRANSFORM_LENGTH = 6;

    private ArtboardHandle artboard;
    private StateMachineHandle stateMachine;
    private float[] transform;
    private float width;
    private float height;

    public DrawCommand() {
        this.transform = identity();
    }

    public DrawCommand(ArtboardHandle artboard, StateMachineHandle stateMachine, float[] transform, float width,
            float height) {
        set(artboard, stateMachine, transform, width, height);
    }

    /**
     * 原地改写全部字段
     *
     * @return this
     */
    public DrawCommand set(ArtboardHandle artboard, StateMachineHandle stateMachine, float[] transform, float width,
            float height) {
        Objects.requireNonNull(transform, "transform");
        if (transform.length < TRANSFORM_LENGTH) {
            throw new IllegalArgumentException("transform must have 6 elements, had " + transform.length);
        }
        this.artboard = Objects.requireNonNull(artboard, "artboard");
        this.stateMachine = stateMachine;
        this.transform = transform;
        this.width = width;
        this.height = height;
        return this;
    }

    public ArtboardHandle artboard() {
        return artboard;
    }

    /**
     * 可能为 null
     */
    public StateMachineHandle stateMachine() {
        return stateMachine;
    }

    public float[] transform() {
        return transform;
    }

    public float width() {
        return width;
    }

    public float height() {
        return height;
    }

    public static float[] identity() {
        return new float[] {1f, 0f, 0f, 1f, 0f, 0f};
    }

    @Override
    public String toString() {
        return "DrawCommand[" + artboard + ", " + stateMachine + ", [" + transform[0] + ", " + transform[1] + ", "
                + transform[2] + ", " + transform[3] + ", " + transform[4] + ", " + transform[5] + "], " + width
                + "x" + height + "]";
    }
}
