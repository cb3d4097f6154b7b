package com.animaframework.core.backend;

import com.animaframework.core.render.DrawCommand;

/**
 * 句柄已在工作线程上解析为原生对象的一条绘制记录。
 * <p>
 * 实例由工作线程按帧复用，只在 {@link NativeBackend#drawBatch} 调用期间有效，后端不能持有引用。
 */
public final class ResolvedDraw {

    private Object artboard;
    private Object stateMachine;
    private final float[] transform = DrawCommand.identity();
    private float width;
    private float height;

    public ResolvedDraw() {
    }

    public ResolvedDraw(Object artboard, Object stateMachine, float[] transform, float width, float height) {
        set(artboard, stateMachine, transform, 0, width, height);
    }

    /**
     * 从 source[offset..offset+6) 复制变换
     */
    public ResolvedDraw set(Object artboard, Object stateMachine, float[] source, int offset, float width,
            float height) {
        this.artboard = artboard;
        this.stateMachine = stateMachine;
        System.arraycopy(source, offset, transform, 0, DrawCommand.TRANSFORM_LENGTH);
        this.width = width;
        this.height = height;
        return this;
    }

    /** 放回池中前清掉原生对象引用 */
    public void clear() {
        artboard = null;
        stateMachine = null;
    }

    /** 原生画板 */
    public Object artboard() {
        return artboard;
    }

    /** 原生状态机，可能为 null */
    public Object stateMachine() {
        return stateMachine;
    }

    /** 6 元素仿射变换 [a, b, c, d, tx, ty]，从显示空间映射到表面空间 */
    public float[] transform() {
        return transform;
    }

    /** 显示宽度，画板内容会拉伸到该尺寸 */
    public float width() {
        return width;
    }

    public float height() {
        return height;
    }
}
