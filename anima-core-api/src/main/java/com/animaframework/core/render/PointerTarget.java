package com.animaframework.core.render;

import java.util.Objects;

import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.StateMachineHandle;

/**
 * 指针事件的目标：接收事件的状态机，以及画板按 fit/alignment 绘制到的表面尺寸。
 * 工作线程用同一套 {@link FitTransforms} 把表面坐标映射回画板坐标。
 */
public record PointerTarget(ArtboardHandle artboard, StateMachineHandle stateMachine, Fit fit, Alignment alignment,
        float surfaceWidth, float surfaceHeight) {

    public PointerTarget {
        Objects.requireNonNull(artboard, "artboard");
        Objects.requireNonNull(stateMachine, "stateMachine");
        Objects.requireNonNull(fit, "fit");
        Objects.requireNonNull(alignment, "alignment");
        if (!(surfaceWidth > 0) || !(surfaceHeight > 0)) {
            throw new IllegalArgumentException(
                    "surface size must be positive, was " + surfaceWidth + "x" + surfaceHeight);
        }
    }

    /**
     * 画板拉伸到 width x height 的显示区域，坐标以显示区域左上角为原点
     */
    public static PointerTarget stretched(ArtboardHandle artboard, StateMachineHandle stateMachine, float width,
            float height) {
        return new PointerTarget(artboard, stateMachine, Fit.FILL, Alignment.CENTER, width, height);
    }
}
