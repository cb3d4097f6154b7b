package com.animaframework.core.render;

/**
 * 单画板绘制时画板内容适配到表面的方式
 */
public enum Fit {
    FILL,
    CONTAIN,
    COVER,
    FIT_WIDTH,
    FIT_HEIGHT,
    NONE,
    SCALE_DOWN
}
