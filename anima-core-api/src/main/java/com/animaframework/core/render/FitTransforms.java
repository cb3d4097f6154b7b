package com.animaframework.core.render;

/**
 * 计算把 content 尺寸的画板按 {@link Fit}/{@link Alignment} 放入 frame 尺寸表面的仿射变换
 */
public final class FitTransforms {

    private FitTransforms() {
    }

    /**
     * @return [a, b, c, d, tx, ty]，作用于画板本地坐标（0..contentWidth, 0..contentHeight）
     */
    public static float[] compute(Fit fit, Alignment alignment, float frameWidth, float frameHeight,
            float contentWidth, float contentHeight) {
        if (contentWidth <= 0 || contentHeight <= 0) {
            throw new IllegalArgumentException("content size must be positive");
        }
        float sx = frameWidth / contentWidth;
        float sy = frameHeight / contentHeight;
        float scaleX;
        float scaleY;
        switch (fit) {
            case FILL -> {
                scaleX = sx;
                scaleY = sy;
            }
            case CONTAIN -> scaleX = scaleY = Math.min(sx, sy);
            case COVER -> scaleX = scaleY = Math.max(sx, sy);
            case FIT_WIDTH -> scaleX = scaleY = sx;
            case FIT_HEIGHT -> scaleX = scaleY = sy;
            case NONE -> scaleX = scaleY = 1f;
            case SCALE_DOWN -> scaleX = scaleY = Math.min(1f, Math.min(sx, sy));
            default -> throw new IllegalArgumentException("Unknown fit " + fit);
        }
        float freeX = frameWidth - contentWidth * scaleX;
        float freeY = frameHeight - contentHeight * scaleY;
        float tx = freeX * (alignment.x() + 1f) / 2f;
        float ty = freeY * (alignment.y() + 1f) / 2f;
        return new float[] {scaleX, 0f, 0f, scaleY, tx, ty};
    }

    /**
     * 把表面坐标映射回画板本地坐标。transform 必须来自 {@link #compute}（只有缩放和平移）
     *
     * @return out
     */
    public static float[] toContent(float[] transform, float x, float y, float[] out) {
        out[0] = (x - transform[4]) / transform[0];
        out[1] = (y - transform[5]) / transform[3];
        return out;
    }
}
