package com.animaframework.sprite;

import com.animaframework.core.render.DrawCommand;

/**
 * 精灵仿射变换 [a, b, c, d, tx, ty] 的计算与求逆，映射为
 * x' = a * x + c * y + tx，y' = b * x + d * y + ty。
 * <p>
 * 全部写入调用方提供的数组，不分配中间矩阵对象。
 */
public final class SpriteTransforms {

    private static final double EPSILON = 1e-9;

    private SpriteTransforms() {
    }

    public static float[] compute(Sprite sprite, float[] out) {
        SpriteScale scale = sprite.getScale();
        SpriteOrigin origin = sprite.getOrigin();
        return compute(sprite.getX(), sprite.getY(), scale.scaleX(), scale.scaleY(), sprite.getRotation(),
                origin.pivotX() * sprite.getWidth(), origin.pivotY() * sprite.getHeight(), out);
    }

    /**
     * @param rotationDegrees 顺时针角度（y 轴向下）
     * @param pivotX          轴心点，显示尺寸单位
     * @param pivotY          轴心点，显示尺寸单位
     */
    public static float[] compute(float x, float y, float scaleX, float scaleY, float rotationDegrees, float pivotX,
            float pivotY, float[] out) {
        checkLength(out);
        if (rotationDegrees == 0f) {
            out[0] = scaleX;
            out[1] = 0f;
            out[2] = 0f;
            out[3] = scaleY;
            out[4] = x - pivotX * scaleX;
            out[5] = y - pivotY * scaleY;
            return out;
        }
        double radians = Math.toRadians(rotationDegrees);
        float cos = (float) Math.cos(radians);
        float sin = (float) Math.sin(radians);
        out[0] = scaleX * cos;
        out[1] = scaleY * sin;
        out[2] = -scaleX * sin;
        out[3] = scaleY * cos;
        out[4] = x - (pivotX * scaleX * cos - pivotY * scaleX * sin);
        out[5] = y - (pivotX * scaleY * sin + pivotY * scaleY * cos);
        return out;
    }

    /**
     * 把世界坐标点映射回精灵本地坐标
     *
     * @return 变换不可逆（缩放为 0）时返回 false，out 不变
     */
    public static boolean toLocal(float[] transform, float worldX, float worldY, float[] out) {
        double a = transform[0];
        double b = transform[1];
        double c = transform[2];
        double d = transform[3];
        double det = a * d - b * c;
        if (Math.abs(det) < EPSILON) {
            return false;
        }
        double sx = worldX - transform[4];
        double sy = worldY - transform[5];
        out[0] = (float) ((d * sx - c * sy) / det);
        out[1] = (float) ((-b * sx + a * sy) / det);
        return true;
    }

    /**
     * 本地矩形 [0, width] x [0, height] 变换后的包围盒
     */
    public static SpriteBounds bounds(float[] transform, float width, float height) {
        float a = transform[0];
        float b = transform[1];
        float c = transform[2];
        float d = transform[3];
        float tx = transform[4];
        float ty = transform[5];
        float minX = Float.POSITIVE_INFINITY;
        float minY = Float.POSITIVE_INFINITY;
        float maxX = Float.NEGATIVE_INFINITY;
        float maxY = Float.NEGATIVE_INFINITY;
        for (int corner = 0; corner < 4; corner++) {
            float lx = (corner & 1) == 0 ? 0f : width;
            float ly = (corner & 2) == 0 ? 0f : height;
            float wx = a * lx + c * ly + tx;
            float wy = b * lx + d * ly + ty;
            minX = Math.min(minX, wx);
            minY = Math.min(minY, wy);
            maxX = Math.max(maxX, wx);
            maxY = Math.max(maxY, wy);
        }
        return new SpriteBounds(minX, minY, maxX, maxY);
    }

    private static void checkLength(float[] out) {
        if (out.length < DrawCommand.TRANSFORM_LENGTH) {
            throw new IllegalArgumentException("transform must have 6 elements, had " + out.length);
        }
    }
}
