package com.animaframework.sprite;

/**
 * 精灵变换后矩形在世界坐标中的轴对齐包围盒
 */
public record SpriteBounds(float left, float top, float right, float bottom) {

    public float width() {
        return right - left;
    }

    public float height() {
        return bottom - top;
    }

    public boolean contains(float x, float y) {
        return x >= left && x < right && y >= top && y < bottom;
    }

    public boolean intersects(SpriteBounds other) {
        return left < other.right && other.left < right && top < other.bottom && other.top < bottom;
    }
}
