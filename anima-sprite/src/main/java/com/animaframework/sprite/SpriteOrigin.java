package com.animaframework.sprite;

/**
 * 精灵的归一化轴心点，(0, 0) 为左上角，(1, 1) 为右下角。
 * 位置、缩放和旋转都以这个点为基准。
 */
public record SpriteOrigin(float pivotX, float pivotY) {

    public static final SpriteOrigin CENTER = new SpriteOrigin(0.5f, 0.5f);
    public static final SpriteOrigin TOP_LEFT = new SpriteOrigin(0f, 0f);

    public SpriteOrigin {
        if (!(pivotX >= 0f && pivotX <= 1f)) {
            throw new IllegalArgumentException("pivotX must be between 0 and 1, was " + pivotX);
        }
        if (!(pivotY >= 0f && pivotY <= 1f)) {
            throw new IllegalArgumentException("pivotY must be between 0 and 1, was " + pivotY);
        }
    }

    public static SpriteOrigin custom(float pivotX, float pivotY) {
        return new SpriteOrigin(pivotX, pivotY);
    }
}
