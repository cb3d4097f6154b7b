package com.animaframework.sprite;

/**
 * 非均匀缩放，负值表示镜像
 */
public record SpriteScale(float scaleX, float scaleY) {

    public static final SpriteScale UNSCALED = new SpriteScale(1f, 1f);

    public SpriteScale {
        if (!Float.isFinite(scaleX) || !Float.isFinite(scaleY)) {
            throw new IllegalArgumentException("scale must be finite, was " + scaleX + "x" + scaleY);
        }
    }

    public static SpriteScale of(float scale) {
        return new SpriteScale(scale, scale);
    }

    public boolean isUniform() {
        return scaleX == scaleY;
    }

    public SpriteScale times(SpriteScale other) {
        return new SpriteScale(scaleX * other.scaleX, scaleY * other.scaleY);
    }

    public SpriteScale times(float factor) {
        return new SpriteScale(scaleX * factor, scaleY * factor);
    }
}
