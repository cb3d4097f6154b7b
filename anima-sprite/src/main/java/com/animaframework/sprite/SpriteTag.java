package com.animaframework.sprite;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 精灵分组标签
 */
public record SpriteTag(String value) {

    public SpriteTag {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SpriteTag value cannot be blank");
        }
    }

    public static SpriteTag of(String value) {
        return new SpriteTag(value);
    }

    public static Set<SpriteTag> tags(String... values) {
        return Arrays.stream(values).map(SpriteTag::new).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String toString() {
        return "SpriteTag(" + value + ")";
    }
}
