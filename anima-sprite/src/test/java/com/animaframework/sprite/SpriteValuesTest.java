package com.animaframework.sprite;

import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpriteValuesTest {

    @Test
    void originPresets() {
        assertEquals(new SpriteOrigin(0.5f, 0.5f), SpriteOrigin.CENTER);
        assertEquals(new SpriteOrigin(0f, 0f), SpriteOrigin.TOP_LEFT);
        assertEquals(1f, SpriteOrigin.custom(1f, 0.25f).pivotX());
    }

    @Test
    void originOutsideUnitSquareIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SpriteOrigin.custom(1.01f, 0f));
        assertThrows(IllegalArgumentException.class, () -> SpriteOrigin.custom(0f, -0.1f));
        assertThrows(IllegalArgumentException.class, () -> SpriteOrigin.custom(Float.NaN, 0f));
    }

    @Test
    void scaleArithmetic() {
        SpriteScale scale = new SpriteScale(2f, 3f).times(SpriteScale.of(2f));

        assertEquals(new SpriteScale(4f, 6f), scale);
        assertFalse(scale.isUniform());
        assertTrue(SpriteScale.UNSCALED.times(5f).isUniform());
        assertThrows(IllegalArgumentException.class, () -> new SpriteScale(Float.POSITIVE_INFINITY, 1f));
    }

    @Test
    void tagsMustNotBeBlank() {
        assertThrows(IllegalArgumentException.class, () -> SpriteTag.of(" "));
        assertThrows(IllegalArgumentException.class, () -> SpriteTag.of(null));
        assertEquals(Set.of(SpriteTag.of("enemy"), SpriteTag.of("flying")), SpriteTag.tags("enemy", "flying"));
    }
}
