package com.animaframework.core.backend;

/**
 * 画板尺寸（像素）
 */
public record ArtboardSize(float width, float height) {
}
