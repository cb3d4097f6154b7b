package com.animaframework.core.render;

import com.animaframework.core.handle.SurfaceHandle;

/**
 * 离屏绘制表面。调用方持有尺寸信息，用于在入队前校验读回缓冲区大小。
 */
public record ImageSurface(SurfaceHandle handle, int width, int height) {

    public static final int BYTES_PER_PIXEL = 4;

    /** 读回缓冲区是 byte[]，受 JVM 数组长度上限约束 */
    public static final int MAX_BYTE_SIZE = Integer.MAX_VALUE - 8;

    public ImageSurface {
        if (handle == null) {
            throw new NullPointerException("handle");
        }
        checkSize(width, height);
    }

    /**
     * @throws IllegalArgumentException 尺寸不为正，或 RGBA 字节数超过 {@link #MAX_BYTE_SIZE}
     */
    public static void checkSize(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("surface size must be positive, was " + width + "x" + height);
        }
        if ((long) width * height * BYTES_PER_PIXEL > MAX_BYTE_SIZE) {
            throw new IllegalArgumentException("surface " + width + "x" + height + " exceeds the maximum of "
                    + MAX_BYTE_SIZE + " bytes");
        }
    }

    /**
     * RGBA 读回所需的字节数
     */
    public int byteSize() {
        return Math.multiplyExact(Math.multiplyExact(width, height), BYTES_PER_PIXEL);
    }
}
