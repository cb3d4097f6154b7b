package com.animaframework.core.backend.software;

import java.util.Arrays;

/**
 * 把经过仿射变换的矩形以纯色填充到 ARGB 像素数组
 */
final class SoftwareRasterizer {

    private static final double EPSILON = 1e-9;

    private SoftwareRasterizer() {
    }

    static void clear(int[] pixels, int argb) {
        Arrays.fill(pixels, argb);
    }

    /**
     * 填充本地矩形 [0, width) x [0, height) 经 transform 映射后覆盖的像素（按像素中心采样）
     */
    static void fillRect(int[] pixels, int surfaceWidth, int surfaceHeight, float[] transform, float width,
            float height, int argb) {
        if ((argb >>> 24) == 0 || width <= 0 || height <= 0) {
            return;
        }
        double a = transform[0];
        double b = transform[1];
        double c = transform[2];
        double d = transform[3];
        double tx = transform[4];
        double ty = transform[5];
        double det = a * d - b * c;
        if (Math.abs(det) < EPSILON) {
            return;
        }

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        double[][] corners = {{0, 0}, {width, 0}, {0, height}, {width, height}};
        for (double[] corner : corners) {
            double x = a * corner[0] + c * corner[1] + tx;
            double y = b * corner[0] + d * corner[1] + ty;
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }
        int x0 = Math.max(0, (int) Math.floor(minX));
        int y0 = Math.max(0, (int) Math.floor(minY));
        int x1 = Math.min(surfaceWidth, (int) Math.ceil(maxX));
        int y1 = Math.min(surfaceHeight, (int) Math.ceil(maxY));

        for (int py = y0; py < y1; py++) {
            double sy = py + 0.5 - ty;
            for (int px = x0; px < x1; px++) {
                double sx = px + 0.5 - tx;
                double lx = (d * sx - c * sy) / det;
                double ly = (-b * sx + a * sy) / det;
                if (lx >= 0 && lx < width && ly >= 0 && ly < height) {
                    int index = py * surfaceWidth + px;
                    pixels[index] = blend(pixels[index], argb);
                }
            }
        }
    }

    /**
     * src-over 混合
     */
    static int blend(int dst, int src) {
        int sa = src >>> 24;
        if (sa == 0xFF) {
            return src;
        }
        int da = dst >>> 24;
        int outA = sa + da * (255 - sa) / 255;
        if (outA == 0) {
            return 0;
        }
        int r = channel(src >> 16, dst >> 16, sa, da, outA);
        int g = channel(src >> 8, dst >> 8, sa, da, outA);
        int bl = channel(src, dst, sa, da, outA);
        return (outA << 24) | (r << 16) | (g << 8) | bl;
    }

    private static int channel(int src, int dst, int sa, int da, int outA) {
        int s = src & 0xFF;
        int d = dst & 0xFF;
        return Math.min(255, (s * sa + d * da * (255 - sa) / 255) / outA);
    }

    /**
     * ARGB 像素写出为 RGBA 字节
     */
    static void toRgba(int[] pixels, byte[] dest) {
        for (int i = 0; i < pixels.length; i++) {
            int argb = pixels[i];
            int offset = i * 4;
            dest[offset] = (byte) (argb >> 16);
            dest[offset + 1] = (byte) (argb >> 8);
            dest[offset + 2] = (byte) argb;
            dest[offset + 3] = (byte) (argb >>> 24);
        }
    }
}
