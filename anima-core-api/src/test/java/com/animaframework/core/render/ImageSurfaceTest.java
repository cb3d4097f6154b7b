package com.animaframework.core.render;

import com.animaframework.core.handle.SurfaceHandle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageSurfaceTest {

    @Test
    void byteSizeIsFourBytesPerPixel() {
        assertEquals(8 * 6 * 4, new ImageSurface(new SurfaceHandle(1), 8, 6).byteSize());
    }

    @Test
    void sizesWhoseReadbackWouldNotFitInAnArrayAreRejected() {
        // 30000 x 30000 x 4 超出 int 范围
        assertThrows(IllegalArgumentException.class, () -> new ImageSurface(new SurfaceHandle(1), 30000, 30000));
        assertThrows(IllegalArgumentException.class,
                () -> new ImageSurface(new SurfaceHandle(1), Integer.MAX_VALUE, 1));
        assertThrows(IllegalArgumentException.class, () -> ImageSurface.checkSize(46341, 46341));
    }

    @Test
    void largestAllowedSurfaceStillReportsAPositiveByteSize() {
        int width = ImageSurface.MAX_BYTE_SIZE / ImageSurface.BYTES_PER_PIXEL;
        ImageSurface surface = new ImageSurface(new SurfaceHandle(1), width, 1);
        assertTrue(surface.byteSize() > 0);
        assertEquals((long) width * ImageSurface.BYTES_PER_PIXEL, surface.byteSize());
    }

    @Test
    void nonPositiveSizesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ImageSurface(new SurfaceHandle(1), 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ImageSurface(new SurfaceHandle(1), 1, -1));
    }
}
