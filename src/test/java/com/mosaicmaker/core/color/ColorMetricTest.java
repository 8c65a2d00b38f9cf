package com.mosaicmaker.core.color;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColorMetricTest {

    @Test
    void distanceToSelfIsZero() {
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            Rgb c = randomColor(random);
            assertEquals(0.0, ColorMetric.distance(c, c), "distance(" + c + ", " + c + ")");
        }
    }

    @Test
    void distanceIsSymmetricAndPositiveForDifferentColors() {
        Random random = new Random(11);
        for (int i = 0; i < 200; i++) {
            Rgb a = randomColor(random);
            Rgb b = randomColor(random);
            double ab = ColorMetric.distance(a, b);
            assertEquals(ab, ColorMetric.distance(b, a));
            if (!a.equals(b)) {
                assertTrue(ab > 0, "Different colors must have a positive distance");
            }
        }
    }

    @Test
    void computesEuclideanDistance() {
        assertEquals(Math.sqrt(300), ColorMetric.distance(new Rgb(10, 10, 10), new Rgb(0, 0, 0)), 1e-9);
        assertEquals(5.0, ColorMetric.distance(new Rgb(3, 4, 0), new Rgb(0, 0, 0)), 1e-9);
        assertEquals(Math.sqrt(3) * 255, ColorMetric.distance(new Rgb(0, 0, 0), new Rgb(255, 255, 255)), 1e-9);
    }

    @Test
    void ignoresAlphaWhenReadingPackedPixels() {
        Rgb opaque = Rgb.fromArgb(0xFF102030);
        Rgb translucent = Rgb.fromArgb(0x40102030);
        assertEquals(opaque, translucent);
        assertEquals(0.0, ColorMetric.distance(opaque, translucent));
        assertEquals(0xFF102030, opaque.toArgb());
    }

    @Test
    void rejectsChannelsOutsideEightBits() {
        assertThrows(IllegalArgumentException.class, () -> new Rgb(256, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Rgb(0, -1, 0));
    }

    private static Rgb randomColor(Random random) {
        return new Rgb(random.nextInt(256), random.nextInt(256), random.nextInt(256));
    }
}
