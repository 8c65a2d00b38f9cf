package com.mosaicmaker.core.render;

import com.mosaicmaker.core.color.Rgb;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PixelColorAveragerTest {

    @TempDir
    Path tempDir;

    @Test
    void averagesOpaquePixelsAndIgnoresTransparentOnes() {
        BufferedImage image = new BufferedImage(3, 1, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, 0xFF000000);
        image.setRGB(1, 0, 0xFFFFFFFF);
        image.setRGB(2, 0, 0x00FF0000);

        assertEquals(Optional.of(new Rgb(128, 128, 128)), PixelColorAverager.average(image));
    }

    @Test
    void fullyTransparentImageHasNoAverage() {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        assertTrue(PixelColorAverager.average(image).isEmpty());
    }

    @Test
    void averagesImageFiles() throws IOException {
        Path png = tempDir.resolve("teal.png");
        ImageIO.write(DefaultImageCodecTest.solid(5, 5, 0xFF0A141E), "png", png.toFile());

        PixelColorAverager averager = new PixelColorAverager(new DefaultImageCodec());

        assertEquals(Optional.of(new Rgb(10, 20, 30)), averager.average(png));
    }

    @Test
    void propagatesDecodeFailures() throws IOException {
        Path junk = Files.writeString(tempDir.resolve("junk.jpg"), "nope");
        PixelColorAverager averager = new PixelColorAverager(new DefaultImageCodec());
        assertThrows(IOException.class, () -> averager.average(junk));
    }
}
