package com.mosaicmaker.core.render;

import com.mosaicmaker.core.color.Rgb;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Averages the color channels of every pixel that is not fully transparent.
 */
public final class PixelColorAverager implements ColorAverager {
    private final ImageCodec codec;

    public PixelColorAverager(ImageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public Optional<Rgb> average(Path file) throws IOException {
        return average(codec.decode(file));
    }

    public static Optional<Rgb> average(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] row = new int[width];
        long red = 0;
        long green = 0;
        long blue = 0;
        long counted = 0;
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int argb : row) {
                if ((argb >>> 24) == 0) {
                    continue;
                }
                red += (argb >> 16) & 0xFF;
                green += (argb >> 8) & 0xFF;
                blue += argb & 0xFF;
                counted++;
            }
        }
        if (counted == 0) {
            return Optional.empty();
        }
        long half = counted / 2;
        return Optional.of(new Rgb(
            (int) ((red + half) / counted),
            (int) ((green + half) / counted),
            (int) ((blue + half) / counted)
        ));
    }
}
