package com.mosaicmaker.core.assemble;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A finished mosaic: the composed image and the grid that produced it.
 * The image is private to the canvas; callers receive copies.
 */
public final class MosaicCanvas {
    private final BufferedImage image;
    private final MatchGrid grid;
    private final int subpixelSize;

    MosaicCanvas(BufferedImage image, MatchGrid grid, int subpixelSize) {
        this.image = Objects.requireNonNull(image, "image");
        this.grid = Objects.requireNonNull(grid, "grid");
        this.subpixelSize = subpixelSize;
    }

    public BufferedImage image() {
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        copy.setData(image.getRaster());
        return copy;
    }

    public MatchGrid grid() {
        return grid;
    }

    public int subpixelSize() {
        return subpixelSize;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public int pixel(int x, int y) {
        return image.getRGB(x, y);
    }
}
