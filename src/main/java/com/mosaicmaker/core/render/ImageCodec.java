package com.mosaicmaker.core.render;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads, resizes and writes images for the mosaic pipeline.
 */
public interface ImageCodec {

    BufferedImage decode(Path file) throws IOException;

    /**
     * Scales {@code source} to cover {@code width x height} keeping its aspect ratio, then crops
     * the centre. The result is always an ARGB image of exactly the requested size.
     */
    BufferedImage resizeToFill(BufferedImage source, int width, int height);

    void export(BufferedImage image, Path target) throws IOException;
}
