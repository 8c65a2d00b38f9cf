package com.mosaicmaker.core.render;

import com.mosaicmaker.core.color.Rgb;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Computes the average color of an image file. An empty result means the file has no usable
 * pixels and should not become a tile.
 */
@FunctionalInterface
public interface ColorAverager {
    Optional<Rgb> average(Path file) throws IOException;
}
