package com.mosaicmaker.core.model;

import com.mosaicmaker.core.color.Rgb;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One library image reduced to its identity, its average color and a square thumbnail.
 * The thumbnail pixels are copied on creation and never change afterwards.
 */
public final class Tile {
    private final int id;
    private final Path sourceLocator;
    private final Rgb averageColor;
    private final int thumbnailSize;
    private final int[] thumbnailPixels;

    public Tile(int id, Path sourceLocator, Rgb averageColor, BufferedImage thumbnail) {
        if (id < 0) {
            throw new IllegalArgumentException("Tile id must be non-negative: " + id);
        }
        Objects.requireNonNull(thumbnail, "thumbnail");
        if (thumbnail.getWidth() != thumbnail.getHeight() || thumbnail.getWidth() < 1) {
            throw new IllegalArgumentException("Thumbnail must be square, got "
                + thumbnail.getWidth() + "x" + thumbnail.getHeight());
        }
        this.id = id;
        this.sourceLocator = Objects.requireNonNull(sourceLocator, "sourceLocator");
        this.averageColor = Objects.requireNonNull(averageColor, "averageColor");
        this.thumbnailSize = thumbnail.getWidth();
        this.thumbnailPixels = thumbnail.getRGB(0, 0, thumbnailSize, thumbnailSize, null, 0, thumbnailSize);
    }

    public int id() {
        return id;
    }

    public Path sourceLocator() {
        return sourceLocator;
    }

    public Rgb averageColor() {
        return averageColor;
    }

    public int thumbnailSize() {
        return thumbnailSize;
    }

    /**
     * @return a fresh ARGB image holding the thumbnail pixels
     */
    public BufferedImage thumbnail() {
        BufferedImage copy = new BufferedImage(thumbnailSize, thumbnailSize, BufferedImage.TYPE_INT_ARGB);
        copy.setRGB(0, 0, thumbnailSize, thumbnailSize, thumbnailPixels, 0, thumbnailSize);
        return copy;
    }

    /**
     * Copies the thumbnail pixels verbatim into {@code target} with the top-left corner at (x, y).
     */
    public void writeThumbnail(BufferedImage target, int x, int y) {
        target.setRGB(x, y, thumbnailSize, thumbnailSize, thumbnailPixels, 0, thumbnailSize);
    }

    @Override
    public String toString() {
        return "Tile#" + id + " " + averageColor + " " + sourceLocator;
    }
}
