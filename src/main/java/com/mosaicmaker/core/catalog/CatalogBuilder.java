package com.mosaicmaker.core.catalog;

import com.mosaicmaker.core.color.Rgb;
import com.mosaicmaker.core.fs.LibraryScanner;
import com.mosaicmaker.core.model.Catalog;
import com.mosaicmaker.core.model.Tile;
import com.mosaicmaker.core.render.ColorAverager;
import com.mosaicmaker.core.render.ImageCodec;
import com.mosaicmaker.logging.AppLogger;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a {@link Catalog} from the images in a library folder.
 * <p>
 * Files that cannot be averaged or decoded are logged and left out; they never fail the rebuild.
 * Only a missing or unreadable folder does.
 */
public final class CatalogBuilder {
    private static final Logger LOGGER = AppLogger.get();

    private final LibraryScanner scanner;
    private final ColorAverager averager;
    private final ImageCodec codec;
    private final AtomicLong generations = new AtomicLong();

    public CatalogBuilder(LibraryScanner scanner, ColorAverager averager, ImageCodec codec) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.averager = Objects.requireNonNull(averager, "averager");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Catalog build(Path libraryDir, int subpixelSize) throws IOException {
        return build(libraryDir, subpixelSize, () -> false);
    }

    public Catalog build(Path libraryDir, int subpixelSize, BooleanSupplier cancelled) throws IOException {
        if (subpixelSize < 1) {
            throw new IllegalArgumentException("Subpixel size must be at least 1: " + subpixelSize);
        }
        List<Path> files = scanner.scan(libraryDir);
        LOGGER.info("Reloading library " + libraryDir + " (" + files.size() + " candidate files)");

        List<Tile> tiles = new ArrayList<>();
        int skipped = 0;
        for (Path file : files) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Library rebuild cancelled before " + file);
            }
            LOGGER.fine("Processing " + file);
            Optional<Tile> tile = createTile(file, tiles.size(), subpixelSize);
            if (tile.isPresent()) {
                tiles.add(tile.get());
            } else {
                skipped++;
            }
        }

        Catalog catalog = new Catalog(generations.incrementAndGet(), subpixelSize, tiles);
        LOGGER.info("Library reloaded: %d tiles, %d files skipped (generation %d)"
            .formatted(catalog.size(), skipped, catalog.generation()));
        return catalog;
    }

    private Optional<Tile> createTile(Path file, int id, int subpixelSize) {
        Optional<Rgb> average;
        try {
            average = averager.average(file);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Skipping " + file + ": average color failed (" + e.getMessage() + ")");
            return Optional.empty();
        }
        if (average.isEmpty()) {
            LOGGER.warning("Skipping " + file + ": no average color");
            return Optional.empty();
        }

        BufferedImage thumbnail;
        try {
            thumbnail = codec.resizeToFill(codec.decode(file), subpixelSize, subpixelSize);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Skipping " + file + ": thumbnail failed (" + e.getMessage() + ")");
            return Optional.empty();
        }
        return Optional.of(new Tile(id, file, average.get(), thumbnail));
    }
}
