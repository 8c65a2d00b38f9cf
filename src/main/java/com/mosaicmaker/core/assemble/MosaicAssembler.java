package com.mosaicmaker.core.assemble;

import com.mosaicmaker.core.color.Rgb;
import com.mosaicmaker.core.match.CandidatePool;
import com.mosaicmaker.core.match.CellMatch;
import com.mosaicmaker.core.match.TileMatcher;
import com.mosaicmaker.core.model.Catalog;
import com.mosaicmaker.logging.AppLogger;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an intermediate (grid-sized) image into a mosaic canvas.
 * <p>
 * Cells are matched row by row, left to right. The order is significant in unique mode because
 * every accepted tile leaves the shared pool, so it decides which cells end up sharing tiles.
 * Each pass starts from a fresh, empty pool.
 */
public final class MosaicAssembler {
    private static final Logger LOGGER = AppLogger.get();

    /** Cells with alpha at or below this value are left transparent without matching. */
    public static final int ALPHA_CUTOFF = 125;

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    public MosaicCanvas assemble(BufferedImage intermediate, Catalog catalog, MatchSettings settings) {
        return assemble(intermediate, catalog, settings, NEVER_CANCELLED);
    }

    public MosaicCanvas assemble(BufferedImage intermediate,
                                 Catalog catalog,
                                 MatchSettings settings,
                                 BooleanSupplier cancelled) {
        MatchGrid grid = match(intermediate, catalog, settings, cancelled);
        BufferedImage image = compose(grid, catalog, settings.subpixelSize());
        LOGGER.info("Mosaic assembled: %dx%d cells, %d matched, %d unmatched, %d skipped".formatted(
            grid.width(), grid.height(),
            grid.matchedCount(),
            grid.countOf(CellMatch.Status.NO_MATCH),
            grid.countOf(CellMatch.Status.SKIPPED)));
        return new MosaicCanvas(image, grid, settings.subpixelSize());
    }

    /**
     * Runs the matcher over every cell of {@code intermediate} in row-major order.
     */
    public MatchGrid match(BufferedImage intermediate,
                           Catalog catalog,
                           MatchSettings settings,
                           BooleanSupplier cancelled) {
        if (intermediate == null) {
            throw new IllegalArgumentException("Intermediate image is required");
        }
        int width = intermediate.getWidth();
        int height = intermediate.getHeight();
        TileMatcher matcher = new TileMatcher(new CandidatePool(catalog), settings.threshold(), settings.unique());

        List<CellMatch> cells = new ArrayList<>(width * height);
        for (int y = 0; y < height; y++) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Matching progress: %.1f%%".formatted(100.0 * y / height));
            }
            for (int x = 0; x < width; x++) {
                if (cancelled.getAsBoolean()) {
                    throw new CancellationException("Matching cancelled at cell (" + x + "," + y + ")");
                }
                int argb = intermediate.getRGB(x, y);
                int alpha = (argb >>> 24) & 0xFF;
                if (alpha <= ALPHA_CUTOFF) {
                    cells.add(CellMatch.skipped());
                    continue;
                }
                OptionalInt tileId = matcher.match(Rgb.fromArgb(argb));
                cells.add(tileId.isPresent() ? CellMatch.matched(tileId.getAsInt()) : CellMatch.noMatch());
            }
        }
        return new MatchGrid(width, height, cells);
    }

    /**
     * Writes the matched thumbnails into a new ARGB canvas. Skipped and unmatched cells become
     * fully transparent blocks. Blocks never overlap or blend.
     */
    public BufferedImage compose(MatchGrid grid, Catalog catalog, int subpixelSize) {
        if (subpixelSize < 1) {
            throw new IllegalArgumentException("Subpixel size must be at least 1: " + subpixelSize);
        }
        if (grid.matchedCount() > 0 && catalog.thumbnailSize() != subpixelSize) {
            throw new IllegalStateException("Catalog thumbnails are " + catalog.thumbnailSize()
                + "px but the canvas needs " + subpixelSize + "px blocks; rebuild the library");
        }

        BufferedImage canvas = new BufferedImage(
            grid.width() * subpixelSize,
            grid.height() * subpixelSize,
            BufferedImage.TYPE_INT_ARGB
        );
        int[] transparentBlock = new int[subpixelSize * subpixelSize];

        for (int row = 0; row < grid.height(); row++) {
            for (int column = 0; column < grid.width(); column++) {
                int xOffset = column * subpixelSize;
                int yOffset = row * subpixelSize;
                CellMatch cell = grid.cell(column, row);
                if (cell.isMatched()) {
                    catalog.tile(cell.tileId()).writeThumbnail(canvas, xOffset, yOffset);
                } else {
                    canvas.setRGB(xOffset, yOffset, subpixelSize, subpixelSize, transparentBlock, 0, subpixelSize);
                }
            }
        }
        return canvas;
    }
}
