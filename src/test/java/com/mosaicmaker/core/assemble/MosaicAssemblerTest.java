package com.mosaicmaker.core.assemble;

import com.mosaicmaker.core.color.Rgb;
import com.mosaicmaker.core.match.CellMatch;
import com.mosaicmaker.core.model.Catalog;
import com.mosaicmaker.core.model.Tile;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MosaicAssemblerTest {

    private static final int TRANSPARENT = 0x00000000;

    private final MosaicAssembler assembler = new MosaicAssembler();

    @Test
    void uniqueMatchingDrainsAndRefillsPoolInRowMajorOrder() {
        Catalog catalog = catalog(2, new Rgb(0, 0, 0), new Rgb(255, 255, 255));
        BufferedImage grid = grid(4, 1,
            0xFF0A0A0A,
            0xFFF0F0F0,
            TRANSPARENT,
            0xFF050505);

        MosaicCanvas canvas = assembler.assemble(grid, catalog, new MatchSettings(50, true, 2));

        assertEquals(List.of(
            CellMatch.matched(0),
            CellMatch.matched(1),
            CellMatch.skipped(),
            CellMatch.matched(0)
        ), canvas.grid().cells());
        assertEquals(8, canvas.width());
        assertEquals(2, canvas.height());
        assertEquals(0xFF000000, canvas.pixel(0, 0));
        assertEquals(0xFFFFFFFF, canvas.pixel(3, 1));
        assertEquals(TRANSPARENT, canvas.pixel(4, 0));
        assertEquals(0xFF000000, canvas.pixel(7, 1));
    }

    @Test
    void visitsRowsBeforeColumns() {
        Catalog catalog = catalog(1, new Rgb(0, 0, 0), new Rgb(1, 1, 1));
        // 2x2 grid, all black: unique mode hands out tile 0, 1, 0, 1 in visiting order.
        BufferedImage grid = grid(2, 2, 0xFF000000, 0xFF000000, 0xFF000000, 0xFF000000);

        MatchGrid result = assembler.match(grid, catalog, new MatchSettings(10, true, 1), () -> false);

        assertEquals(CellMatch.matched(0), result.cell(0, 0));
        assertEquals(CellMatch.matched(1), result.cell(1, 0));
        assertEquals(CellMatch.matched(0), result.cell(0, 1));
        assertEquals(CellMatch.matched(1), result.cell(1, 1));
    }

    @Test
    void zeroThresholdLeavesEveryCellUnmatched() {
        Catalog catalog = catalog(2, new Rgb(0, 0, 0), new Rgb(255, 255, 255));
        BufferedImage grid = grid(3, 1, 0xFF000000, 0xFFFFFFFF, 0xFF808080);

        MosaicCanvas canvas = assembler.assemble(grid, catalog, new MatchSettings(0, true, 2));

        assertEquals(0, canvas.grid().matchedCount());
        assertEquals(3, canvas.grid().countOf(CellMatch.Status.NO_MATCH));
        assertFullyTransparent(canvas.image());
    }

    @Test
    void singleTileCoversEveryOpaqueCellWithoutUniqueness() {
        Catalog catalog = catalog(3, new Rgb(40, 80, 120));
        Random random = new Random(3);
        int[] pixels = new int[5 * 4];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = 0xFF000000 | random.nextInt(0x1000000);
        }
        pixels[7] = 0x10FFFFFF;
        BufferedImage grid = grid(5, 4, pixels);

        MatchGrid result = assembler.match(grid, catalog, new MatchSettings(1000, false, 3), () -> false);

        for (int i = 0; i < pixels.length; i++) {
            CellMatch expected = i == 7 ? CellMatch.skipped() : CellMatch.matched(0);
            assertEquals(expected, result.cells().get(i), "cell " + i);
        }
    }

    @Test
    void alphaAtCutoffIsSkippedAndAboveIsMatched() {
        Catalog catalog = catalog(1, new Rgb(0, 0, 0));
        BufferedImage grid = grid(2, 1, 0x7D000000, 0x7E000000);

        MatchGrid result = assembler.match(grid, catalog, new MatchSettings(10, false, 1), () -> false);

        assertEquals(CellMatch.skipped(), result.cell(0, 0));
        assertEquals(CellMatch.matched(0), result.cell(1, 0));
    }

    @Test
    void identicalInputsGiveIdenticalResults() {
        Catalog catalog = catalog(2, new Rgb(0, 0, 0), new Rgb(128, 128, 128), new Rgb(255, 255, 255),
            new Rgb(200, 30, 30), new Rgb(30, 200, 30));
        Random random = new Random(42);
        int[] pixels = new int[8 * 6];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (random.nextInt(256) << 24) | random.nextInt(0x1000000);
        }
        BufferedImage grid = grid(8, 6, pixels);
        MatchSettings settings = new MatchSettings(120, true, 2);

        MosaicCanvas first = assembler.assemble(grid, catalog, settings);
        MosaicCanvas second = assembler.assemble(grid, catalog, settings);

        assertEquals(first.grid(), second.grid());
    }

    @Test
    void canvasSizeDependsOnlyOnGridAndSubpixelSize() {
        BufferedImage grid = grid(3, 2, 0xFF000000, 0xFF000000, 0xFF000000, 0, 0, 0);

        MosaicCanvas none = assembler.assemble(grid, Catalog.empty(), new MatchSettings(100, true, 5));
        MosaicCanvas some = assembler.assemble(grid, catalog(5, new Rgb(0, 0, 0)), new MatchSettings(100, true, 5));

        assertEquals(15, none.width());
        assertEquals(10, none.height());
        assertEquals(15, some.width());
        assertEquals(10, some.height());
        assertEquals(3, some.grid().matchedCount());
    }

    @Test
    void thumbnailsAreCopiedExactlyIntoTheirBlocks() {
        BufferedImage thumb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        thumb.setRGB(0, 0, 0xFF010203);
        thumb.setRGB(1, 0, 0xFF040506);
        thumb.setRGB(0, 1, 0xFF070809);
        thumb.setRGB(1, 1, 0x800A0B0C);
        Tile tile = new Tile(0, Path.of("pattern.png"), new Rgb(5, 5, 5), thumb);
        Catalog catalog = new Catalog(1L, 2, List.of(tile));
        BufferedImage grid = grid(2, 2, 0, 0, 0, 0xFF050505);

        MosaicCanvas canvas = assembler.assemble(grid, catalog, new MatchSettings(10, false, 2));

        assertEquals(0xFF010203, canvas.pixel(2, 2));
        assertEquals(0xFF040506, canvas.pixel(3, 2));
        assertEquals(0xFF070809, canvas.pixel(2, 3));
        assertEquals(0x800A0B0C, canvas.pixel(3, 3));
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                if (x < 2 || y < 2) {
                    assertEquals(TRANSPARENT, canvas.pixel(x, y), "pixel " + x + "," + y);
                }
            }
        }
    }

    @Test
    void rejectsCatalogBuiltForAnotherTileSize() {
        Catalog catalog = catalog(4, new Rgb(0, 0, 0));
        BufferedImage grid = grid(1, 1, 0xFF000000);

        assertThrows(IllegalStateException.class,
            () -> assembler.assemble(grid, catalog, new MatchSettings(10, false, 2)));
    }

    @Test
    void stopsWhenCancelled() {
        Catalog catalog = catalog(1, new Rgb(0, 0, 0));
        BufferedImage grid = grid(3, 3, new int[9]);
        AtomicInteger checks = new AtomicInteger();

        assertThrows(CancellationException.class, () -> assembler.assemble(grid, catalog,
            new MatchSettings(10, false, 1), () -> checks.incrementAndGet() > 4));
        assertEquals(5, checks.get());
    }

    @Test
    void canvasHandsOutCopies() {
        Catalog catalog = catalog(1, new Rgb(0, 0, 0));
        MosaicCanvas canvas = assembler.assemble(grid(1, 1, 0xFF000000), catalog, new MatchSettings(10, false, 1));

        canvas.image().setRGB(0, 0, 0xFFFFFFFF);

        assertEquals(0xFF000000, canvas.pixel(0, 0));
    }

    private static void assertFullyTransparent(BufferedImage image) {
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                assertEquals(TRANSPARENT, image.getRGB(x, y), "pixel " + x + "," + y);
            }
        }
        assertTrue(image.getColorModel().hasAlpha());
    }

    private static BufferedImage grid(int width, int height, int... argb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    private static Catalog catalog(int subpixelSize, Rgb... colors) {
        List<Tile> tiles = new ArrayList<>();
        for (int i = 0; i < colors.length; i++) {
            BufferedImage thumb = new BufferedImage(subpixelSize, subpixelSize, BufferedImage.TYPE_INT_ARGB);
            for (int y = 0; y < subpixelSize; y++) {
                for (int x = 0; x < subpixelSize; x++) {
                    thumb.setRGB(x, y, colors[i].toArgb());
                }
            }
            tiles.add(new Tile(i, Path.of("tile-" + i + ".png"), colors[i], thumb));
        }
        return new Catalog(1L, subpixelSize, tiles);
    }
}
