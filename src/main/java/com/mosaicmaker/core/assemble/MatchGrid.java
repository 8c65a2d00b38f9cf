package com.mosaicmaker.core.assemble;

import com.mosaicmaker.core.match.CellMatch;

import java.util.List;

/**
 * Per-cell outcomes of a matching pass, stored row-major.
 */
public record MatchGrid(int width, int height, List<CellMatch> cells) {
    public MatchGrid {
        cells = List.copyOf(cells);
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid must be at least 1x1, got " + width + "x" + height);
        }
        if (cells.size() != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " cells, got " + cells.size());
        }
    }

    public CellMatch cell(int column, int row) {
        if (column < 0 || column >= width || row < 0 || row >= height) {
            throw new IndexOutOfBoundsException("Cell (" + column + "," + row + ") outside " + width + "x" + height);
        }
        return cells.get(row * width + column);
    }

    public long matchedCount() {
        return cells.stream().filter(CellMatch::isMatched).count();
    }

    public long countOf(CellMatch.Status status) {
        return cells.stream().filter(c -> c.status() == status).count();
    }
}
