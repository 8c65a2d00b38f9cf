package com.mosaicmaker.core.model;

import java.util.List;

/**
 * Ordered, identity-unique set of tiles produced by one library rebuild.
 * Tile ids equal their position in the catalog.
 */
public final class Catalog {
    private static final Catalog EMPTY = new Catalog(0L, 0, List.of());

    private final long generation;
    private final int thumbnailSize;
    private final List<Tile> tiles;

    public Catalog(long generation, int thumbnailSize, List<Tile> tiles) {
        this.tiles = List.copyOf(tiles);
        for (int i = 0; i < this.tiles.size(); i++) {
            Tile tile = this.tiles.get(i);
            if (tile.id() != i) {
                throw new IllegalArgumentException("Tile at position " + i + " carries id " + tile.id());
            }
            if (tile.thumbnailSize() != thumbnailSize) {
                throw new IllegalArgumentException("Tile " + i + " thumbnail is " + tile.thumbnailSize()
                    + "px, catalog expects " + thumbnailSize + "px");
            }
        }
        this.generation = generation;
        this.thumbnailSize = thumbnailSize;
    }

    public static Catalog empty() {
        return EMPTY;
    }

    public long generation() {
        return generation;
    }

    public int thumbnailSize() {
        return thumbnailSize;
    }

    public List<Tile> tiles() {
        return tiles;
    }

    public Tile tile(int id) {
        if (id < 0 || id >= tiles.size()) {
            throw new IndexOutOfBoundsException("No tile with id " + id + " in catalog of " + tiles.size());
        }
        return tiles.get(id);
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }
}
