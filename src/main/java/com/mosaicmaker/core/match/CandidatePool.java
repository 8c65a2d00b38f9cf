package com.mosaicmaker.core.match;

import com.mosaicmaker.core.model.Catalog;
import com.mosaicmaker.core.model.Tile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mutable working subset of a {@link Catalog} for one matching session.
 * <p>
 * Membership is tracked with a removal stamp per catalog position instead of a copied list:
 * a tile is out of the pool when its stamp equals the current epoch, so {@link #reset()} is a
 * counter bump. Unused tiles are always visited in catalog order, which is the same order a
 * cloned-then-shrunk list would hold.
 * <p>
 * A new pool is empty; the first {@link #ensureFilled()} refills it with the whole catalog.
 */
public final class CandidatePool {
    private final Catalog catalog;
    private final int[] removedInEpoch;
    private int epoch = 1;
    private int remaining;

    public CandidatePool(Catalog catalog) {
        this.catalog = catalog;
        this.removedInEpoch = new int[catalog.size()];
        this.remaining = 0;
    }

    public Catalog catalog() {
        return catalog;
    }

    public boolean isEmpty() {
        return remaining == 0;
    }

    public int size() {
        return remaining;
    }

    /**
     * Refills the pool with every catalog tile.
     */
    public void reset() {
        if (epoch == Integer.MAX_VALUE) {
            Arrays.fill(removedInEpoch, 0);
            epoch = 0;
        }
        epoch++;
        remaining = removedInEpoch.length;
    }

    /**
     * Refills the pool only when it has been drained.
     */
    public void ensureFilled() {
        if (isEmpty()) {
            reset();
        }
    }

    public boolean contains(int tileId) {
        return remaining > 0
            && tileId >= 0
            && tileId < removedInEpoch.length
            && removedInEpoch[tileId] != epoch;
    }

    /**
     * Takes one tile out of the pool until the next reset.
     */
    public void remove(int tileId) {
        if (!contains(tileId)) {
            throw new IllegalStateException("Tile " + tileId + " is not in the pool");
        }
        removedInEpoch[tileId] = epoch;
        remaining--;
    }

    /**
     * @return the tiles currently in the pool, in catalog order
     */
    public List<Tile> candidates() {
        List<Tile> out = new ArrayList<>(remaining);
        if (remaining == 0) {
            return out;
        }
        for (Tile tile : catalog.tiles()) {
            if (removedInEpoch[tile.id()] != epoch) {
                out.add(tile);
            }
        }
        return out;
    }
}
