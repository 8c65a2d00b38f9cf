package com.mosaicmaker.core.match;

import com.mosaicmaker.core.color.ColorMetric;
import com.mosaicmaker.core.color.Rgb;
import com.mosaicmaker.core.model.Tile;

import java.util.OptionalInt;

/**
 * Picks the catalog tile whose average color is closest to a target color.
 * <p>
 * A candidate is accepted only when its distance is strictly below the best seen so far, and the
 * best starts at the threshold, so the first tile in pool order wins ties and a threshold of zero
 * never matches. In unique mode an accepted tile leaves the pool. When a scan accepts nothing the
 * pool is refilled and the scan repeated, up to {@link #MAX_ATTEMPTS} scans in total.
 */
public final class TileMatcher {

    /** Initial scan plus one retry over a refilled pool. */
    public static final int MAX_ATTEMPTS = 2;

    private final CandidatePool pool;
    private final double threshold;
    private final boolean unique;

    public TileMatcher(CandidatePool pool, double threshold, boolean unique) {
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("Threshold must be a non-negative number: " + threshold);
        }
        this.pool = pool;
        this.threshold = threshold;
        this.unique = unique;
    }

    public CandidatePool pool() {
        return pool;
    }

    /**
     * @return the matched tile id, or empty when no tile is closer than the threshold
     */
    public OptionalInt match(Rgb target) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            pool.ensureFilled();
            int best = scan(target);
            if (best >= 0) {
                if (unique) {
                    pool.remove(best);
                }
                return OptionalInt.of(best);
            }
            pool.reset();
        }
        return OptionalInt.empty();
    }

    private int scan(Rgb target) {
        if (pool.isEmpty()) {
            return -1;
        }
        double bestDistance = threshold;
        int bestId = -1;
        for (Tile candidate : pool.catalog().tiles()) {
            if (!pool.contains(candidate.id())) {
                continue;
            }
            double distance = ColorMetric.distance(candidate.averageColor(), target);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestId = candidate.id();
            }
        }
        return bestId;
    }
}
