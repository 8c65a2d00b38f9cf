package com.mosaicmaker.core.assemble;

/**
 * Parameters of one matching pass.
 *
 * @param threshold     exclusive upper bound on the accepted color distance
 * @param unique        drain accepted tiles from the candidate pool
 * @param subpixelSize  side of every canvas block in pixels
 */
public record MatchSettings(double threshold, boolean unique, int subpixelSize) {
    public MatchSettings {
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("Threshold must be a non-negative number: " + threshold);
        }
        if (subpixelSize < 1) {
            throw new IllegalArgumentException("Subpixel size must be at least 1: " + subpixelSize);
        }
    }
}
