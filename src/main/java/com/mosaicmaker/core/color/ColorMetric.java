package com.mosaicmaker.core.color;

/**
 * Straight Euclidean distance in RGB space. No perceptual weighting is applied.
 */
public final class ColorMetric {

    private ColorMetric() {}

    /**
     * @return {@code sqrt(dr² + dg² + db²)}, always {@code >= 0}
     */
    public static double distance(Rgb a, Rgb b) {
        double dr = a.red() - b.red();
        double dg = a.green() - b.green();
        double db = a.blue() - b.blue();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }
}
