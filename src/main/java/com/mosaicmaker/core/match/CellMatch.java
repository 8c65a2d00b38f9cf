package com.mosaicmaker.core.match;

/**
 * Outcome for one grid cell. Only {@link Status#MATCHED} carries a tile id.
 */
public record CellMatch(Status status, int tileId) {
    private static final CellMatch NO_MATCH = new CellMatch(Status.NO_MATCH, -1);
    private static final CellMatch SKIPPED = new CellMatch(Status.SKIPPED, -1);

    public enum Status { MATCHED, NO_MATCH, SKIPPED }

    public CellMatch {
        if (status == Status.MATCHED && tileId < 0) {
            throw new IllegalArgumentException("Matched cell needs a tile id");
        }
        if (status != Status.MATCHED && tileId != -1) {
            throw new IllegalArgumentException(status + " cell cannot carry a tile id");
        }
    }

    public static CellMatch matched(int tileId) {
        return new CellMatch(Status.MATCHED, tileId);
    }

    public static CellMatch noMatch() {
        return NO_MATCH;
    }

    public static CellMatch skipped() {
        return SKIPPED;
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    @Override
    public String toString() {
        return isMatched() ? Integer.toString(tileId) : status.name();
    }
}
