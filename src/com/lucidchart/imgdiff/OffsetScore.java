package com.lucidchart.imgdiff;

/** A scored alignment candidate, emitted by a search worker. */
final class OffsetScore {

    final Offset offset;
    final double score;

    OffsetScore(Offset offset, double score) {
        this.offset = offset;
        this.score = score;
    }

    /** Higher score wins.  Equal scores go to the smaller |dx|+|dy|, then the smaller dx, then the smaller dy,
     * which makes the reduction independent of the order in which workers finish.
     */
    boolean isBetterThan(OffsetScore other) {
        if (other == null) return true;
        int byScore = Double.compare(score, other.score);
        if (byScore != 0) return byScore > 0;
        int byLength = Integer.compare(offset.manhattanLength(), other.offset.manhattanLength());
        if (byLength != 0) return byLength < 0;
        if (offset.dx != other.offset.dx) return offset.dx < other.offset.dx;
        return offset.dy < other.offset.dy;
    }

    @Override
    public String toString() {
        return "offset=" + offset + " score=" + String.format("%.4f", score);
    }
}
