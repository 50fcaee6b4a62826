package com.lucidchart.imgdiff;

/** An integer translation between the two compared images.
 *
 * Pixel (x, y) of the second image corresponds to pixel (x - dx, y - dy) of the first image,
 * i.e. the content of the first image shows up in the second image moved by (dx, dy).
 * The scorer, the detector and the renderer all use this same convention.
 */
public final class Offset {

    public static final Offset ZERO = new Offset(0, 0);

    public final int dx;
    public final int dy;

    private Offset(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public static Offset apply(int dx, int dy) {
        return (dx == 0 && dy == 0) ? ZERO : new Offset(dx, dy);
    }

    /** Distance from no translation at all, used to break score ties */
    public int manhattanLength() {
        return Math.abs(dx) + Math.abs(dy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Offset)) return false;
        Offset offset = (Offset) o;
        return dx == offset.dx && dy == offset.dy;
    }

    @Override
    public int hashCode() {
        return 31 * dx + dy;
    }

    @Override
    public String toString() {
        return "(" + dx + ", " + dy + ")";
    }
}
