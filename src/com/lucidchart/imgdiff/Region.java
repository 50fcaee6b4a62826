package com.lucidchart.imgdiff;

import java.awt.Rectangle;

/** An axis aligned area of the second image that still differs after alignment.
 * Bounds are half-open: minX and minY are inside the region, maxX and maxY are not.
 */
public final class Region {

    /** The invalidated region, used to drop a rectangle while merging */
    public static final Region EMPTY = new Region(0, 0, 0, 0);

    public final int minX;
    public final int minY;
    public final int maxX;
    public final int maxY;

    private Region(int minX, int minY, int maxX, int maxY) {
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    //*** FACTORY METHODS ***

    public static Region apply(int minX, int minY, int maxX, int maxY) {
        return new Region(minX, minY, maxX, maxY);
    }

    public static Region ofSize(int x, int y, int width, int height) {
        return new Region(x, y, x + width, y + height);
    }

    public static Region apply(Rectangle rectangle) {
        return ofSize(rectangle.x, rectangle.y, rectangle.width, rectangle.height);
    }

    /** True if the region covers at least one pixel */
    public boolean isValid() {
        return minX < maxX && minY < maxY;
    }

    public int getWidth() {
        return maxX - minX;
    }

    public int getHeight() {
        return maxY - minY;
    }

    public int area() {
        return getWidth() * getHeight();
    }

    public int getCenterX() {
        return (minX + maxX) / 2;
    }

    public int getCenterY() {
        return (minY + maxY) / 2;
    }

    /** Length of the diagonal */
    double diagonal() {
        return Math.sqrt((double) getWidth() * getWidth() + (double) getHeight() * getHeight());
    }

    /** The smallest region covering both */
    public Region union(Region other) {
        return new Region(
                Math.min(minX, other.minX),
                Math.min(minY, other.minY),
                Math.max(maxX, other.maxX),
                Math.max(maxY, other.maxY));
    }

    /** The shared area.  Not valid if the two regions do not truly intersect. */
    public Region intersection(Region other) {
        return new Region(
                Math.max(minX, other.minX),
                Math.max(minY, other.minY),
                Math.min(maxX, other.maxX),
                Math.min(maxY, other.maxY));
    }

    /** True if the other region lies within this one, allowing it to stick out by the margin on every side */
    public boolean contains(Region other, int margin) {
        return minX - margin <= other.minX &&
                minY - margin <= other.minY &&
                maxX + margin >= other.maxX &&
                maxY + margin >= other.maxY;
    }

    public boolean contains(int x, int y) {
        return x >= minX && x < maxX && y >= minY && y < maxY;
    }

    public Rectangle toRectangle() {
        return new Rectangle(minX, minY, getWidth(), getHeight());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Region)) return false;
        Region region = (Region) o;
        return minX == region.minX &&
                minY == region.minY &&
                maxX == region.maxX &&
                maxY == region.maxY;
    }

    @Override
    public int hashCode() {
        int result = minX;
        result = 31 * result + minY;
        result = 31 * result + maxX;
        result = 31 * result + maxY;
        return result;
    }

    @Override
    public String toString() {
        return "Region(" + minX + "," + minY + " - " + maxX + "," + maxY + ")";
    }
}
