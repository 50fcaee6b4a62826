package com.lucidchart.imgdiff;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/** Consolidates overlapping, nearby and nested diff regions so each visible difference is outlined once.
 *
 * Merging runs in passes over the regions sorted from small to large.
 * A region nested in another is dropped; two regions that overlap enough, or sit close enough, become their union
 * unless the union would be mostly empty space.
 * What remains is capped to the largest regions, then near duplicates (regions sharing almost the same center) are collapsed.
 */
public class RegionMerger {

    static final int MAX_MERGE_PASSES = 20;
    static final int MAX_FINALIZE_PASSES = 3;
    static final int MAX_REGIONS = 50;

    /** Slack allowed when testing if one region lies inside another */
    static final int CONTAINMENT_MARGIN = 5;

    /** Regions further apart than this on either axis are never merged */
    static final int PROXIMITY_THRESHOLD = 10;

    /** A true intersection must cover at least 1/5 of the smaller region */
    static final int MIN_INTERSECTION_DIVISOR = 5;

    /** Regions whose areas differ by more than this factor only merge when they overlap a lot */
    static final double MAX_AREA_RATIO = 10.0;
    static final double MIN_OVERLAP_RATIO_FOR_UNEVEN_MERGE = 0.5;

    /** The union may not grow beyond this multiple of the two original areas */
    static final double MAX_AREA_INCREASE = 1.8;

    /** Centers closer than this share of the averaged width plus height mark two regions as duplicates */
    static final double SIMILAR_CENTER_FACTOR = 0.15;

    /** Returns the consolidated regions.  The input list is not modified. */
    public List<Region> merge(List<Region> regions) {
        if (regions.size() <= 1) return new ArrayList<>(regions);

        List<Region> result = new ArrayList<>(regions);
        boolean changed = true;

        for (int pass = 0; changed && pass < MAX_MERGE_PASSES; pass++) {
            changed = false;

            result = validOnly(result);
            result.sort(Comparator.comparingInt(Region::area));

            for (int i = 0; i < result.size(); i++)
                for (int j = i + 1; j < result.size(); j++) {
                    Region first = result.get(i);
                    Region second = result.get(j);
                    if (!first.isValid() || !second.isValid()) continue;

                    // Nested regions, either way round within the margin: keep the larger one only
                    if (first.contains(second, CONTAINMENT_MARGIN) || second.contains(first, CONTAINMENT_MARGIN)) {
                        if (second.area() > first.area()) result.set(i, second);
                        result.set(j, Region.EMPTY);
                        changed = true;
                        continue;
                    }

                    if (shouldMerge(first, second)) {
                        Region merged = first.union(second);
                        if (isReasonableMerge(first, second, merged)) {
                            result.set(i, merged);
                            result.set(j, Region.EMPTY);
                            changed = true;
                        }
                    }
                }

            if (changed) result = validOnly(result);
        }

        if (result.size() > MAX_REGIONS) {
            result.sort(Comparator.comparingInt(Region::area).reversed());
            result = new ArrayList<>(result.subList(0, MAX_REGIONS));
        }

        return finalizeRegions(result);
    }

    /** True if the regions touch or overlap, and are either of comparable size or overlap by more than half */
    static boolean shouldMerge(Region r1, Region r2) {
        if (!overlapOrTouch(r1, r2)) return false;

        double area1 = r1.area();
        double area2 = r2.area();
        if (area1 > area2 * MAX_AREA_RATIO || area2 > area1 * MAX_AREA_RATIO)
            return overlapRatio(r1, r2) > MIN_OVERLAP_RATIO_FOR_UNEVEN_MERGE;

        return true;
    }

    /** True if the regions are within the proximity threshold on both axes and either
     * truly intersect by a meaningful share of the smaller one, or, not intersecting, have centers closer than half their average diagonal.
     */
    static boolean overlapOrTouch(Region r1, Region r2) {
        boolean nearX = !(r1.maxX + PROXIMITY_THRESHOLD <= r2.minX || r2.maxX + PROXIMITY_THRESHOLD <= r1.minX);
        boolean nearY = !(r1.maxY + PROXIMITY_THRESHOLD <= r2.minY || r2.maxY + PROXIMITY_THRESHOLD <= r1.minY);
        if (!nearX || !nearY) return false;

        Region intersection = r1.intersection(r2);
        if (!intersection.isValid()) {
            double avgDiagonal = (r1.diagonal() + r2.diagonal()) / 2;
            return centerDistance(r1, r2) < avgDiagonal / 2;
        }

        int smallerArea = Math.min(r1.area(), r2.area());
        return intersection.area() >= smallerArea / MIN_INTERSECTION_DIVISOR;
    }

    /** Intersection area as a share, 0.0 to 1.0, of the smaller region */
    static double overlapRatio(Region r1, Region r2) {
        Region intersection = r1.intersection(r2);
        if (!intersection.isValid()) return 0.0;
        int smallerArea = Math.min(r1.area(), r2.area());
        if (smallerArea <= 0) return 0.0;
        return (double) intersection.area() / smallerArea;
    }

    /** Rejects unions that would be mostly area neither region covered */
    static boolean isReasonableMerge(Region r1, Region r2, Region merged) {
        long beforeArea = (long) r1.area() + r2.area();
        return merged.area() <= beforeArea * MAX_AREA_INCREASE;
    }

    /** Collapses near duplicates, keeping the larger of each pair */
    static List<Region> finalizeRegions(List<Region> regions) {
        List<Region> result = new ArrayList<>(regions);
        boolean changed = true;

        for (int pass = 0; changed && pass < MAX_FINALIZE_PASSES; pass++) {
            changed = false;

            for (int i = 0; i < result.size(); i++) {
                if (!result.get(i).isValid()) continue;
                for (int j = 0; j < result.size(); j++) {
                    if (i == j || !result.get(j).isValid()) continue;

                    if (areSimilar(result.get(i), result.get(j))) {
                        if (result.get(i).area() < result.get(j).area()) result.set(i, result.get(j));
                        result.set(j, Region.EMPTY);
                        changed = true;
                    }
                }
            }

            if (changed) result = validOnly(result);
        }
        return result;
    }

    static boolean areSimilar(Region r1, Region r2) {
        int avgWidth = (r1.getWidth() + r2.getWidth()) / 2;
        int avgHeight = (r1.getHeight() + r2.getHeight()) / 2;
        return centerDistance(r1, r2) < (avgWidth + avgHeight) * SIMILAR_CENTER_FACTOR;
    }

    private static double centerDistance(Region r1, Region r2) {
        int dx = r1.getCenterX() - r2.getCenterX();
        int dy = r1.getCenterY() - r2.getCenterY();
        return Math.sqrt((double) dx * dx + (double) dy * dy);
    }

    private static List<Region> validOnly(List<Region> regions) {
        return regions.stream().filter(Region::isValid).collect(Collectors.toCollection(ArrayList::new));
    }
}
