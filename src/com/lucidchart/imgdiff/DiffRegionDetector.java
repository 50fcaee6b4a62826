package com.lucidchart.imgdiff;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Locates the areas of the second image that still differ from the first once the alignment offset is applied.
 *
 * The approach is to build a boolean diff mask the size of the second image, sampling every n-th pixel and marking
 * the whole sampled block, then to group marked cells into padded bounding boxes which the {@link RegionMerger} consolidates.
 * Areas of the second image that fall outside the first image after translation always count as different.
 */
public class DiffRegionDetector {

    /** Half size of the window absorbed around each unvisited diff cell */
    static final int GROUPING_RADIUS = 10;

    /** Added on every side of a grouped bounding box */
    static final int REGION_PADDING = 5;

    /** Regions are grown to at least this width and height */
    static final int MIN_REGION_SIZE = 20;

    private final DiffSettings settings;
    private final RegionMerger merger;

    public DiffRegionDetector(DiffSettings settings) {
        this(settings, new RegionMerger());
    }

    DiffRegionDetector(DiffSettings settings, RegionMerger merger) {
        this.settings = settings;
        this.merger = merger;
    }

    /** Returns the merged regions of the second image that differ from the first at the given offset */
    public List<Region> detectDiffRegions(RasterImage imgA, RasterImage imgB, Offset offset) {
        long startTime = System.currentTimeMillis();

        boolean[][] diffMask = buildDiffMask(imgA, imgB, offset);
        List<Region> grouped = groupDiffRegions(diffMask);
        List<Region> sized = enforceMinimumSize(grouped, imgB.getWidth(), imgB.getHeight());
        List<Region> merged = merger.merge(sized);

        if (merged.size() < sized.size())
            LOG.info("detectDiffRegions: merged {} diff regions into {} combined regions", sized.size(), merged.size());
        LOG.info("detectDiffRegions: found {} region(s) in {}ms", merged.size(), System.currentTimeMillis() - startTime);

        return merged;
    }

    /** Marks, block by block, where the second image differs from the first.
     * @return a mask indexed [y][x] with the dimensions of the second image, TRUE means different
     */
    boolean[][] buildDiffMask(RasterImage imgA, RasterImage imgB, Offset offset) {
        int width = imgB.getWidth();
        int height = imgB.getHeight();
        int samplingRate = settings.getSamplingRate();
        int threshold = settings.getThreshold();
        boolean[][] diffMask = new boolean[height][width];

        LOG.info("buildDiffMask: comparing {}x{} pixels at offset {}, sampling rate 1/{}", width, height, offset, samplingRate);

        int progressStep = settings.getProgressStep();
        int lastPercentReported = -1;

        for (int y = 0; y < height; y += samplingRate) {
            for (int x = 0; x < width; x += samplingRate) {
                int xA = x - offset.dx;
                int yA = y - offset.dy;

                // Unmapped area is always a difference
                boolean isDifferent = !imgA.contains(xA, yA) ||
                        ColorMetric.exceedsThreshold(imgA.getRGB(xA, yA), imgB.getRGB(x, y), threshold);

                if (isDifferent) markBlock(diffMask, x, y, samplingRate);
            }

            int percent = (y * 100) / height;
            if (percent > lastPercentReported && percent % progressStep == 0) {
                LOG.debug("buildDiffMask: diff detection progress {}%", percent);
                lastPercentReported = percent;
            }
        }
        return diffMask;
    }

    private static void markBlock(boolean[][] diffMask, int x, int y, int samplingRate) {
        for (int sy = 0; sy < samplingRate && y + sy < diffMask.length; sy++)
            for (int sx = 0; sx < samplingRate && x + sx < diffMask[0].length; sx++)
                diffMask[y + sy][x + sx] = true;
    }

    /** Groups diff cells into padded bounding boxes.
     * Each unvisited diff cell, in raster order, absorbs the diff cells within a fixed window around it.
     * This is not a flood fill: clusters further apart than the window become separate boxes, left for the merger to join.
     */
    static List<Region> groupDiffRegions(boolean[][] diffMask) {
        List<Region> regions = new ArrayList<>();
        int height = diffMask.length;
        if (height == 0) return regions;
        int width = diffMask[0].length;
        boolean[][] visited = new boolean[height][width];

        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++) {
                if (!diffMask[y][x] || visited[y][x]) continue;

                int minX = x;
                int minY = y;
                int maxX = x;
                int maxY = y;

                for (int ny = Math.max(0, y - GROUPING_RADIUS); ny <= Math.min(height - 1, y + GROUPING_RADIUS); ny++)
                    for (int nx = Math.max(0, x - GROUPING_RADIUS); nx <= Math.min(width - 1, x + GROUPING_RADIUS); nx++) {
                        if (diffMask[ny][nx]) {
                            visited[ny][nx] = true;
                            minX = Math.min(minX, nx);
                            minY = Math.min(minY, ny);
                            maxX = Math.max(maxX, nx);
                            maxY = Math.max(maxY, ny);
                        }
                    }

                minX = Math.max(0, minX - REGION_PADDING);
                minY = Math.max(0, minY - REGION_PADDING);
                maxX = Math.min(width - 1, maxX + REGION_PADDING);
                maxY = Math.min(height - 1, maxY + REGION_PADDING);

                regions.add(Region.apply(minX, minY, maxX + 1, maxY + 1));
            }
        return regions;
    }

    /** Re-centers and grows regions smaller than the minimum size on either axis, clipped to the image */
    static List<Region> enforceMinimumSize(List<Region> regions, int imageWidth, int imageHeight) {
        List<Region> sized = new ArrayList<>(regions.size());
        for (Region region : regions) {
            if (region.getWidth() >= MIN_REGION_SIZE && region.getHeight() >= MIN_REGION_SIZE) {
                sized.add(region);
                continue;
            }
            int centerX = region.getCenterX();
            int centerY = region.getCenterY();
            int newWidth = Math.max(region.getWidth(), MIN_REGION_SIZE);
            int newHeight = Math.max(region.getHeight(), MIN_REGION_SIZE);

            sized.add(Region.apply(
                    Math.max(0, centerX - newWidth / 2),
                    Math.max(0, centerY - newHeight / 2),
                    Math.min(imageWidth, centerX + newWidth / 2),
                    Math.min(imageHeight, centerY + newHeight / 2)));
        }
        return sized;
    }

    /** Quick check for any difference at the offset.
     * Walks the part of the first image that the translated second image covers and returns on the first pixel pair
     * whose max-channel difference exceeds the threshold.  Unlike the region detection, unmapped area is not a difference here.
     */
    public boolean hasDifferences(RasterImage imgA, RasterImage imgB, Offset offset) {
        int minX = Math.max(0, -offset.dx);
        int minY = Math.max(0, -offset.dy);
        int maxX = Math.min(imgA.getWidth(), imgB.getWidth() - offset.dx);
        int maxY = Math.min(imgA.getHeight(), imgB.getHeight() - offset.dy);
        int samplingRate = settings.getSamplingRate();
        int threshold = settings.getThreshold();

        for (int y = minY; y < maxY; y += samplingRate)
            for (int x = minX; x < maxX; x += samplingRate) {
                int xB = x + offset.dx;
                int yB = y + offset.dy;
                if (!imgB.contains(xB, yB)) continue;

                if (ColorMetric.exceedsThreshold(imgA.getRGB(x, y), imgB.getRGB(xB, yB), threshold)) {
                    LOG.debug("hasDifferences: first difference at ({}, {}) of the first image", x, y);
                    return true;
                }
            }
        return false;
    }

    private static final Logger LOG = LoggerFactory.getLogger(DiffRegionDetector.class);
}
