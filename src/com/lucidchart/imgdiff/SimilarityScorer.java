package com.lucidchart.imgdiff;

/** Scores how well two images agree once the second is translated by a candidate offset.
 *
 * The score is the share of sampled pixels in the overlap whose {@link ColorMetric#distance(int, int) distance} is under the threshold,
 * lowered further when the overlap covers less than half of the larger image, so that tiny overlaps can not win the alignment search.
 * The sampling rate is passed on each call, which lets the progressive search run coarse and fine stages against the same scorer.
 * Instances hold no mutable state and may be shared by any number of threads.
 */
public class SimilarityScorer {

    /** Overlaps covering less than this share of the larger image are penalized */
    static final double MIN_UNPENALIZED_COVERAGE = 0.5;

    private final int threshold;

    public SimilarityScorer(int threshold) {
        this.threshold = threshold;
    }

    public SimilarityScorer(DiffSettings settings) {
        this(settings.getThreshold());
    }

    /**
     * @param imgA the first image
     * @param imgB the second image, whose pixel (x, y) is compared to pixel (x - dx, y - dy) of the first
     * @param offset the candidate translation
     * @param samplingRate the stride over the overlap on both axes, at least 1
     * @return a score from 0.0 (no usable overlap or no matching pixel) to 1.0 (every sampled pixel matches over a large overlap)
     */
    public double score(RasterImage imgA, RasterImage imgB, Offset offset, int samplingRate) {
        int stride = Math.max(1, samplingRate);

        // Overlap, in the coordinates of the first image
        int left = Math.max(0, -offset.dx);
        int top = Math.max(0, -offset.dy);
        int overlapWidth = Math.min(imgA.getWidth(), imgB.getWidth() - offset.dx) - left;
        int overlapHeight = Math.min(imgA.getHeight(), imgB.getHeight() - offset.dy) - top;

        if (overlapWidth <= 0 || overlapHeight <= 0) return 0.0;

        int sampledPoints = 0;
        int matchingPoints = 0;

        for (int y = 0; y < overlapHeight; y += stride)
            for (int x = 0; x < overlapWidth; x += stride) {
                int xA = left + x;
                int yA = top + y;
                int xB = xA + offset.dx;
                int yB = yA + offset.dy;

                if (!imgA.contains(xA, yA) || !imgB.contains(xB, yB)) continue;

                sampledPoints++;
                if (ColorMetric.distance(imgA.getRGB(xA, yA), imgB.getRGB(xB, yB)) < threshold) matchingPoints++;
            }

        if (sampledPoints == 0) return 0.0;

        double score = (double) matchingPoints / sampledPoints;

        long overlapArea = (long) overlapWidth * overlapHeight;
        long largerArea = Math.max(imgA.getArea(), imgB.getArea());
        double coverageRatio = (double) overlapArea / largerArea;
        if (coverageRatio < MIN_UNPENALIZED_COVERAGE) score *= coverageRatio * 2.0;

        return score;
    }
}
