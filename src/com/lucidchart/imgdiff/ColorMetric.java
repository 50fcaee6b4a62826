package com.lucidchart.imgdiff;

/** Pixel distance functions shared by the scorer, the detector and the renderer.
 *
 * Two metrics exist and they are not interchangeable:
 * the max-channel difference answers "is this pixel different" against the 0-255 threshold,
 * while the alpha-weighted distance is a continuous value (roughly 0 to 460) used when scoring alignments.
 * Pixels are packed ARGB ints, as returned by {@link java.awt.image.BufferedImage#getRGB(int, int)}.
 */
public final class ColorMetric {

    /** Weight given to the alpha difference in {@link #distance(int, int)} */
    static final double ALPHA_DIFFERENCE_WEIGHT = 0.3;

    private ColorMetric() {}

    /** Returns the largest absolute difference of the red, green and blue channels.  Alpha is ignored. */
    public static int maxChannelDifference(int argb1, int argb2) {
        int rDiff = Math.abs(getRed(argb1) - getRed(argb2));
        int gDiff = Math.abs(getGreen(argb1) - getGreen(argb2));
        int bDiff = Math.abs(getBlue(argb1) - getBlue(argb2));
        return Math.max(Math.max(rDiff, gDiff), bDiff);
    }

    /** True if the max-channel difference of the two pixels exceeds the threshold */
    public static boolean exceedsThreshold(int argb1, int argb2, int threshold) {
        return maxChannelDifference(argb1, argb2) > threshold;
    }

    /** Returns the three dimensional RGB distance, scaled by the mean alpha of both pixels, plus a small share of the alpha difference.
     * Two fully transparent pixels are always at distance 0, whatever their color channels hold.
     */
    public static double distance(int argb1, int argb2) {
        int a1 = getAlpha(argb1);
        int a2 = getAlpha(argb2);
        if (a1 == 0 && a2 == 0) return 0.0;

        double alphaFactor = (a1 + a2) / (2.0 * 255.0);
        int rDiff = getRed(argb1) - getRed(argb2);
        int gDiff = getGreen(argb1) - getGreen(argb2);
        int bDiff = getBlue(argb1) - getBlue(argb2);
        double rgbDistance = Math.sqrt(rDiff * rDiff + gDiff * gDiff + bDiff * bDiff);

        return rgbDistance * alphaFactor + Math.abs(a1 - a2) * ALPHA_DIFFERENCE_WEIGHT;
    }

    /** An efficient way of extracting alpha from the argb int value obtained from getRGB() */
    public static int getAlpha(int argb) {
        return (argb >>> 24) & 0x000000FF;
    }

    /** An efficient way of extracting red from the argb int value obtained from getRGB() */
    public static int getRed(int argb) {
        return (argb >> 16) & 0x000000FF;
    }

    /** An efficient way of extracting green from the argb int value obtained from getRGB() */
    public static int getGreen(int argb) {
        return (argb >> 8) & 0x000000FF;
    }

    /** An efficient way of extracting blue from the argb int value obtained from getRGB() */
    public static int getBlue(int argb) {
        return argb & 0x000000FF;
    }

    /** Packs 8-bit channels into an argb int */
    public static int argb(int alpha, int red, int green, int blue) {
        return (alpha & 0xFF) << 24 | (red & 0xFF) << 16 | (green & 0xFF) << 8 | (blue & 0xFF);
    }
}
