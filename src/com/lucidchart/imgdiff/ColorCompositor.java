package com.lucidchart.imgdiff;

import java.awt.Color;

import static com.lucidchart.imgdiff.ColorMetric.argb;
import static com.lucidchart.imgdiff.ColorMetric.getAlpha;
import static com.lucidchart.imgdiff.ColorMetric.getBlue;
import static com.lucidchart.imgdiff.ColorMetric.getGreen;
import static com.lucidchart.imgdiff.ColorMetric.getRed;

/** Blends the first image into the diff overlay, optionally pushing it toward a tint color.
 * All channel arithmetic truncates to 8 bits, it never rounds.
 */
public final class ColorCompositor {

    private ColorCompositor() {}

    /**
     * @param dst the current canvas pixel (the second image)
     * @param src the pixel of the first image shown through the overlay
     * @param transparency transparency of the source, 0.0 is opaque and 1.0 fully transparent
     * @param tint the color blended into the source when tinting is enabled
     * @param tintEnabled apply the tint before blending
     * @param tintStrength how far the source moves toward the tint, 0.0 none and 1.0 tint only
     * @param tintTransparency transparency of the tinted source, averaged with transparency
     * @return the blended argb pixel, with the larger of the two alphas
     */
    public static int blend(int dst, int src, double transparency, Color tint, boolean tintEnabled, double tintStrength, double tintTransparency) {
        int r;
        int g;
        int b;

        if (tintEnabled) {
            double srcWeight = 1.0 - tintStrength;
            int tr = (int) (getRed(src) * srcWeight + tint.getRed() * tintStrength);
            int tg = (int) (getGreen(src) * srcWeight + tint.getGreen() * tintStrength);
            int tb = (int) (getBlue(src) * srcWeight + tint.getBlue() * tintStrength);

            double effectiveTransparency = (transparency + tintTransparency) / 2;
            r = mix(tr, getRed(dst), effectiveTransparency);
            g = mix(tg, getGreen(dst), effectiveTransparency);
            b = mix(tb, getBlue(dst), effectiveTransparency);
        } else {
            r = mix(getRed(src), getRed(dst), transparency);
            g = mix(getGreen(src), getGreen(dst), transparency);
            b = mix(getBlue(src), getBlue(dst), transparency);
        }

        int a = Math.max(getAlpha(src), getAlpha(dst));
        return argb(a, r, g, b);
    }

    private static int mix(int source, int background, double transparency) {
        return (int) (source * (1 - transparency) + background * transparency);
    }
}
