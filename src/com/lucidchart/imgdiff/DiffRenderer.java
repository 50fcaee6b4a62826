package com.lucidchart.imgdiff;

import java.awt.Color;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Draws the diff report: the second image with a red frame around each diff region,
 * and, when enabled, the aligned first image blended (and tinted) into the inside of each frame.
 */
public class DiffRenderer {

    static final int BORDER_THICKNESS = 3;
    static final int BORDER_COLOR = Color.RED.getRGB();

    private final DiffSettings settings;

    public DiffRenderer(DiffSettings settings) {
        this.settings = settings;
    }

    /** Returns a new image as large as the larger of both inputs on each axis.
     * Canvas area not covered by the second image is left fully transparent.
     */
    public RasterImage render(RasterImage imgA, RasterImage imgB, Offset offset, List<Region> regions) {
        long startTime = System.currentTimeMillis();
        int width = Math.max(imgA.getWidth(), imgB.getWidth());
        int height = Math.max(imgA.getHeight(), imgB.getHeight());

        LOG.info("render: creating {}x{} result image with {} region(s)", width, height, regions.size());
        if (settings.isOverlayEnabled()) {
            if (settings.isTintEnabled()) {
                Color tint = settings.getTint();
                LOG.info("render: applying tinted overlay (R:{} G:{} B:{}) with transparency {}, tint strength {}, tint transparency {}",
                        tint.getRed(), tint.getGreen(), tint.getBlue(),
                        settings.getOverlayTransparency(), settings.getTintStrength(), settings.getTintTransparency());
            } else {
                LOG.info("render: applying transparent overlay with transparency {}", settings.getOverlayTransparency());
            }
        }

        RasterImage.Canvas canvas = new RasterImage.Canvas(width, height);
        canvas.draw(imgB);

        for (Region region : regions) {
            if (settings.isOverlayEnabled()) drawOverlay(canvas, imgA, offset, region);
            drawBorder(canvas, region);
        }

        LOG.info("render: completed in {}ms", System.currentTimeMillis() - startTime);
        return canvas.toImage();
    }

    /** Blends the aligned first image into the inside of the frame, skipping pixels the first image does not cover */
    private void drawOverlay(RasterImage.Canvas canvas, RasterImage imgA, Offset offset, Region region) {
        for (int y = region.minY + BORDER_THICKNESS; y < region.maxY - BORDER_THICKNESS; y++)
            for (int x = region.minX + BORDER_THICKNESS; x < region.maxX - BORDER_THICKNESS; x++) {
                if (!canvas.contains(x, y)) continue;
                int srcX = x - offset.dx;
                int srcY = y - offset.dy;
                if (!imgA.contains(srcX, srcY)) continue;

                canvas.setRGB(x, y, ColorCompositor.blend(
                        canvas.getRGB(x, y),
                        imgA.getRGB(srcX, srcY),
                        settings.getOverlayTransparency(),
                        settings.getTint(),
                        settings.isTintEnabled(),
                        settings.getTintStrength(),
                        settings.getTintTransparency()));
            }
    }

    /** A solid frame, BORDER_THICKNESS wide, inside the region bounds */
    private static void drawBorder(RasterImage.Canvas canvas, Region region) {
        for (int x = region.minX; x < region.maxX; x++)
            for (int i = 0; i < BORDER_THICKNESS; i++) {
                if (region.minY + i < region.maxY) canvas.setRGB(x, region.minY + i, BORDER_COLOR);
                if (region.maxY - 1 - i >= region.minY) canvas.setRGB(x, region.maxY - 1 - i, BORDER_COLOR);
            }
        for (int y = region.minY; y < region.maxY; y++)
            for (int i = 0; i < BORDER_THICKNESS; i++) {
                if (region.minX + i < region.maxX) canvas.setRGB(region.minX + i, y, BORDER_COLOR);
                if (region.maxX - 1 - i >= region.minX) canvas.setRGB(region.maxX - 1 - i, y, BORDER_COLOR);
            }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DiffRenderer.class);
}
