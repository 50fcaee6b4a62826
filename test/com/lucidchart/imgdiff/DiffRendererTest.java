package com.lucidchart.imgdiff;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.lucidchart.imgdiff.ColorMetric.argb;
import static com.lucidchart.imgdiff.TestUtil.BLACK;
import static com.lucidchart.imgdiff.TestUtil.WHITE;

public class DiffRendererTest {

    private final RasterImage first = RasterImage.filled(30, 30, WHITE);
    private final RasterImage second = RasterImage.filled(40, 20, BLACK);

    private DiffRenderer renderer(boolean overlay) {
        return new DiffRenderer(With.context().overlay(overlay).overlayTransparency(0.5).tint(false).toSettings());
    }

    @Test
    public void testCanvasCoversBothImages() {
        RasterImage result = renderer(true).render(first, second, Offset.ZERO, Collections.<Region>emptyList());
        Assert.assertEquals(result.getWidth(), 40);
        Assert.assertEquals(result.getHeight(), 30);
        Assert.assertEquals(result.getRGB(39, 19), BLACK);
        Assert.assertEquals(result.getRGB(0, 25), 0, "Area outside the second image stays transparent");
    }

    @Test
    public void testBorderAndOverlay() {
        RasterImage result = renderer(true).render(first, second, Offset.apply(5, 5), Collections.singletonList(Region.apply(0, 0, 20, 20)));

        Assert.assertEquals(result.getRGB(0, 0), DiffRenderer.BORDER_COLOR);
        Assert.assertEquals(result.getRGB(19, 10), DiffRenderer.BORDER_COLOR);
        Assert.assertEquals(result.getRGB(17, 10), DiffRenderer.BORDER_COLOR);
        Assert.assertEquals(result.getRGB(10, 2), DiffRenderer.BORDER_COLOR);

        // Blended white over black
        Assert.assertEquals(result.getRGB(10, 10), argb(255, 127, 127, 127));
        Assert.assertEquals(result.getRGB(16, 16), argb(255, 127, 127, 127));
        // (3, 3) maps to (-2, -2) of the first image, which does not exist
        Assert.assertEquals(result.getRGB(3, 3), BLACK);
        // Outside the region
        Assert.assertEquals(result.getRGB(25, 10), BLACK);
    }

    @Test
    public void testOverlayDisabled() {
        RasterImage result = renderer(false).render(first, second, Offset.ZERO, Collections.singletonList(Region.apply(0, 0, 20, 20)));
        Assert.assertEquals(result.getRGB(0, 0), DiffRenderer.BORDER_COLOR);
        Assert.assertEquals(result.getRGB(10, 10), BLACK);
    }

    @Test
    public void testTintedOverlay() {
        DiffRenderer tinted = new DiffRenderer(With.context()
                .overlayTransparency(0.5)
                .tint(true)
                .tintStrength(0.5)
                .tintTransparency(0.5)
                .toSettings());
        RasterImage result = tinted.render(first, second, Offset.ZERO, Collections.singletonList(Region.apply(0, 0, 20, 20)));
        // White tinted halfway to red is (255, 127, 127), then blended halfway over black
        Assert.assertEquals(result.getRGB(10, 10), argb(255, 127, 63, 63));
    }

    @Test
    public void testRegionsBeyondTheCanvasAreClipped() {
        RasterImage result = renderer(true).render(first, second, Offset.ZERO,
                Arrays.asList(Region.apply(30, 10, 50, 40), Region.apply(-5, -5, 2, 2)));
        Assert.assertEquals(result.getRGB(39, 12), DiffRenderer.BORDER_COLOR);
        Assert.assertEquals(result.getRGB(0, 0), DiffRenderer.BORDER_COLOR);
        Assert.assertEquals(result.getWidth(), 40);
    }
}
