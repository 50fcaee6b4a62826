package com.lucidchart.imgdiff;

import org.testng.Assert;
import org.testng.annotations.Test;

import static com.lucidchart.imgdiff.ColorMetric.argb;

public class ColorMetricTest {

    @Test
    public void testChannelExtraction() {
        int pixel = argb(0x80, 0x11, 0x22, 0x33);
        Assert.assertEquals(ColorMetric.getAlpha(pixel), 0x80);
        Assert.assertEquals(ColorMetric.getRed(pixel), 0x11);
        Assert.assertEquals(ColorMetric.getGreen(pixel), 0x22);
        Assert.assertEquals(ColorMetric.getBlue(pixel), 0x33);
    }

    @Test
    public void testMaxChannelDifference() {
        int first = argb(255, 10, 20, 30);
        int second = argb(0, 40, 25, 0);
        Assert.assertEquals(ColorMetric.maxChannelDifference(first, second), 30);
        Assert.assertEquals(ColorMetric.maxChannelDifference(second, first), 30);
    }

    @Test
    public void testThresholdIsExclusive() {
        int first = argb(255, 10, 20, 30);
        int second = argb(255, 40, 20, 30);
        Assert.assertFalse(ColorMetric.exceedsThreshold(first, second, 30));
        Assert.assertTrue(ColorMetric.exceedsThreshold(first, second, 29));
        Assert.assertFalse(ColorMetric.exceedsThreshold(first, first, 0));
    }

    @Test
    public void testTransparentPixelsAreEqual() {
        Assert.assertEquals(ColorMetric.distance(argb(0, 255, 0, 0), argb(0, 0, 0, 255)), 0.0);
    }

    @Test
    public void testOpaqueDistance() {
        Assert.assertEquals(ColorMetric.distance(TestUtil.BLACK, TestUtil.WHITE), 255 * Math.sqrt(3), 1e-9);
        Assert.assertEquals(ColorMetric.distance(TestUtil.WHITE, TestUtil.WHITE), 0.0);
    }

    @Test
    public void testAlphaDifferenceOnly() {
        // Same color, one opaque and one transparent: half the alpha factor on a zero distance plus the alpha term
        Assert.assertEquals(ColorMetric.distance(argb(255, 0, 0, 0), argb(0, 0, 0, 0)), 255 * 0.3, 1e-9);
    }
}
