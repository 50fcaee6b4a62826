package com.lucidchart.imgdiff;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.List;

import static com.lucidchart.imgdiff.TestUtil.BLACK;
import static com.lucidchart.imgdiff.TestUtil.WHITE;

public class DiffRegionDetectorTest {

    private final DiffRegionDetector detector = new DiffRegionDetector(DiffSettings.defaults());

    @Test
    public void testIdenticalImages() {
        RasterImage image = TestUtil.square(50, 50, BLACK, 10, 10, 20, WHITE);
        Assert.assertTrue(detector.detectDiffRegions(image, image, Offset.ZERO).isEmpty());
        Assert.assertFalse(detector.hasDifferences(image, image, Offset.ZERO));
    }

    @Test
    public void testSingleDifference() {
        RasterImage first = RasterImage.filled(100, 100, BLACK);
        RasterImage second = TestUtil.square(100, 100, BLACK, 40, 40, 20, WHITE);

        List<Region> regions = detector.detectDiffRegions(first, second, Offset.ZERO);
        Assert.assertEquals(regions, Collections.singletonList(Region.apply(35, 35, 65, 65)));
        Assert.assertTrue(detector.hasDifferences(first, second, Offset.ZERO));
    }

    @Test
    public void testDifferenceInTheCornerIsCovered() {
        RasterImage first = RasterImage.filled(50, 50, BLACK);
        Region square = Region.apply(30, 30, 50, 50);

        List<Region> regions = detector.detectDiffRegions(first, TestUtil.square(50, 50, BLACK, 30, 30, 20, WHITE), Offset.ZERO);
        Assert.assertEquals(regions.size(), 1, "Unexpected regions " + regions);
        Assert.assertTrue(regions.get(0).contains(square, 0), "Unexpected region " + regions.get(0));

        regions = detector.detectDiffRegions(first, TestUtil.square(50, 50, BLACK, 0, 0, 20, WHITE), Offset.ZERO);
        Assert.assertEquals(regions.size(), 1, "Unexpected regions " + regions);
        Assert.assertTrue(regions.get(0).contains(Region.apply(0, 0, 20, 20), 0), "Unexpected region " + regions.get(0));
    }

    @Test
    public void testSeparateDifferences() {
        RasterImage first = RasterImage.filled(100, 100, BLACK);
        int[] pixels = new int[100 * 100];
        for (int y = 0; y < 100; y++)
            for (int x = 0; x < 100; x++) {
                boolean changed = (x >= 5 && x < 10 && y >= 5 && y < 10) || (x >= 80 && x < 85 && y >= 80 && y < 85);
                pixels[y * 100 + x] = changed ? WHITE : BLACK;
            }
        RasterImage second = RasterImage.apply(100, 100, pixels);

        List<Region> regions = detector.detectDiffRegions(first, second, Offset.ZERO);
        Assert.assertEquals(regions.size(), 2);
        Assert.assertTrue(regions.contains(Region.apply(0, 0, 17, 17)), "Unexpected regions " + regions);
        Assert.assertTrue(regions.contains(Region.apply(72, 72, 92, 92)), "Unexpected regions " + regions);
    }

    @Test
    public void testUnmappedAreaIsDifferent() {
        // Identical content, but the left 10 columns of the second image have no counterpart at this offset
        RasterImage image = RasterImage.filled(50, 50, WHITE);
        Offset offset = Offset.apply(10, 0);

        List<Region> regions = detector.detectDiffRegions(image, image, offset);
        Assert.assertEquals(regions, Collections.singletonList(Region.apply(0, 0, 17, 48)));
        Assert.assertFalse(detector.hasDifferences(image, image, offset), "Unmapped area is not checked for differences");
    }

    @Test
    public void testDifferenceAtOffset() {
        RasterImage first = TestUtil.square(60, 60, BLACK, 10, 10, 10, WHITE);
        RasterImage second = TestUtil.square(60, 60, BLACK, 15, 15, 10, WHITE);
        Assert.assertFalse(detector.hasDifferences(first, second, Offset.apply(5, 5)));
        Assert.assertTrue(detector.hasDifferences(first, second, Offset.ZERO));
    }

    @Test
    public void testSampledMaskMarksBlocks() {
        DiffRegionDetector sampled = new DiffRegionDetector(With.context().samplingRate(4).toSettings());
        RasterImage first = RasterImage.filled(10, 10, BLACK);
        RasterImage second = TestUtil.square(10, 10, BLACK, 4, 4, 1, WHITE);

        boolean[][] mask = sampled.buildDiffMask(first, second, Offset.ZERO);
        for (int y = 0; y < 10; y++)
            for (int x = 0; x < 10; x++)
                Assert.assertEquals(mask[y][x], x >= 4 && x < 8 && y >= 4 && y < 8, "Mask at (" + x + ", " + y + ")");
    }

    @Test
    public void testGroupingIsPadded() {
        boolean[][] mask = new boolean[50][50];
        mask[20][30] = true;
        Assert.assertEquals(DiffRegionDetector.groupDiffRegions(mask), Collections.singletonList(Region.apply(25, 15, 36, 26)));
        Assert.assertTrue(DiffRegionDetector.groupDiffRegions(new boolean[0][0]).isEmpty());
    }

    @Test
    public void testMinimumSize() {
        List<Region> sized = DiffRegionDetector.enforceMinimumSize(
                Collections.singletonList(Region.apply(25, 15, 36, 26)), 50, 50);
        Assert.assertEquals(sized, Collections.singletonList(Region.apply(20, 10, 40, 30)));

        List<Region> clipped = DiffRegionDetector.enforceMinimumSize(
                Collections.singletonList(Region.apply(0, 0, 11, 11)), 50, 50);
        Assert.assertEquals(clipped, Collections.singletonList(Region.apply(0, 0, 15, 15)));
    }
}
