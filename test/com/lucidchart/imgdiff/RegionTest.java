package com.lucidchart.imgdiff;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.awt.Rectangle;

public class RegionTest {

    @Test
    public void testGeometry() {
        Region region = Region.ofSize(10, 20, 30, 40);
        Assert.assertEquals(region, Region.apply(10, 20, 40, 60));
        Assert.assertEquals(region.area(), 1200);
        Assert.assertEquals(region.getCenterX(), 25);
        Assert.assertEquals(region.getCenterY(), 40);
        Assert.assertEquals(region.toRectangle(), new Rectangle(10, 20, 30, 40));
        Assert.assertEquals(Region.apply(new Rectangle(10, 20, 30, 40)), region);
    }

    @Test
    public void testUnionAndIntersection() {
        Region first = Region.apply(0, 0, 20, 20);
        Region second = Region.apply(10, 5, 30, 15);
        Assert.assertEquals(first.union(second), Region.apply(0, 0, 30, 20));
        Assert.assertEquals(first.intersection(second), Region.apply(10, 5, 20, 15));
        Assert.assertFalse(first.intersection(Region.apply(20, 0, 40, 20)).isValid(), "Touching regions do not intersect");
    }

    @Test
    public void testContainsWithMargin() {
        Region outer = Region.apply(10, 10, 50, 50);
        Assert.assertTrue(outer.contains(Region.apply(5, 5, 55, 55), 5));
        Assert.assertFalse(outer.contains(Region.apply(4, 5, 55, 55), 5));
        Assert.assertTrue(outer.contains(10, 10));
        Assert.assertFalse(outer.contains(50, 10));
    }

    @Test
    public void testEmpty() {
        Assert.assertFalse(Region.EMPTY.isValid());
        Assert.assertEquals(Region.EMPTY.area(), 0);
    }
}
