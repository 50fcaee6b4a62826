package com.lucidchart.imgdiff;

import java.awt.image.BufferedImage;
import java.util.Arrays;

import static com.lucidchart.imgdiff.Require.require;

/** An immutable grid of argb pixels with 8 bits per channel.
 *
 * The pixels of a {@link BufferedImage} are copied once on construction, so the comparison never goes through
 * the color model again and any number of worker threads may read the same instance without synchronization.
 */
public final class RasterImage {

    private final int width;
    private final int height;
    private final int[] pixels; // row major

    private RasterImage(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    //*** FACTORY METHODS ***

    /** Copies the pixels of a buffered image */
    public static RasterImage apply(BufferedImage image) {
        require(image != null, "An image must be provided");
        int w = image.getWidth();
        int h = image.getHeight();
        return new RasterImage(w, h, image.getRGB(0, 0, w, h, null, 0, w));
    }

    /** Wraps a copy of row major argb pixels */
    public static RasterImage apply(int width, int height, int[] argbPixels) {
        require(width >= 0 && height >= 0, "Image dimensions must not be negative");
        require(argbPixels != null && argbPixels.length == width * height, "Expected " + width * height + " pixels");
        return new RasterImage(width, height, argbPixels.clone());
    }

    /** An image of a single color */
    public static RasterImage filled(int width, int height, int argb) {
        require(width >= 0 && height >= 0, "Image dimensions must not be negative");
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, argb);
        return new RasterImage(width, height, pixels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getArea() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /** Returns the argb value of a pixel.  The caller is responsible for staying within bounds. */
    public int getRGB(int x, int y) {
        return pixels[y * width + x];
    }

    /** Converts back to an argb buffered image, e.g. for encoding */
    public BufferedImage toBufferedImage() {
        require(!isEmpty(), "An empty image can not be converted to a buffered image");
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    @Override
    public String toString() {
        return "RasterImage(w" + width + ",h" + height + ")";
    }

    /** Mutable pixel buffer used while composing an output image.  Not thread safe. */
    static final class Canvas {
        private final int width;
        private final int height;
        private final int[] pixels;

        Canvas(int width, int height) {
            this.width = width;
            this.height = height;
            this.pixels = new int[width * height];
        }

        int getWidth() {
            return width;
        }

        int getHeight() {
            return height;
        }

        boolean contains(int x, int y) {
            return x >= 0 && y >= 0 && x < width && y < height;
        }

        int getRGB(int x, int y) {
            return pixels[y * width + x];
        }

        /** Pixels outside the canvas are silently ignored */
        void setRGB(int x, int y, int argb) {
            if (contains(x, y)) pixels[y * width + x] = argb;
        }

        /** Copies an image onto the canvas with its top left corner at the origin, replacing what was there */
        void draw(RasterImage image) {
            int w = Math.min(width, image.width);
            for (int y = 0; y < Math.min(height, image.height); y++)
                System.arraycopy(image.pixels, y * image.width, pixels, y * width, w);
        }

        RasterImage toImage() {
            return new RasterImage(width, height, pixels.clone());
        }
    }
}
