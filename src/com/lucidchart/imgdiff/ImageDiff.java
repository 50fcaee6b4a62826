package com.lucidchart.imgdiff;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.lucidchart.imgdiff.Require.require;

/** A utility to compare two images that may be shifted against each other.
 *
 * The approach is to first find the integer offset that best aligns the second image with the first,
 * then to look for pixels that still differ at that offset, group them into regions,
 * and finally to render the second image with each region framed in red and the aligned first image blended into it.
 *
 * Alignment and the differences check run when the comparison is created.
 * Regions and the diff image are only computed when first requested, so a caller that only needs to know
 * whether the images differ does not pay for them.  Both are computed at most once, also when requested from several threads.
 */
public class ImageDiff {

    /** JPEG quality used when saving a diff image */
    private static final float JPEG_QUALITY = 0.9f;

    private final RasterImage first; // The reference image
    private final RasterImage second; // The image that is checked, and the base of the diff image
    private final DiffSettings settings;
    private final Offset offset;
    private final boolean differencesFound;
    private final Status status;

    /** Hold the results, when and if created */
    private List<Region> regions;
    private RasterImage diffImage;

    /** Compares two images with the given settings.
     *
     * @param first The image the second is aligned to.
     * @param second The image that is checked.  The diff image is drawn on top of it.
     * @param settings Immutable settings for the whole comparison.
     */
    private ImageDiff(RasterImage first, RasterImage second, DiffSettings settings) {
        require(first != null && second != null, "Both images must be provided");
        require(settings != null, "Settings must be provided");

        this.first = first;
        this.second = second;
        this.settings = settings;

        if (first.getWidth() != second.getWidth() || first.getHeight() != second.getHeight())
            LOG.warn("ImageDiff: image dimensions do not match, first {} and second {}", first, second);

        this.offset = new AlignmentSearcher(settings).findBestAlignment(first, second);
        this.differencesFound = new DiffRegionDetector(settings).hasDifferences(first, second, offset);
        this.status = differencesFound ? Status.FAILED : Status.PASSED;

        LOG.info("ImageDiff: detected offset {}, differences found: {}", offset, differencesFound);
    }



    /*
       ___          _                                 _   _               _
      / __\_ _  ___| |_ ___  _ __ _   _    /\/\   ___| |_| |__   ___   __| |___
     / _\/ _` |/ __| __/ _ \| '__| | | |  /    \ / _ \ __| '_ \ / _ \ / _` / __|
    / / | (_| | (__| || (_) | |  | |_| | / /\/\ \  __/ |_| | | | (_) | (_| \__ \
    \/   \__,_|\___|\__\___/|_|   \__, | \/    \/\___|\__|_| |_|\___/ \__,_|___/
                                  |___/
     */

    /** Compare two images using the default settings */
    public static ImageDiff apply(BufferedImage first, BufferedImage second) {
        return apply(first, second, With.context());
    }

    /** Compare two images using the matchLevel search strategy and otherwise default settings */
    public static ImageDiff apply(BufferedImage first, BufferedImage second, MatchLevel matchLevel) {
        require(matchLevel != null, "A match level must be supplied");
        return apply(first, second, With.context().matchLevel(matchLevel));
    }

    /** Compare two images with a chain of arguments */
    public static ImageDiff apply(BufferedImage first, BufferedImage second, With with) {
        require(with != null, "Arguments must be supplied");
        return new ImageDiff(toRaster(first, "first"), toRaster(second, "second"), with.toSettings());
    }

    public static ImageDiff apply(Path first, Path second, With with) {
        return ImageDiff.apply(getImage(first), getImage(second), with);
    }

    public static ImageDiff apply(File first, File second, With with) {
        return ImageDiff.apply(getImage(first), getImage(second), with);
    }

    /** Compare two encoded images */
    public static ImageDiff apply(byte[] first, byte[] second, With with) {
        return ImageDiff.apply(getImage(first), getImage(second), with);
    }

    public static ImageDiff apply(RasterImage first, RasterImage second, DiffSettings settings) {
        return new ImageDiff(first, second, settings);
    }

    private static RasterImage toRaster(BufferedImage image, String which) {
        require(image != null, "The " + which + " image must be provided");
        return RasterImage.apply(image);
    }



    /*
       ___       _     _ _              _   _ _ _ _   _
      / _ \_   _| |__ | (_) ___   /\ /\| |_(_) (_) |_(_) ___  ___
     / /_)/ | | | '_ \| | |/ __| / / \ \ __| | | | __| |/ _ \/ __|
    / ___/| |_| | |_) | | | (__  \ \_/ / |_| | | | |_| |  __/\__ \
    \/     \__,_|_.__/|_|_|\___|  \___/ \__|_|_|_|\__|_|\___||___/

     */

    /** The offset that best aligns the second image with the first */
    public Offset getOffset() {
        return offset;
    }

    /** True if any pixel pair differs beyond the threshold at the detected offset */
    public boolean hasDifferences() {
        return differencesFound;
    }

    /** True if no difference was found at the detected offset */
    public boolean isMatch() {
        return !differencesFound;
    }

    public Status getStatus() {
        return status;
    }

    public DiffSettings getSettings() {
        return settings;
    }

    /** The merged regions of the second image that differ, in its coordinates */
    public synchronized List<Region> getRegions() {
        if (regions == null)
            regions = Collections.unmodifiableList(new DiffRegionDetector(settings).detectDiffRegions(first, second, offset));
        return regions;
    }

    /** The second image with the diff regions framed, and overlaid if enabled */
    public synchronized RasterImage getDiffImage() {
        if (diffImage == null) diffImage = new DiffRenderer(settings).render(first, second, offset, getRegions());
        return diffImage;
    }

    /** Obtain an image from an array of bytes */
    public static BufferedImage getImage(byte[] image) {
        require(image != null, "Image bytes must be provided");
        try {
            return requireDecoded(ImageIO.read(new ByteArrayInputStream(image)), "array of bytes");
        } catch (IOException ioe) {
            throw new UncheckedIOException("Unable to obtain image from array of bytes", ioe);
        }
    }

    /** Obtain an image from a path */
    public static BufferedImage getImage(Path image) {
        require(image != null, "An image path must be provided");
        try {
            return requireDecoded(ImageIO.read(image.toFile()), image.toString());
        } catch (IOException ioe) {
            throw new UncheckedIOException("Unable to obtain image from path " + image, ioe);
        }
    }

    /** Obtain an image from a file */
    public static BufferedImage getImage(File image) {
        require(image != null, "An image file must be provided");
        return getImage(image.toPath());
    }

    /** ImageIO returns null, rather than failing, when no reader understands the content */
    private static BufferedImage requireDecoded(BufferedImage image, String source) {
        if (image == null) throw new IllegalArgumentException("Unsupported image format: " + source);
        return image;
    }

    /** Saves an image, picking PNG or JPEG from the file extension.  JPEG output drops the alpha channel. */
    public static void saveImage(RasterImage image, Path output) {
        require(image != null && output != null, "An image and an output path must be provided");
        String fileName = output.getFileName().toString();
        String extension = fileName.contains(".") ? fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT) : "";

        long startTime = System.currentTimeMillis();
        LOG.info("saveImage: saving diff image to {}", output);
        try {
            switch (extension) {
                case "png":
                    ImageIO.write(image.toBufferedImage(), "png", output.toFile());
                    break;
                case "jpg":
                case "jpeg":
                    writeJpeg(withoutAlpha(image.toBufferedImage()), output);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported output format: " + (extension.isEmpty() ? fileName : extension));
            }
        } catch (IOException ioe) {
            throw new UncheckedIOException("Unable to save image to " + output, ioe);
        }
        LOG.info("saveImage: image saved in {}ms", System.currentTimeMillis() - startTime);
    }

    private static void writeJpeg(BufferedImage image, Path output) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) throw new IllegalStateException("No JPEG writer available");
        ImageWriter writer = writers.next();
        Files.deleteIfExists(output); // the output stream overwrites in place without truncating
        try (ImageOutputStream out = ImageIO.createImageOutputStream(output.toFile())) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private static BufferedImage withoutAlpha(BufferedImage source) {
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < source.getWidth(); x++)
            for (int y = 0; y < source.getHeight(); y++)
                rgb.setRGB(x, y, source.getRGB(x, y));
        return rgb;
    }

    @Override
    public String toString() {
        return  "ImageDiff: " +
                "\n\nFirst Size = (w" + first.getWidth() + ",h" + first.getHeight() + ")" +
                "\nSecond Size = (w" + second.getWidth() + ",h" + second.getHeight() + ")" +
                "\nOffset = " + offset +
                "\nDifferences Found = " + differencesFound +
                "\nStatus = " + status.text +
                (regions != null ? "\nRegions = " + regions.size() : "") +
                "\nSettings = " + settings;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageDiff.class);
}
