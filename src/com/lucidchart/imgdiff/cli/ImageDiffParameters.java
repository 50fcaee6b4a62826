package com.lucidchart.imgdiff.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.lucidchart.imgdiff.DiffSettings;
import com.lucidchart.imgdiff.With;

import java.awt.Color;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line parameters for {@link ImageDiffTool}.
 * Defaults favor speed: progressive search with every 4th pixel sampled and a light tint on the overlay.
 */
@Parameters
public class ImageDiffParameters {

    public static final String DEFAULT_TINT_COLOR = "255,0,0";

    @Parameter(names = "--help", description = "Display this note", help = true)
    public boolean help;

    @Parameter(names = {"-i1", "--input1"}, description = "First image path", required = true)
    public String input1;

    @Parameter(names = {"-i2", "--input2"}, description = "Second image path", required = true)
    public String input2;

    @Parameter(names = {"-o", "--output"}, description = "Output diff image path (.png, .jpg or .jpeg), required unless --exit-on-diff is set")
    public String output;

    @Parameter(names = {"-m", "--max-offset"}, description = "Maximum pixel offset to search for alignment")
    public int maxOffset = DiffSettings.DEFAULT_MAX_OFFSET;

    @Parameter(names = {"-d", "--diff-threshold"}, description = "Color difference threshold (0-255)")
    public int threshold = DiffSettings.DEFAULT_THRESHOLD;

    @Parameter(names = {"-c", "--cpu"}, description = "Number of threads used to score alignment candidates")
    public int workerCount = Runtime.getRuntime().availableProcessors();

    @Parameter(names = {"-s", "--sampling"}, description = "Sampling rate for pixel comparison (1=all pixels, 2=every other pixel, etc)")
    public int samplingRate = 4;

    @Parameter(names = {"-p", "--precise"}, description = "Enable precise mode (disables the default fast mode for more accurate comparison)")
    public boolean precise;

    @Parameter(names = {"-od", "--overlay-disable"}, description = "Disable transparent overlay of the first image in diff areas")
    public boolean overlayDisabled;

    @Parameter(names = {"-ot", "--overlay-transparency"}, description = "Transparency level for overlay (0.0=opaque, 1.0=transparent)")
    public double overlayTransparency = 0.95;

    @Parameter(names = {"-td", "--tint-disable"}, description = "Disable color tint on overlay")
    public boolean tintDisabled;

    @Parameter(names = {"-tc", "--tint-color"}, description = "Tint color as R,G,B (0-255 for each value)")
    public String tintColor = DEFAULT_TINT_COLOR;

    @Parameter(names = {"-ts", "--tint-strength"}, description = "Tint strength (0.0=no tint, 1.0=full tint)")
    public double tintStrength = 0.05;

    @Parameter(names = {"-tw", "--tint-weight"}, description = "Transparency level for tint (0.0=opaque, 1.0=transparent)")
    public double tintTransparency = 0.2;

    @Parameter(names = {"-e", "--exit-on-diff"}, description = "Exit with status code 1 if differences are found (no diff image is saved then)")
    public boolean exitOnDiff;

    private transient JCommander jCommander;

    /**
     * Parses the arguments into this object.
     *
     * @return false if usage was displayed because help was requested or the arguments are invalid.
     */
    public boolean parse(String[] args) {
        jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName("java -jar imgdiff.jar")
                .build();

        boolean parseFailed = true;
        try {
            jCommander.parse(args);
            validate();
            parseFailed = false;
        } catch (ParameterException pe) {
            System.err.println("\nERROR: failed to parse command line arguments\n\n" + pe.getMessage() + "\n");
        }

        if (help || parseFailed) {
            jCommander.usage();
            return false;
        }
        return true;
    }

    private void validate() {
        if (!help && output == null && !exitOnDiff)
            throw new ParameterException("The following option is required: [-o | --output]");
    }

    /** Maps the flags onto comparison arguments, clamping out of range values */
    public With toWith() {
        return With.context()
                .maxOffset(maxOffset)
                .threshold(threshold)
                .workerCount(workerCount)
                .samplingRate(samplingRate)
                .fastMode(!precise)
                .overlay(!overlayDisabled)
                .overlayTransparency(overlayTransparency)
                .tint(parseTintColor(tintColor))
                .tint(!tintDisabled)
                .tintStrength(tintStrength)
                .tintTransparency(tintTransparency);
    }

    /**
     * Parses an "R,G,B" color.
     * A malformed value falls back to red, a component that is not a number falls back to the red default for that component,
     * and components are clamped to 0-255.
     */
    public static Color parseTintColor(String colorText) {
        String[] parts = colorText == null ? new String[0] : colorText.split(",", -1);
        if (parts.length != 3) {
            LOG.warn("parseTintColor: invalid tint color format '{}', using default ({})", colorText, DEFAULT_TINT_COLOR);
            return new Color(255, 0, 0);
        }
        int red = parseComponent(parts[0], "red", 255);
        int green = parseComponent(parts[1], "green", 0);
        int blue = parseComponent(parts[2], "blue", 0);
        return new Color(red, green, blue);
    }

    private static int parseComponent(String text, String name, int defaultValue) {
        try {
            return Math.max(0, Math.min(255, Integer.parseInt(text.trim())));
        } catch (NumberFormatException nfe) {
            LOG.warn("parseTintColor: invalid {} value '{}' in tint color, using default ({})", name, text, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "{input1='" + input1 + '\'' +
                ", input2='" + input2 + '\'' +
                ", output='" + output + '\'' +
                ", maxOffset=" + maxOffset +
                ", threshold=" + threshold +
                ", workerCount=" + workerCount +
                ", samplingRate=" + samplingRate +
                ", precise=" + precise +
                ", overlayDisabled=" + overlayDisabled +
                ", overlayTransparency=" + overlayTransparency +
                ", tintDisabled=" + tintDisabled +
                ", tintColor='" + tintColor + '\'' +
                ", tintStrength=" + tintStrength +
                ", tintTransparency=" + tintTransparency +
                ", exitOnDiff=" + exitOnDiff +
                '}';
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageDiffParameters.class);
}
