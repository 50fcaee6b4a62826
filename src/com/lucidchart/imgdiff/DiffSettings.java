package com.lucidchart.imgdiff;

import java.awt.Color;

import static com.lucidchart.imgdiff.Require.require;

/** The immutable settings of one comparison.
 * Build these through {@link With}, which clamps values into range.  Values handed in directly are checked, never clamped.
 */
public final class DiffSettings {

    public static final int DEFAULT_MAX_OFFSET = 10;
    public static final int DEFAULT_THRESHOLD = 30;
    public static final int DEFAULT_SAMPLING_RATE = 1;
    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final int DEFAULT_PROGRESS_STEP = 5;
    public static final double DEFAULT_OVERLAY_TRANSPARENCY = 0.3;
    public static final Color DEFAULT_TINT = new Color(255, 0, 0);
    public static final double DEFAULT_TINT_STRENGTH = 0.7;
    public static final double DEFAULT_TINT_TRANSPARENCY = 0.2;

    public static final int MAX_THRESHOLD = 255;

    private final int maxOffset;
    private final int threshold;
    private final int samplingRate;
    private final boolean fastMode;
    private final int workerCount;
    private final int progressStep;
    private final boolean overlayEnabled;
    private final double overlayTransparency;
    private final Color tint;
    private final boolean tintEnabled;
    private final double tintStrength;
    private final double tintTransparency;

    DiffSettings(int maxOffset, int threshold, int samplingRate, boolean fastMode, int workerCount, int progressStep,
                 boolean overlayEnabled, double overlayTransparency,
                 Color tint, boolean tintEnabled, double tintStrength, double tintTransparency) {
        require(maxOffset >= 0, "Max offset must be greater than or equal to 0");
        require(threshold >= 0 && threshold <= MAX_THRESHOLD, "Threshold must be between 0 and " + MAX_THRESHOLD);
        require(samplingRate >= 1, "Sampling rate must be greater than or equal to 1");
        require(workerCount >= 1, "Worker count must be greater than or equal to 1");
        require(progressStep >= 1 && progressStep <= 100, "Progress step must be between 1 and 100");
        require(isFraction(overlayTransparency), "Overlay transparency must be between 0.0 and 1.0");
        require(tint != null, "A tint color must be provided");
        require(isFraction(tintStrength), "Tint strength must be between 0.0 and 1.0");
        require(isFraction(tintTransparency), "Tint transparency must be between 0.0 and 1.0");

        this.maxOffset = maxOffset;
        this.threshold = threshold;
        this.samplingRate = samplingRate;
        this.fastMode = fastMode;
        this.workerCount = workerCount;
        this.progressStep = progressStep;
        this.overlayEnabled = overlayEnabled;
        this.overlayTransparency = overlayTransparency;
        this.tint = tint;
        this.tintEnabled = tintEnabled;
        this.tintStrength = tintStrength;
        this.tintTransparency = tintTransparency;
    }

    /** Settings with every default value */
    public static DiffSettings defaults() {
        return With.context().toSettings();
    }

    private static boolean isFraction(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    /** Search radius: offsets from -maxOffset to maxOffset are tried on both axes */
    public int getMaxOffset() {
        return maxOffset;
    }

    public int getThreshold() {
        return threshold;
    }

    public int getSamplingRate() {
        return samplingRate;
    }

    /** True for the progressive coarse-to-fine search */
    public boolean isFastMode() {
        return fastMode;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /** Percentage interval between progress log lines */
    public int getProgressStep() {
        return progressStep;
    }

    public boolean isOverlayEnabled() {
        return overlayEnabled;
    }

    public double getOverlayTransparency() {
        return overlayTransparency;
    }

    public Color getTint() {
        return tint;
    }

    public boolean isTintEnabled() {
        return tintEnabled;
    }

    public double getTintStrength() {
        return tintStrength;
    }

    public double getTintTransparency() {
        return tintTransparency;
    }

    @Override
    public String toString() {
        return "DiffSettings{" +
                "maxOffset=" + maxOffset +
                ", threshold=" + threshold +
                ", samplingRate=" + samplingRate +
                ", fastMode=" + fastMode +
                ", workerCount=" + workerCount +
                ", progressStep=" + progressStep +
                ", overlayEnabled=" + overlayEnabled +
                ", overlayTransparency=" + overlayTransparency +
                ", tint=(" + tint.getRed() + "," + tint.getGreen() + "," + tint.getBlue() + ")" +
                ", tintEnabled=" + tintEnabled +
                ", tintStrength=" + tintStrength +
                ", tintTransparency=" + tintTransparency +
                '}';
    }
}
