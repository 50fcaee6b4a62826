package com.lucidchart.imgdiff;

import java.awt.Color;

/** A flexible way of specifying arguments in chain for an image diff.
 * This enables semantic calls and flexible updates of arguments without needing to maintain so many constructor alternatives.
 * Numeric values are clamped into their documented range as they are set.
 */
public class With {
    private int maxOffsetHolder = DiffSettings.DEFAULT_MAX_OFFSET;
    private int thresholdHolder = DiffSettings.DEFAULT_THRESHOLD;
    private int samplingRateHolder = DiffSettings.DEFAULT_SAMPLING_RATE;
    private boolean fastModeHolder = false;
    private int workerCountHolder = DiffSettings.DEFAULT_WORKER_COUNT;
    private int progressStepHolder = DiffSettings.DEFAULT_PROGRESS_STEP;

    private boolean overlayHolder = true;
    private double overlayTransparencyHolder = DiffSettings.DEFAULT_OVERLAY_TRANSPARENCY;
    private Color tintHolder = DiffSettings.DEFAULT_TINT;
    private boolean tintHolderEnabled = true;
    private double tintStrengthHolder = DiffSettings.DEFAULT_TINT_STRENGTH;
    private double tintTransparencyHolder = DiffSettings.DEFAULT_TINT_TRANSPARENCY;

    private With(){}

    /** Provides a With object to enable easy chaining of context options */
    public static With context() {
        return new With();
    }

    /** The largest offset, in pixels, tried on each axis when aligning the images (Default is 10) */
    public With maxOffset(int maxOffset) {
        maxOffsetHolder = Math.max(0, maxOffset);
        return this;
    }

    /** Color difference, 0-255, above which two pixels are considered different (Default is 30) */
    public With threshold(int threshold) {
        thresholdHolder = clamp(threshold, 0, DiffSettings.MAX_THRESHOLD);
        return this;
    }

    /** Compare every n-th pixel on both axes.  1 compares all pixels. */
    public With samplingRate(int samplingRate) {
        samplingRateHolder = Math.max(1, samplingRate);
        return this;
    }

    /** Use the progressive coarse-to-fine alignment search instead of the exhaustive one */
    public With fastMode(boolean fastMode) {
        fastModeHolder = fastMode;
        return this;
    }

    /** Number of threads scoring alignment candidates (Default is 4) */
    public With workerCount(int workerCount) {
        workerCountHolder = Math.max(1, workerCount);
        return this;
    }

    /** Percentage interval between progress log lines */
    public With progressStep(int progressStep) {
        progressStepHolder = clamp(progressStep, 1, 100);
        return this;
    }

    /** Show the first image through the highlighted regions */
    public With overlay(boolean enabled) {
        overlayHolder = enabled;
        return this;
    }

    /** Transparency of the overlay, 0.0 is opaque and 1.0 fully transparent */
    public With overlayTransparency(double transparency) {
        overlayTransparencyHolder = clamp(transparency);
        return this;
    }

    /** Color pushed into the overlay.  Alpha of the given color is ignored. */
    public With tint(Color tint) {
        if (tint != null) tintHolder = new Color(tint.getRed(), tint.getGreen(), tint.getBlue());
        return this;
    }

    public With tint(boolean enabled) {
        tintHolderEnabled = enabled;
        return this;
    }

    /** How far the overlay moves toward the tint, 0.0 none and 1.0 tint only */
    public With tintStrength(double tintStrength) {
        tintStrengthHolder = clamp(tintStrength);
        return this;
    }

    /** Transparency of the tinted overlay, 0.0 is opaque and 1.0 fully transparent */
    public With tintTransparency(double tintTransparency) {
        tintTransparencyHolder = clamp(tintTransparency);
        return this;
    }

    /** Specify a preset sampling strategy */
    public With matchLevel(MatchLevel matchLevel) {
        this.samplingRateHolder = matchLevel.samplingRate;
        this.fastModeHolder = matchLevel.fastMode;
        return this;
    }

    /** A snapshot of the current arguments.  Later calls on this object do not affect it. */
    public DiffSettings toSettings() {
        return new DiffSettings(
                maxOffsetHolder,
                thresholdHolder,
                samplingRateHolder,
                fastModeHolder,
                workerCountHolder,
                progressStepHolder,
                overlayHolder,
                overlayTransparencyHolder,
                tintHolder,
                tintHolderEnabled,
                tintStrengthHolder,
                tintTransparencyHolder);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
