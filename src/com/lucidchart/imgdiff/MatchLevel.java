package com.lucidchart.imgdiff;

/**
 * Preset alignment search strategies.
 *
 * PRECISE compares every pixel of every candidate offset.
 * BALANCED samples every 4th pixel and narrows the search progressively, the command line default.
 * COARSE samples every 8th pixel with the progressive search, for large images where speed matters more than exactness.
 */
public class MatchLevel {
    public static final MatchLevel PRECISE = MatchLevel.apply(1, false);
    public static final MatchLevel BALANCED = MatchLevel.apply(4, true);
    public static final MatchLevel COARSE = MatchLevel.apply(8, true);

    public final int samplingRate;
    public final boolean fastMode;

    private MatchLevel(int samplingRate, boolean fastMode) {
        this.samplingRate = samplingRate;
        this.fastMode = fastMode;
    }

    public static MatchLevel apply(int samplingRate, boolean fastMode) {
        return new MatchLevel(Math.max(1, samplingRate), fastMode);
    }
}
