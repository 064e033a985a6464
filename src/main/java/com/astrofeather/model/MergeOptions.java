package com.astrofeather.model;

// Con varias políticas activas: replace > highpass > deconv > default
public final class MergeOptions {

    public static final double DEFAULT_MIN_BEAM_FRACTION = 0.1;

    private final Double replaceHiresThreshold;
    private final boolean highpassFilterSD;
    private final boolean deconvSD;
    private final double minBeamFraction;

    private MergeOptions(Double replaceHiresThreshold, boolean highpassFilterSD, boolean deconvSD, double minBeamFraction) {
        this.replaceHiresThreshold = replaceHiresThreshold;
        this.highpassFilterSD = highpassFilterSD;
        this.deconvSD = deconvSD;
        this.minBeamFraction = minBeamFraction;
    }

    public static MergeOptions defaults() {
        return new MergeOptions(null, false, false, DEFAULT_MIN_BEAM_FRACTION);
    }

    public MergeOptions withReplaceHires(double threshold) {
        return new MergeOptions(threshold, highpassFilterSD, deconvSD, minBeamFraction);
    }

    public MergeOptions withHighpassFilterSD(boolean v) {
        return new MergeOptions(replaceHiresThreshold, v, deconvSD, minBeamFraction);
    }

    public MergeOptions withDeconvSD(boolean v) {
        return new MergeOptions(replaceHiresThreshold, highpassFilterSD, v, minBeamFraction);
    }

    public MergeOptions withMinBeamFraction(double v) {
        return new MergeOptions(replaceHiresThreshold, highpassFilterSD, deconvSD, v);
    }

    public MergePolicy policy() {
        if (replaceHiresThreshold != null) return MergePolicy.REPLACE_HIRES;
        if (highpassFilterSD) return MergePolicy.HIGHPASS_SD;
        if (deconvSD) return MergePolicy.DECONV_SD;
        return MergePolicy.DEFAULT;
    }

    public double replaceHiresThreshold() {
        return replaceHiresThreshold == null ? Double.NaN : replaceHiresThreshold;
    }

    public double minBeamFraction() { return minBeamFraction; }

    @Override
    public String toString() {
        return "MergeOptions[" + policy() + ", replace=" + replaceHiresThreshold + ", minBeamFraction=" + minBeamFraction + "]";
    }
}
