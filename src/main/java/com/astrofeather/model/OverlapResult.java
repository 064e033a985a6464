package com.astrofeather.model;

import java.util.Arrays;

/**
 * Comparación de amplitudes alta / baja resolución (deconvolucionada) en la
 * banda de escalas (SAS, LAS). Los arrays están alineados; los valores de
 * baja resolución enmascarados por {@code min_beam_fraction} son NaN.
 */
public class OverlapResult {
    public final double[] angularScalesArcsec;
    public final double[] highResAmplitude;
    public final double[] lowResDeconvolvedAmplitude;
    public final double[] ratio;

    public OverlapResult(double[] angularScalesArcsec, double[] highResAmplitude,
                         double[] lowResDeconvolvedAmplitude, double[] ratio) {
        this.angularScalesArcsec = angularScalesArcsec;
        this.highResAmplitude = highResAmplitude;
        this.lowResDeconvolvedAmplitude = lowResDeconvolvedAmplitude;
        this.ratio = ratio;
    }

    public int selected() { return ratio.length; }

    public double[] finiteRatios() {
        return Arrays.stream(ratio).filter(Double::isFinite).toArray();
    }

    public double medianRatio() {
        double[] r = finiteRatios();
        if (r.length == 0) return Double.NaN;
        Arrays.sort(r);
        int mid = r.length / 2;
        return (r.length % 2 == 0) ? (r[mid - 1] + r[mid]) / 2.0 : r[mid];
    }

    public double meanRatio() {
        return Arrays.stream(finiteRatios()).average().orElse(Double.NaN);
    }
}
