package com.astrofeather.model;

/**
 * Eje espectral lineal (CRPIX3/CRVAL3/CDELT3). Los canales se indexan desde 0.
 */
public class SpectralAxis {
    public final double crpix;
    public final double crval;
    public final double cdelt;
    public final String ctype;
    public final String cunit;

    public SpectralAxis(double crpix, double crval, double cdelt, String ctype, String cunit) {
        this.crpix = crpix;
        this.crval = crval;
        this.cdelt = cdelt;
        this.ctype = ctype;
        this.cunit = cunit;
    }

    public double worldValue(int channel) {
        return crval + (channel + 1 - crpix) * cdelt;
    }

    public double[] worldValues(int channels) {
        double[] v = new double[channels];
        for (int k = 0; k < channels; k++) v[k] = worldValue(k);
        return v;
    }

    public SpectralAxis relinearize(double firstValue, double spacing) {
        return new SpectralAxis(1.0, firstValue, spacing, ctype, cunit);
    }
}
