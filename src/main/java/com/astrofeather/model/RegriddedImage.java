package com.astrofeather.model;

public class RegriddedImage {
    public final double[][] data;
    public final Wcs wcs; // siempre el de la referencia
    public final BrightnessUnit unit;
    public final double pixelScale;

    public RegriddedImage(double[][] data, Wcs wcs, BrightnessUnit unit, double pixelScale) {
        this.data = data;
        this.wcs = wcs;
        this.unit = unit;
        this.pixelScale = pixelScale;
    }

    public int rows() { return data.length; }
    public int cols() { return data[0].length; }

    public FitsImage toImage() {
        return FitsImage.ofMatrix(data, wcs, unit);
    }
}
