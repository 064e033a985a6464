package com.astrofeather.model;

import java.util.Optional;

public final class CubeFeatherResult {

    private final double[][][] combined;
    private final Wcs wcs;
    private final BrightnessUnit unit;
    private final FitsImage regriddedLowRes;

    public CubeFeatherResult(double[][][] combined, Wcs wcs, BrightnessUnit unit, FitsImage regriddedLowRes) {
        this.combined = combined;
        this.wcs = wcs;
        this.unit = unit;
        this.regriddedLowRes = regriddedLowRes;
    }

    /** Parte real de cada plano combinado, indexado [canal][fila][columna]. */
    public double[][][] combined() { return combined; }
    public Wcs wcs() { return wcs; }
    public int planes() { return combined.length; }

    public Optional<FitsImage> regriddedLowRes() { return Optional.ofNullable(regriddedLowRes); }

    public FitsImage toImage() {
        return FitsImage.ofCube(combined, wcs, unit);
    }
}
