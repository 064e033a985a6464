package com.astrofeather.model;

import java.util.Optional;

public final class FeatherResult {

    private final ComplexImage combined;
    private final Wcs wcs;
    private final BrightnessUnit unit;
    private final FitsImage regriddedLowRes;

    public FeatherResult(ComplexImage combined, Wcs wcs, BrightnessUnit unit, FitsImage regriddedLowRes) {
        this.combined = combined;
        this.wcs = wcs;
        this.unit = unit;
        this.regriddedLowRes = regriddedLowRes;
    }

    public ComplexImage combined() { return combined; }
    public Wcs wcs() { return wcs; }

    public Optional<FitsImage> regriddedLowRes() { return Optional.ofNullable(regriddedLowRes); }

    public FitsImage realImage() {
        return FitsImage.ofMatrix(combined.realPart(), wcs, unit);
    }
}
