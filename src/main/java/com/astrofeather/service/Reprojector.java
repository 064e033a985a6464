package com.astrofeather.service;

import com.astrofeather.model.Wcs;

// Las zonas sin cobertura quedan en NaN
public interface Reprojector {

    double[][] reproject(double[][] source, Wcs sourceWcs, Wcs targetWcs);

    /** Reproyección espacial de un cubo completo en una sola llamada. */
    double[][][] reprojectCube(double[][][] source, Wcs sourceWcs, Wcs targetWcs);
}
