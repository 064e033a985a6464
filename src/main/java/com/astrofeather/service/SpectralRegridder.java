package com.astrofeather.service;

import com.astrofeather.exception.DimensionalityException;
import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.SpectralAxis;
import com.astrofeather.model.Wcs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SpectralRegridder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpectralRegridder.class);

    private static final double LINEAR_TOLERANCE = 1e-7;

    // outGrid en las unidades de CUNIT3
    public FitsImage regrid(FitsImage cube, double[] outGrid) {
        if (cube.rank() != 3) throw new DimensionalityException("El cubo a remuestrear", cube.rank(), 3);
        if (outGrid == null || outGrid.length < 2) {
            throw new PreconditionException("la rejilla de salida necesita al menos 2 canales");
        }
        SpectralAxis axis = cube.wcs().spectralAxis().orElseThrow(() ->
                new PreconditionException("el cubo no tiene eje espectral (CRVAL3/CDELT3)"));

        double[][][] data = cube.cube();
        double[] inAxis = axis.worldValues(data.length);
        if (inAxis.length < 2) throw new PreconditionException("el cubo necesita al menos 2 canales");

        double[] out = outGrid.clone();
        if (out[out.length - 1] < out[0]) reverse(out);
        if (inAxis[inAxis.length - 1] < inAxis[0]) {
            reverse(inAxis);
            reverse(data);
        }

        double inSpacing = meanSpacing(inAxis);
        double outSpacing = meanSpacing(out);
        for (int k = 1; k < out.length; k++) {
            double d = out[k] - out[k - 1];
            if (!(d > 0) || Math.abs(d - outSpacing) > LINEAR_TOLERANCE * Math.abs(outSpacing)) {
                throw new PreconditionException("la rejilla de salida debe ser lineal (canal " + k + ")");
            }
        }
        if (outSpacing > 2 * inSpacing) {
            throw new PreconditionException(String.format(
                    "la rejilla de entrada es demasiado fina (%g frente a %g): suavizar antes de remuestrear", inSpacing, outSpacing));
        }

        int rows = cube.rows(), cols = cube.cols();
        double[][][] result = new double[out.length][rows][cols];
        double[] spectrum = new double[inAxis.length];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                for (int k = 0; k < spectrum.length; k++) spectrum[k] = data[k][y][x];
                for (int k = 0; k < out.length; k++) result[k][y][x] = interp(out[k], inAxis, spectrum);
            }
        }
        LOGGER.info("Remuestreo espectral: {} -> {} canales (paso {} -> {})", inAxis.length, out.length, inSpacing, outSpacing);

        Wcs wcs = cube.wcs().withSpectralAxis(axis.relinearize(out[0], outSpacing));
        return FitsImage.ofCube(result, wcs, cube.unit());
    }

    /** Interpolación lineal con extremos fijados a las muestras de los bordes. */
    static double interp(double x, double[] xp, double[] fp) {
        int n = xp.length;
        if (x <= xp[0]) return fp[0];
        if (x >= xp[n - 1]) return fp[n - 1];
        int lo = 0, hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (xp[mid] <= x) lo = mid;
            else hi = mid;
        }
        double t = (x - xp[lo]) / (xp[hi] - xp[lo]);
        return fp[lo] + t * (fp[hi] - fp[lo]);
    }

    private static double meanSpacing(double[] v) {
        return (v[v.length - 1] - v[0]) / (v.length - 1);
    }

    private static void reverse(double[] a) {
        for (int i = 0, j = a.length - 1; i < j; i++, j--) {
            double t = a[i]; a[i] = a[j]; a[j] = t;
        }
    }

    private static void reverse(double[][][] a) {
        for (int i = 0, j = a.length - 1; i < j; i++, j--) {
            double[][] t = a[i]; a[i] = a[j]; a[j] = t;
        }
    }
}
