package com.astrofeather.service;

import com.astrofeather.exception.DimensionalityException;
import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.SpectralAxis;
import com.astrofeather.model.Wcs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Suavizado gaussiano a lo largo del eje espectral seguido de un diezmado
 * entero que mantiene el muestreo de Nyquist del cubo suavizado.
 */
public class SpectralSmoother {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpectralSmoother.class);

    // Truncado del kernel en sigmas
    private static final double TRUNCATE = 4.0;

    public FitsImage smoothAndDownsample(FitsImage cube, double fwhmChannels) {
        if (cube.rank() != 3) throw new DimensionalityException("El cubo a suavizar", cube.rank(), 3);
        if (!(fwhmChannels >= 1)) {
            throw new PreconditionException("el FWHM espectral debe ser al menos 1 canal: " + fwhmChannels);
        }
        SpectralAxis axis = cube.wcs().spectralAxis().orElseThrow(() ->
                new PreconditionException("el cubo no tiene eje espectral (CRVAL3/CDELT3)"));

        double sigma = fwhmChannels / FeatherKernelBuilder.FWHM_TO_SIGMA;
        double[] kernel = gaussian(sigma);
        int factor = (int) Math.floor(fwhmChannels);

        double[][][] data = cube.cube();
        int planes = data.length, rows = cube.rows(), cols = cube.cols();
        int outPlanes = (planes + factor - 1) / factor;
        double[][][] out = new double[outPlanes][rows][cols];

        double[] spectrum = new double[planes];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                for (int k = 0; k < planes; k++) spectrum[k] = data[k][y][x];
                for (int j = 0; j < outPlanes; j++) out[j][y][x] = convolveAt(spectrum, kernel, j * factor);
            }
        }
        LOGGER.info("Suavizado espectral sigma={} canales, diezmado x{}: {} -> {} canales", sigma, factor, planes, outPlanes);

        SpectralAxis ds = axis.relinearize(axis.worldValue(0), axis.cdelt * factor);
        Wcs wcs = cube.wcs().withSpectralAxis(ds);
        return FitsImage.ofCube(out, wcs, cube.unit());
    }

    /** Gaussiana normalizada de semianchura ceil(4 sigma). */
    static double[] gaussian(double sigma) {
        int half = (int) Math.ceil(TRUNCATE * sigma);
        double[] k = new double[2 * half + 1];
        double sum = 0;
        for (int i = -half; i <= half; i++) {
            k[i + half] = Math.exp(-0.5 * i * i / (sigma * sigma));
            sum += k[i + half];
        }
        for (int i = 0; i < k.length; i++) k[i] /= sum;
        return k;
    }

    // Ignora NaN y canales fuera del cubo, renormalizando con el peso que queda
    static double convolveAt(double[] spectrum, double[] kernel, int center) {
        int half = kernel.length / 2;
        double acc = 0, weight = 0;
        for (int i = -half; i <= half; i++) {
            int k = center + i;
            if (k < 0 || k >= spectrum.length) continue;
            double v = spectrum[k];
            if (Double.isNaN(v)) continue;
            acc += v * kernel[i + half];
            weight += kernel[i + half];
        }
        return weight > 0 ? acc / weight : Double.NaN;
    }
}
