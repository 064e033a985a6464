package com.astrofeather.service;

import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.Angle;
import com.astrofeather.model.ComplexImage;
import com.astrofeather.model.KernelPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Construye los pesos de Fourier a partir del haz gaussiano de baja resolución.
 */
public class FeatherKernelBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeatherKernelBuilder.class);

    /** Conversión FWHM -> sigma: sqrt(8 ln 2). */
    public static final double FWHM_TO_SIGMA = Math.sqrt(8 * Math.log(2));

    /**
     * @param rows       nax2
     * @param cols       nax1
     * @param fwhm       FWHM del haz de baja resolución
     * @param pixelScale tamaño del píxel en grados
     */
    public KernelPair build(int rows, int cols, Angle fwhm, double pixelScale) {
        if (rows <= 0 || cols <= 0) {
            throw new PreconditionException("forma del kernel no positiva (" + rows + " x " + cols + ")");
        }
        if (fwhm == null || !(fwhm.toDegrees() > 0)) {
            throw new PreconditionException("FWHM debe ser positivo: " + fwhm);
        }
        if (!(pixelScale > 0)) {
            throw new PreconditionException("escala de píxel debe ser positiva: " + pixelScale);
        }

        // sigma en píxeles
        double sigma = fwhm.toDegrees() / FWHM_TO_SIGMA / pixelScale;
        LOGGER.debug("Kernel {}x{}: fwhm={} pixscale={} deg sigma={} px", rows, cols, fwhm, pixelScale, sigma);

        double cy = (rows - 1) / 2.0, cx = (cols - 1) / 2.0;
        double[][] gauss = new double[rows][cols];
        for (int y = 0; y < rows; y++) {
            double dy = y - cy;
            for (int x = 0; x < cols; x++) {
                double dx = x - cx;
                gauss[y][x] = Math.exp(-(dx * dx + dy * dy) / (2 * sigma * sigma));
            }
        }

        ComplexImage ft = FourierTransform.forward(FourierTransform.fftshift(gauss));
        double[][] kfft = ft.magnitude();

        double max = 0;
        for (double[] row : kfft) for (double v : row) max = Math.max(max, v);
        if (!(max > 0)) {
            throw new PreconditionException("kernel degenerado: FWHM demasiado pequeño frente al píxel (sigma=" + sigma + " px)");
        }

        double[][] ikfft = new double[rows][cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                kfft[y][x] /= max;
                ikfft[y][x] = 1 - kfft[y][x];
            }
        }
        return new KernelPair(kfft, ikfft);
    }
}
