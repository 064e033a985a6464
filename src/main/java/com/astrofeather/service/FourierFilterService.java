package com.astrofeather.service;

import com.astrofeather.exception.DimensionalityException;
import com.astrofeather.model.Angle;
import com.astrofeather.model.ComplexImage;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.KernelPair;

/**
 * Filtros de Fourier sobre una sola imagen con su propio haz: deconvolución
 * simple de datos de antena única y máscara de enfoque (unsharp mask).
 * No son métodos de uso general; sirven para inspeccionar los datos.
 */
public class FourierFilterService {

    public static final double DEFAULT_MIN_VALUE = 0.1;

    private final FeatherKernelBuilder kernelBuilder;

    public FourierFilterService() {
        this(new FeatherKernelBuilder());
    }

    public FourierFilterService(FeatherKernelBuilder kernelBuilder) {
        this.kernelBuilder = kernelBuilder;
    }

    /** Divide por kfft sólo donde kfft > minValue; el resto conserva el valor original. */
    public ComplexImage simpleDeconvolve(FitsImage image, Angle fwhm, double minValue) {
        KernelPair k = kernelFor(image, fwhm);
        double[][] kfft = k.kfft;
        ComplexImage ft = FourierTransform.forward(image.matrix());
        for (int y = 0; y < ft.rows(); y++) {
            for (int x = 0; x < ft.cols(); x++) {
                if (kfft[y][x] > minValue) ft.set(y, x, ft.re(y, x) / kfft[y][x], ft.im(y, x) / kfft[y][x]);
            }
        }
        return FourierTransform.inverse(ft);
    }

    public ComplexImage fourierUnsharpMask(FitsImage image, Angle fwhm) {
        KernelPair k = kernelFor(image, fwhm);
        return FourierTransform.inverse(FourierTransform.forward(image.matrix()).times(k.ikfft));
    }

    private KernelPair kernelFor(FitsImage image, Angle fwhm) {
        image = image.singlePlane();
        if (image.rank() != 2) throw new DimensionalityException("La imagen a filtrar", image.rank(), 2);
        return kernelBuilder.build(image.rows(), image.cols(), fwhm, image.wcs().pixelScale());
    }
}
