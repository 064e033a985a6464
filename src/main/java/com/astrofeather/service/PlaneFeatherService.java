package com.astrofeather.service;

import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.Angle;
import com.astrofeather.model.FeatherOptions;
import com.astrofeather.model.FeatherResult;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.KernelPair;
import com.astrofeather.model.MergeResult;
import com.astrofeather.model.RegriddedImage;
import com.astrofeather.model.Wcs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class PlaneFeatherService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlaneFeatherService.class);

    // Residuo imaginario relativo a partir del cual algo va mal (centrado, regrid)
    private static final double IMAGINARY_WARN_FRACTION = 1e-6;
    private static final double ELLIPTICAL_BEAM_RATIO = 0.95;

    private final Regridder regridder;
    private final FeatherKernelBuilder kernelBuilder;
    private final FourierMerger merger;

    public PlaneFeatherService() {
        this(new Regridder(), new FeatherKernelBuilder(), new FourierMerger());
    }

    public PlaneFeatherService(Regridder regridder, FeatherKernelBuilder kernelBuilder, FourierMerger merger) {
        this.regridder = regridder;
        this.kernelBuilder = kernelBuilder;
        this.merger = merger;
    }

    public FeatherResult feather(ImageSource highRes, ImageSource lowRes, FeatherOptions options) throws IOException {
        FitsImage hi = highRes.resolve().singlePlane();
        FitsImage lo = lowRes.resolve().singlePlane();

        Angle fwhm = resolveFwhm(options.lowResFwhm(), lo);
        RegriddedImage rg = regridder.regrid(hi, lo);
        KernelPair kernels = kernelBuilder.build(rg.rows(), rg.cols(), fwhm, rg.pixelScale);

        MergeResult merged = merger.merge(kernels,
                scale(hi.matrix(), options.highResScale()),
                scale(rg.data, options.lowResScale()),
                options.merge());

        double imag = merged.combined.maxAbsImaginary();
        double real = merged.combined.maxAbsReal();
        if (real > 0 && imag > IMAGINARY_WARN_FRACTION * real) {
            LOGGER.warn("Residuo imaginario alto ({} frente a pico real {}): revisar regrid/centrado", imag, real);
        }
        LOGGER.info("Combinado {} + {} (fwhm={}, {})", highRes.describe(), lowRes.describe(), fwhm, options.merge().policy());

        return new FeatherResult(merged.combined, hi.wcs(), hi.unit(),
                options.keepRegridded() ? rg.toImage() : null);
    }

    /** FWHM explícito o, si falta, BMAJ de la imagen de baja resolución. */
    static Angle resolveFwhm(Angle explicit, FitsImage lowRes) {
        if (explicit != null) return explicit;
        Wcs wcs = lowRes.wcs();
        Angle bmaj = wcs.beamMajor().orElseThrow(() ->
                new PreconditionException("no se indicó FWHM y la imagen de baja resolución no tiene BMAJ"));
        // El kernel es circular
        wcs.beamMinor()
                .filter(bmin -> bmin.toArcsec() < ELLIPTICAL_BEAM_RATIO * bmaj.toArcsec())
                .ifPresent(bmin -> LOGGER.warn("Haz elíptico ({} x {}): el kernel usa sólo BMAJ", bmaj, bmin));
        return bmaj;
    }

    static double[][] scale(double[][] image, double factor) {
        double[][] out = new double[image.length][];
        for (int y = 0; y < image.length; y++) {
            out[y] = new double[image[y].length];
            for (int x = 0; x < image[y].length; x++) out[y][x] = image[y][x] * factor;
        }
        return out;
    }
}
