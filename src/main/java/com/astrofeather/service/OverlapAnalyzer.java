package com.astrofeather.service;

import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.Angle;
import com.astrofeather.model.ComplexImage;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.KernelPair;
import com.astrofeather.model.OverlapResult;
import com.astrofeather.model.RegriddedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Compara alta resolución y baja resolución deconvolucionada en el rango de
 * escalas donde ambos instrumentos deberían coincidir. Sólo produce números;
 * el dibujo queda para quien lo consuma.
 */
public class OverlapAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(OverlapAnalyzer.class);

    private final Regridder regridder;
    private final FeatherKernelBuilder kernelBuilder;

    public OverlapAnalyzer() {
        this(new Regridder(), new FeatherKernelBuilder());
    }

    public OverlapAnalyzer(Regridder regridder, FeatherKernelBuilder kernelBuilder) {
        this.regridder = regridder;
        this.kernelBuilder = kernelBuilder;
    }

    public OverlapResult compare(ImageSource highRes, ImageSource lowRes, Angle sas, Angle las,
                                 Angle lowResFwhm, double minBeamFraction) throws IOException {
        if (!las.greaterThan(sas)) {
            throw new PreconditionException("LAS (" + las + ") debe ser mayor que SAS (" + sas + ")");
        }
        FitsImage hi = highRes.resolve().singlePlane();
        FitsImage lo = lowRes.resolve().singlePlane();
        Angle fwhm = PlaneFeatherService.resolveFwhm(lowResFwhm, lo);

        RegriddedImage rg = regridder.regrid(hi, lo);
        int rows = rg.rows(), cols = rg.cols();
        double pixscaleArcsec = rg.pixelScale * 3600.0;

        KernelPair kernels = kernelBuilder.build(rows, cols, fwhm, rg.pixelScale);
        double[][] kfft = FourierTransform.fftshift(kernels.kfft);

        ComplexImage fftHi = FourierTransform.fftshift(FourierTransform.forward(hi.matrix()));
        ComplexImage fftLo = FourierTransform.fftshift(FourierTransform.forward(rg.data));

        double sasArcsec = sas.toArcsec(), lasArcsec = las.toArcsec();
        double cy = (rows - 1) / 2.0, cx = (cols - 1) / 2.0;

        List<double[]> selected = new ArrayList<>();
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                double r = Math.hypot(x - cx, y - cy);
                // r = 0 da escala infinita, fuera de cualquier banda finita
                double scale = cols / r * pixscaleArcsec;
                if (!(scale > sasArcsec && scale < lasArcsec)) continue;

                double ampHi = fftHi.abs(y, x);
                double ampLo = kfft[y][x] < minBeamFraction ? Double.NaN : fftLo.abs(y, x) / kfft[y][x];
                selected.add(new double[]{ scale, ampHi, ampLo, ampHi / ampLo });
            }
        }
        if (selected.isEmpty()) {
            throw new PreconditionException(String.format(
                    "ningún píxel de Fourier entre SAS=%s y LAS=%s (malla %dx%d, %.3f\"/px)", sas, las, rows, cols, pixscaleArcsec));
        }

        int n = selected.size();
        double[] scales = new double[n], ampHi = new double[n], ampLo = new double[n], ratio = new double[n];
        for (int i = 0; i < n; i++) {
            double[] s = selected.get(i);
            scales[i] = s[0];
            ampHi[i] = s[1];
            ampLo[i] = s[2];
            ratio[i] = s[3];
        }
        OverlapResult result = new OverlapResult(scales, ampHi, ampLo, ratio);
        LOGGER.info("Solape {} - {}: {} píxeles, mediana alta/baja = {}", sas, las, n, result.medianRatio());
        return result;
    }
}
