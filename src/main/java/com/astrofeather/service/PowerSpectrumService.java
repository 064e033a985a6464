package com.astrofeather.service;

import com.astrofeather.model.Angle;
import com.astrofeather.model.ComplexImage;
import com.astrofeather.model.FeatherOptions;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.KernelPair;
import com.astrofeather.model.PowerSpectrumProfile;
import com.astrofeather.model.RegriddedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class PowerSpectrumService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PowerSpectrumService.class);

    private final Regridder regridder;
    private final FeatherKernelBuilder kernelBuilder;

    public PowerSpectrumService() {
        this(new Regridder(), new FeatherKernelBuilder());
    }

    public PowerSpectrumService(Regridder regridder, FeatherKernelBuilder kernelBuilder) {
        this.regridder = regridder;
        this.kernelBuilder = kernelBuilder;
    }

    public PowerSpectrumProfile profile(ImageSource highRes, ImageSource lowRes, FeatherOptions options) throws IOException {
        FitsImage hi = highRes.resolve().singlePlane();
        FitsImage lo = lowRes.resolve().singlePlane();
        Angle fwhm = PlaneFeatherService.resolveFwhm(options.lowResFwhm(), lo);

        RegriddedImage rg = regridder.regrid(hi, lo);
        int rows = rg.rows(), cols = rg.cols();
        KernelPair kernels = kernelBuilder.build(rows, cols, fwhm, rg.pixelScale);
        LOGGER.debug("Esquina antes del desplazamiento: kfft={} ikfft={}", kernels.kfft[0][0], kernels.ikfft[0][0]);

        double[][] kfft = FourierTransform.fftshift(kernels.kfft);
        double[][] ikfft = FourierTransform.fftshift(kernels.ikfft);
        ComplexImage fftHi = FourierTransform.fftshift(FourierTransform.forward(
                PlaneFeatherService.scale(hi.matrix(), options.highResScale())));
        ComplexImage fftLo = FourierTransform.fftshift(FourierTransform.forward(
                PlaneFeatherService.scale(rg.data, options.lowResScale())));

        double[][] ampHi = fftHi.magnitude();
        double[][] ampLo = fftLo.magnitude();
        double[][] hiScaled = fftHi.times(ikfft).magnitude();
        double[][] loScaled = fftLo.times(kfft).magnitude();
        double[][] loDeconv = new double[rows][cols];
        for (int y = 0; y < rows; y++)
            for (int x = 0; x < cols; x++) loDeconv[y][x] = ampLo[y][x] / kfft[y][x];

        int[][] bin = radialBins(rows, cols);
        int nbins = 0;
        for (int[] row : bin) for (int b : row) nbins = Math.max(nbins, b + 1);

        double[] radius = new double[nbins];
        for (int b = 0; b < nbins; b++) radius[b] = b + 0.5;

        double pixscaleArcsec = rg.pixelScale * 3600.0;
        double[] scale = new double[nbins];
        double[] lambda = new double[nbins];
        for (int b = 0; b < nbins; b++) {
            scale[b] = cols / radius[b] * pixscaleArcsec;
            lambda[b] = 1.0 / Math.toRadians(scale[b] / 3600.0);
        }

        return new PowerSpectrumProfile(radius, scale, lambda,
                azimuthalAverage(kfft, bin, nbins),
                azimuthalAverage(ikfft, bin, nbins),
                azimuthalAverage(ampLo, bin, nbins),
                azimuthalAverage(ampHi, bin, nbins),
                azimuthalAverage(loScaled, bin, nbins),
                azimuthalAverage(hiScaled, bin, nbins),
                azimuthalAverage(loDeconv, bin, nbins));
    }

    /** Anillo entero de cada píxel respecto a ((cols-1)/2, (rows-1)/2). */
    static int[][] radialBins(int rows, int cols) {
        double cy = (rows - 1) / 2.0, cx = (cols - 1) / 2.0;
        int[][] bin = new int[rows][cols];
        for (int y = 0; y < rows; y++)
            for (int x = 0; x < cols; x++) bin[y][x] = (int) Math.floor(Math.hypot(x - cx, y - cy));
        return bin;
    }

    /** Media por anillo ignorando valores no finitos; anillos vacíos dan NaN. */
    static double[] azimuthalAverage(double[][] image, int[][] bin, int nbins) {
        double[] sum = new double[nbins];
        int[] count = new int[nbins];
        for (int y = 0; y < image.length; y++) {
            for (int x = 0; x < image[y].length; x++) {
                double v = image[y][x];
                if (!Double.isFinite(v)) continue;
                sum[bin[y][x]] += v;
                count[bin[y][x]]++;
            }
        }
        double[] avg = new double[nbins];
        for (int b = 0; b < nbins; b++) avg[b] = count[b] == 0 ? Double.NaN : sum[b] / count[b];
        return avg;
    }
}
