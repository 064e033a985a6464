package com.astrofeather.service;

import com.astrofeather.model.ComplexImage;
import com.astrofeather.model.KernelPair;
import com.astrofeather.model.MergeOptions;
import com.astrofeather.model.MergePolicy;
import com.astrofeather.model.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Sin estado: una instancia puede usarse desde varios hilos
public class FourierMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(FourierMerger.class);

    public MergeResult merge(KernelPair kernels, double[][] highRes, double[][] lowRes, MergeOptions options) {
        checkShape(kernels, highRes, "alta resolución");
        checkShape(kernels, lowRes, "baja resolución");

        double[][] kfft = kernels.kfft;
        double[][] ikfft = kernels.ikfft;
        int rows = kernels.rows(), cols = kernels.cols();

        ComplexImage fftHi = FourierTransform.forward(highRes);
        ComplexImage fftLo = FourierTransform.forward(lowRes);

        MergePolicy policy = options.policy();
        LOGGER.debug("Combinando {}x{} con política {}", rows, cols, policy);

        ComplexImage sum = ComplexImage.zeros(rows, cols);
        if (policy == MergePolicy.REPLACE_HIRES) {
            double threshold = options.replaceHiresThreshold();
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    if (ikfft[y][x] > threshold) sum.set(y, x, fftHi.re(y, x), fftHi.im(y, x));
                    else sum.set(y, x, fftLo.re(y, x), fftLo.im(y, x));
                }
            }
        } else {
            double minBeam = options.minBeamFraction();
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    double loRe = fftLo.re(y, x), loIm = fftLo.im(y, x);
                    switch (policy) {
                        case HIGHPASS_SD:
                            loRe *= kfft[y][x];
                            loIm *= kfft[y][x];
                            break;
                        case DECONV_SD:
                            if (kfft[y][x] < minBeam) {
                                loRe = 0;
                                loIm = 0;
                            } else {
                                loRe /= kfft[y][x];
                                loIm /= kfft[y][x];
                            }
                            break;
                        default:
                            break;
                    }
                    sum.set(y, x,
                            loRe + ikfft[y][x] * fftHi.re(y, x),
                            loIm + ikfft[y][x] * fftHi.im(y, x));
                }
            }
        }

        ComplexImage combo = FourierTransform.inverse(sum);
        return new MergeResult(sum, combo);
    }

    private static void checkShape(KernelPair k, double[][] image, String what) {
        if (image.length != k.rows() || image[0].length != k.cols()) {
            throw new IllegalArgumentException(String.format("Imagen de %s %dx%d no coincide con el kernel %dx%d",
                    what, image.length, image[0].length, k.rows(), k.cols()));
        }
    }
}
