package com.astrofeather.service;

import com.astrofeather.model.ComplexImage;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DFT 2-D de tamaño arbitrario. Las longitudes potencia de 2 van directas a
 * commons-math; el resto pasa por el algoritmo de Bluestein (chirp-z) sobre
 * una FFT potencia de 2. Convención habitual: directa sin normalizar, inversa
 * dividida por N.
 */
public final class FourierTransform {

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);
    private static final Map<Integer, Chirp> CHIRPS = new ConcurrentHashMap<>();

    private FourierTransform() {}

    /** Transformada directa de una imagen real. Las muestras no finitas pasan a 0. */
    public static ComplexImage forward(double[][] image) {
        int rows = image.length, cols = image[0].length;
        ComplexImage in = ComplexImage.zeros(rows, cols);
        for (int y = 0; y < rows; y++) {
            if (image[y].length != cols) throw new IllegalArgumentException("Imagen irregular en la fila " + y);
            for (int x = 0; x < cols; x++) {
                double v = image[y][x];
                in.set(y, x, Double.isFinite(v) ? v : 0.0, 0.0);
            }
        }
        return transform2d(in, TransformType.FORWARD);
    }

    public static ComplexImage forward(ComplexImage field) {
        return transform2d(field, TransformType.FORWARD);
    }

    public static ComplexImage inverse(ComplexImage field) {
        return transform2d(field, TransformType.INVERSE);
    }

    private static ComplexImage transform2d(ComplexImage in, TransformType type) {
        int rows = in.rows(), cols = in.cols();
        ComplexImage out = ComplexImage.zeros(rows, cols);

        // Filas
        Complex[] row = new Complex[cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) row[x] = new Complex(in.re(y, x), in.im(y, x));
            Complex[] t = transform(row, type);
            for (int x = 0; x < cols; x++) out.set(y, x, t[x].getReal(), t[x].getImaginary());
        }
        // Columnas
        Complex[] col = new Complex[rows];
        for (int x = 0; x < cols; x++) {
            for (int y = 0; y < rows; y++) col[y] = new Complex(out.re(y, x), out.im(y, x));
            Complex[] t = transform(col, type);
            for (int y = 0; y < rows; y++) out.set(y, x, t[y].getReal(), t[y].getImaginary());
        }
        return out;
    }

    static Complex[] transform(Complex[] x, TransformType type) {
        int n = x.length;
        if (ArithmeticUtils.isPowerOfTwo(n)) return FFT.transform(x, type);
        if (type == TransformType.FORWARD) return bluestein(x);

        // ifft(x) = conj(fft(conj(x))) / n
        Complex[] c = new Complex[n];
        for (int i = 0; i < n; i++) c[i] = x[i].conjugate();
        Complex[] f = bluestein(c);
        for (int i = 0; i < n; i++) f[i] = f[i].conjugate().divide(n);
        return f;
    }

    private static Complex[] bluestein(Complex[] x) {
        int n = x.length;
        Chirp chirp = CHIRPS.computeIfAbsent(n, Chirp::new);
        int m = chirp.paddedLength;

        Complex[] a = new Complex[m];
        Arrays.fill(a, Complex.ZERO);
        for (int k = 0; k < n; k++) a[k] = x[k].multiply(chirp.w[k]);

        Complex[] fa = FFT.transform(a, TransformType.FORWARD);
        for (int i = 0; i < m; i++) fa[i] = fa[i].multiply(chirp.filterSpectrum[i]);
        Complex[] conv = FFT.transform(fa, TransformType.INVERSE);

        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) out[k] = conv[k].multiply(chirp.w[k]);
        return out;
    }

    /** Factores w_k = exp(-i pi k^2 / n) y espectro del filtro conj(w), por longitud. */
    private static final class Chirp {
        final Complex[] w;
        final Complex[] filterSpectrum;
        final int paddedLength;

        Chirp(int n) {
            int m = Integer.highestOneBit(2 * n - 1);
            if (m < 2 * n - 1) m <<= 1;
            this.paddedLength = m;

            w = new Complex[n];
            for (int k = 0; k < n; k++) {
                // k^2 mod 2n conserva la precisión para n grandes
                long k2 = ((long) k * k) % (2L * n);
                double angle = Math.PI * k2 / n;
                w[k] = new Complex(Math.cos(angle), -Math.sin(angle));
            }

            Complex[] b = new Complex[m];
            Arrays.fill(b, Complex.ZERO);
            b[0] = w[0].conjugate();
            for (int k = 1; k < n; k++) {
                b[k] = w[k].conjugate();
                b[m - k] = w[k].conjugate();
            }
            filterSpectrum = FFT.transform(b, TransformType.FORWARD);
        }
    }

    /** Desplazamiento circular de n/2 en cada eje: la frecuencia cero pasa al centro. */
    public static double[][] fftshift(double[][] a) {
        int rows = a.length, cols = a[0].length;
        int sy = rows / 2, sx = cols / 2;
        double[][] out = new double[rows][cols];
        for (int y = 0; y < rows; y++)
            for (int x = 0; x < cols; x++)
                out[(y + sy) % rows][(x + sx) % cols] = a[y][x];
        return out;
    }

    public static ComplexImage fftshift(ComplexImage a) {
        return new ComplexImage(fftshift(a.realPart()), fftshift(a.imaginaryPart()));
    }
}
