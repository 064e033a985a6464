package com.astrofeather.service;

import com.astrofeather.model.ComplexImage;
import org.junit.jupiter.api.Test;

import static com.astrofeather.FeatherTestUtils.randomMatrix;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class FourierTransformTest {

    private static ComplexImage naiveDft(double[][] a) {
        int rows = a.length, cols = a[0].length;
        ComplexImage out = ComplexImage.zeros(rows, cols);
        for (int u = 0; u < rows; u++) {
            for (int v = 0; v < cols; v++) {
                double re = 0, im = 0;
                for (int y = 0; y < rows; y++) {
                    for (int x = 0; x < cols; x++) {
                        double phase = -2 * Math.PI * ((double) u * y / rows + (double) v * x / cols);
                        re += a[y][x] * Math.cos(phase);
                        im += a[y][x] * Math.sin(phase);
                    }
                }
                out.set(u, v, re, im);
            }
        }
        return out;
    }

    private static void assertClose(ComplexImage expected, ComplexImage actual, double tol) {
        for (int y = 0; y < expected.rows(); y++) {
            for (int x = 0; x < expected.cols(); x++) {
                assertEquals(expected.re(y, x), actual.re(y, x), tol, "re at " + y + "," + x);
                assertEquals(expected.im(y, x), actual.im(y, x), tol, "im at " + y + "," + x);
            }
        }
    }

    @Test
    public void testArbitrarySizeMatchesDirectDft() {
        double[][] a = randomMatrix(6, 10, 7L);
        assertClose(naiveDft(a), FourierTransform.forward(a), 1e-9);

        double[][] b = randomMatrix(13, 7, 11L);
        assertClose(naiveDft(b), FourierTransform.forward(b), 1e-9);
    }

    @Test
    public void testPowerOfTwoMatchesDirectDft() {
        double[][] a = randomMatrix(8, 16, 3L);
        assertClose(naiveDft(a), FourierTransform.forward(a), 1e-9);
    }

    @Test
    public void testInverseRecoversImage() {
        double[][] a = randomMatrix(9, 12, 5L);
        ComplexImage back = FourierTransform.inverse(FourierTransform.forward(a));
        for (int y = 0; y < 9; y++) {
            for (int x = 0; x < 12; x++) {
                assertEquals(a[y][x], back.re(y, x), 1e-10);
                assertEquals(0.0, back.im(y, x), 1e-10);
            }
        }
    }

    @Test
    public void testNonFiniteSamplesBecomeZero() {
        double[][] a = randomMatrix(5, 6, 1L);
        double[][] dirty = new double[5][];
        for (int y = 0; y < 5; y++) dirty[y] = a[y].clone();
        a[1][2] = 0.0;
        a[3][4] = 0.0;
        a[4][0] = 0.0;
        dirty[1][2] = Double.NaN;
        dirty[3][4] = Double.POSITIVE_INFINITY;
        dirty[4][0] = Double.NEGATIVE_INFINITY;
        assertClose(FourierTransform.forward(a), FourierTransform.forward(dirty), 0.0);
    }

    @Test
    public void testFftshiftMovesOriginToCentre() {
        double[][] a = new double[5][4];
        for (int y = 0; y < 5; y++)
            for (int x = 0; x < 4; x++) a[y][x] = y * 10 + x;
        double[][] s = FourierTransform.fftshift(a);
        assertEquals(0.0, s[2][2], "origin goes to (n/2, m/2)");
        assertEquals(a[4][3], s[1][1]);
        assertEquals(a[2][1], s[4][3]);
    }
}
