package com.astrofeather.service;

import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.Angle;
import com.astrofeather.model.KernelPair;
import org.junit.jupiter.api.Test;

import static com.astrofeather.FeatherTestUtils.ARCSEC;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FeatherKernelBuilderTest {

    private final FeatherKernelBuilder builder = new FeatherKernelBuilder();

    @Test
    public void testKernelsAreComplementaryAndNormalized() {
        int[][] shapes = { { 16, 16 }, { 15, 20 }, { 33, 33 }, { 64, 48 } };
        double[] fwhms = { 3.0, 8.0, 20.0 };
        for (int[] s : shapes) {
            for (double fwhm : fwhms) {
                KernelPair k = builder.build(s[0], s[1], Angle.arcsec(fwhm), ARCSEC);
                double max = 0;
                for (int y = 0; y < s[0]; y++) {
                    for (int x = 0; x < s[1]; x++) {
                        assertEquals(1.0 - k.kfft[y][x], k.ikfft[y][x], 1e-15, "ikfft must be 1 - kfft");
                        assertTrue(k.kfft[y][x] >= 0, "kfft must be non-negative");
                        max = Math.max(max, k.kfft[y][x]);
                    }
                }
                assertEquals(1.0, max, 1e-12, "kfft must peak at 1 for " + s[0] + "x" + s[1] + " fwhm=" + fwhm);
                assertEquals(1.0, k.kfft[0][0], 1e-12, "zero frequency must carry the peak");
            }
        }
    }

    @Test
    public void testSquareGridIsIsotropic() {
        int n = 32;
        KernelPair k = builder.build(n, n, Angle.arcsec(6), ARCSEC);
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                // 90 degree rotation of the frequency plane: (u, v) -> (v, -u)
                assertEquals(k.kfft[u][v], k.kfft[v][(n - u) % n], 1e-9, "rotation at " + u + "," + v);
            }
        }
    }

    @Test
    public void testRectangularGridTransposes() {
        KernelPair a = builder.build(24, 40, Angle.arcsec(5), ARCSEC);
        KernelPair b = builder.build(40, 24, Angle.arcsec(5), ARCSEC);
        for (int y = 0; y < 24; y++)
            for (int x = 0; x < 40; x++)
                assertEquals(a.kfft[y][x], b.kfft[x][y], 1e-9);
    }

    @Test
    public void testKernelDecreasesWithFrequency() {
        int n = 64;
        KernelPair k = builder.build(n, n, Angle.arcsec(8), ARCSEC);
        for (int u = 0; u < n / 2; u++) {
            assertTrue(k.kfft[0][u + 1] <= k.kfft[0][u] + 1e-12, "kfft increases at u=" + u);
            assertTrue(k.kfft[u + 1][0] <= k.kfft[u][0] + 1e-12, "kfft increases at v=" + u);
        }
        assertTrue(k.kfft[0][n / 2] < 1e-6, "kfft should vanish at the Nyquist frequency");
    }

    @Test
    public void testWiderBeamNarrowsKernel() {
        KernelPair narrow = builder.build(32, 32, Angle.arcsec(3), ARCSEC);
        KernelPair wide = builder.build(32, 32, Angle.arcsec(9), ARCSEC);
        assertTrue(wide.kfft[0][3] < narrow.kfft[0][3]);
    }

    @Test
    public void testArcminAndArcsecAgree() {
        KernelPair a = builder.build(16, 16, Angle.arcmin(0.1), ARCSEC);
        KernelPair b = builder.build(16, 16, Angle.arcsec(6), ARCSEC);
        assertEquals(a.kfft[0][2], b.kfft[0][2], 1e-12);
    }

    @Test
    public void testRejectsMalformedInput() {
        assertThrows(PreconditionException.class, () -> builder.build(0, 16, Angle.arcsec(5), ARCSEC));
        assertThrows(PreconditionException.class, () -> builder.build(16, -1, Angle.arcsec(5), ARCSEC));
        assertThrows(PreconditionException.class, () -> builder.build(16, 16, Angle.arcsec(0), ARCSEC));
        assertThrows(PreconditionException.class, () -> builder.build(16, 16, Angle.arcsec(5), 0.0));
        assertThrows(PreconditionException.class, () -> builder.build(16, 16, null, ARCSEC));
    }
}
