package com.astrofeather.service;

import com.astrofeather.exception.DimensionalityException;
import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.BrightnessUnit;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.SpectralAxis;
import com.astrofeather.model.Wcs;
import org.junit.jupiter.api.Test;

import static com.astrofeather.FeatherTestUtils.ARCSEC;
import static com.astrofeather.FeatherTestUtils.celestialWcs;
import static com.astrofeather.FeatherTestUtils.constantImage;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SpectralRegridderTest {

    private static final int PLANES = 6, ROWS = 3, COLS = 4;
    private static final double F0 = 1.0e11, DF = 1.0e6;

    private final SpectralRegridder regridder = new SpectralRegridder();

    /** Cube holding {@code channel + 0.1 * x} at every pixel. */
    private static FitsImage rampCube(SpectralAxis axis) {
        double[][][] c = new double[PLANES][ROWS][COLS];
        for (int k = 0; k < PLANES; k++)
            for (int y = 0; y < ROWS; y++)
                for (int x = 0; x < COLS; x++) c[k][y][x] = k + 0.1 * x;
        Wcs wcs = celestialWcs(ROWS, COLS, ARCSEC).toBuilder().spectralAxis(axis).build();
        return FitsImage.ofCube(c, wcs, BrightnessUnit.KELVIN);
    }

    private static double[] grid(double first, double step, int n) {
        double[] g = new double[n];
        for (int i = 0; i < n; i++) g[i] = first + i * step;
        return g;
    }

    @Test
    public void testLinearInterpolationBetweenChannels() {
        FitsImage cube = rampCube(new SpectralAxis(1.0, F0, DF, "FREQ", "Hz"));
        FitsImage out = regridder.regrid(cube, grid(F0 + 0.5 * DF, DF, 4));

        assertEquals(4, out.planes());
        for (int k = 0; k < 4; k++) assertEquals(k + 0.5 + 0.2, out.get(k, 1, 2), 1e-9);
        SpectralAxis axis = out.wcs().spectralAxis().orElseThrow();
        assertEquals(F0 + 0.5 * DF, axis.worldValue(0), 1e-3);
        assertEquals(DF, axis.cdelt, 1e-6);
        assertEquals("FREQ", axis.ctype);
        assertEquals(BrightnessUnit.KELVIN, out.unit());
    }

    @Test
    public void testValuesOutsideInputAreClamped() {
        FitsImage cube = rampCube(new SpectralAxis(1.0, F0, DF, "FREQ", "Hz"));
        FitsImage out = regridder.regrid(cube, grid(F0 - 3 * DF, 1.5 * DF, 8));
        assertEquals(0.0, out.get(0, 0, 0), 1e-12);
        assertEquals(PLANES - 1, out.get(7, 0, 0), 1e-12);
    }

    @Test
    public void testDescendingAxesAreHandled() {
        // channel k sits at F0 + 5 DF - k DF, so values fall with frequency
        FitsImage cube = rampCube(new SpectralAxis(1.0, F0 + 5 * DF, -DF, "FREQ", "Hz"));
        FitsImage out = regridder.regrid(cube, grid(F0 + 4 * DF, -DF, 3));
        assertEquals(3, out.planes());
        // grid reordered to F0 + 2, 3, 4 DF -> channels 3, 2, 1
        assertEquals(3.0, out.get(0, 0, 0), 1e-9);
        assertEquals(2.0, out.get(1, 0, 0), 1e-9);
        assertEquals(1.0, out.get(2, 0, 0), 1e-9);
        assertEquals(DF, out.wcs().spectralAxis().orElseThrow().cdelt, 1e-6);
    }

    @Test
    public void testNonLinearGridIsRejected() {
        FitsImage cube = rampCube(new SpectralAxis(1.0, F0, DF, "FREQ", "Hz"));
        PreconditionException e = assertThrows(PreconditionException.class,
                () -> regridder.regrid(cube, new double[]{ F0, F0 + DF, F0 + 3 * DF }));
        assertTrue(e.getMessage().contains("lineal"), e.getMessage());
    }

    @Test
    public void testCoarseOutputNeedsSmoothingFirst() {
        FitsImage cube = rampCube(new SpectralAxis(1.0, F0, DF, "FREQ", "Hz"));
        assertThrows(PreconditionException.class, () -> regridder.regrid(cube, grid(F0, 2.5 * DF, 2)));
        // exactly twice the input spacing is still accepted
        assertEquals(3, regridder.regrid(cube, grid(F0, 2 * DF, 3)).planes());
    }

    @Test
    public void testInvalidInputs() {
        FitsImage cube = rampCube(new SpectralAxis(1.0, F0, DF, "FREQ", "Hz"));
        assertThrows(PreconditionException.class, () -> regridder.regrid(cube, new double[]{ F0 }));

        FitsImage plane = constantImage(ROWS, COLS, 1.0, celestialWcs(ROWS, COLS, ARCSEC));
        assertThrows(DimensionalityException.class, () -> regridder.regrid(plane, grid(F0, DF, 3)));

        FitsImage noAxis = FitsImage.ofCube(new double[2][ROWS][COLS], celestialWcs(ROWS, COLS, ARCSEC), BrightnessUnit.KELVIN);
        assertThrows(PreconditionException.class, () -> regridder.regrid(noAxis, grid(F0, DF, 3)));
    }

    @Test
    public void testInterpolationHelper() {
        double[] xp = { 0, 1, 2 };
        double[] fp = { 10, 20, 40 };
        assertEquals(10.0, SpectralRegridder.interp(-1, xp, fp));
        assertEquals(15.0, SpectralRegridder.interp(0.5, xp, fp), 1e-12);
        assertEquals(30.0, SpectralRegridder.interp(1.5, xp, fp), 1e-12);
        assertEquals(40.0, SpectralRegridder.interp(5, xp, fp));
    }
}
