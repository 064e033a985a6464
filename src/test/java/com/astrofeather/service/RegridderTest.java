package com.astrofeather.service;

import com.astrofeather.exception.DimensionalityException;
import com.astrofeather.model.BrightnessUnit;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.RegriddedImage;
import com.astrofeather.model.Wcs;
import org.junit.jupiter.api.Test;

import static com.astrofeather.FeatherTestUtils.ARCSEC;
import static com.astrofeather.FeatherTestUtils.celestialWcs;
import static com.astrofeather.FeatherTestUtils.constantImage;
import static com.astrofeather.FeatherTestUtils.cubeWcs;
import static com.astrofeather.FeatherTestUtils.randomCube;
import static com.astrofeather.FeatherTestUtils.randomMatrix;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RegridderTest {

    private final Regridder regridder = new Regridder();

    @Test
    public void testRejectsNonPlanarInput() {
        FitsImage plane = constantImage(8, 8, 1.0, celestialWcs(8, 8, ARCSEC));
        FitsImage cube = FitsImage.ofCube(randomCube(3, 8, 8, 1L), cubeWcs(3, 8, 8, ARCSEC), BrightnessUnit.JY_PER_BEAM);
        FitsImage line = new FitsImage(new double[8], Wcs.builder().shape(8).build(), BrightnessUnit.JY_PER_BEAM);

        DimensionalityException e = assertThrows(DimensionalityException.class, () -> regridder.regrid(plane, cube));
        assertTrue(e.getMessage().contains("NAXIS=3"), e.getMessage());
        assertThrows(DimensionalityException.class, () -> regridder.regrid(cube, plane));
        assertThrows(DimensionalityException.class, () -> regridder.regrid(plane, line));
    }

    @Test
    public void testIdenticalGridIsCopied() {
        Wcs wcs = celestialWcs(12, 10, 2 * ARCSEC);
        double[][] data = randomMatrix(12, 10, 2L);
        FitsImage ref = constantImage(12, 10, 0.0, wcs);
        FitsImage src = FitsImage.ofMatrix(data, wcs, BrightnessUnit.MJY_PER_BEAM);

        RegriddedImage rg = regridder.regrid(ref, src);
        for (int y = 0; y < 12; y++) assertArrayEquals(data[y], rg.data[y], 0.0);
        assertEquals(2 * ARCSEC, rg.pixelScale, 1e-15);
        assertEquals(BrightnessUnit.MJY_PER_BEAM, rg.unit);
    }

    @Test
    public void testResultCarriesReferenceFrame() {
        Wcs refWcs = celestialWcs(32, 32, ARCSEC);
        Wcs srcWcs = celestialWcs(16, 16, 2 * ARCSEC);
        FitsImage ref = constantImage(32, 32, 0.0, refWcs);
        FitsImage src = constantImage(16, 16, 3.0, srcWcs);

        RegriddedImage rg = regridder.regrid(ref, src);
        assertSame(refWcs, rg.wcs, "the reference coordinate metadata must be attached");
        assertEquals(32, rg.rows());
        assertEquals(32, rg.cols());
        assertEquals(ARCSEC, rg.pixelScale, 1e-15);
        for (int y = 0; y < 32; y++)
            for (int x = 0; x < 32; x++)
                assertEquals(3.0, rg.data[y][x], 1e-5, "at " + y + "," + x);
    }

    @Test
    public void testShiftedGridResamples() {
        Wcs refWcs = celestialWcs(10, 10, ARCSEC);
        // Same sky, reference pixel two columns further along the source
        Wcs srcWcs = refWcs.toBuilder().crpix(refWcs.crpix1() + 2, refWcs.crpix2()).build();
        double[][] data = new double[10][10];
        for (int y = 0; y < 10; y++)
            for (int x = 0; x < 10; x++) data[y][x] = y * 100 + x;

        RegriddedImage rg = regridder.regrid(constantImage(10, 10, 0, refWcs),
                FitsImage.ofMatrix(data, srcWcs, BrightnessUnit.JY_PER_BEAM));
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 8; x++) assertEquals(data[y][x + 2], rg.data[y][x], 1e-6);
            assertTrue(Double.isNaN(rg.data[y][8]), "outside the source footprint");
            assertTrue(Double.isNaN(rg.data[y][9]), "outside the source footprint");
        }
    }

    @Test
    public void testNearestNeighbourInterpolation() {
        Regridder nearest = new Regridder(new WcsReprojector(WcsReprojector.Interpolation.NEAREST));
        Wcs refWcs = celestialWcs(8, 8, ARCSEC);
        Wcs srcWcs = refWcs.toBuilder().crpix(refWcs.crpix1() + 1.2, refWcs.crpix2()).build();
        double[][] data = new double[8][8];
        for (int y = 0; y < 8; y++)
            for (int x = 0; x < 8; x++) data[y][x] = x;

        RegriddedImage rg = nearest.regrid(constantImage(8, 8, 0, refWcs),
                FitsImage.ofMatrix(data, srcWcs, BrightnessUnit.JY_PER_BEAM));
        assertEquals(1.0, rg.data[3][0], 0.0);
        assertEquals(5.0, rg.data[3][4], 0.0);
    }
}
