package com.astrofeather.service;

import com.astrofeather.exception.PreconditionException;
import com.astrofeather.model.Angle;
import com.astrofeather.model.BrightnessUnit;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.OverlapResult;
import com.astrofeather.model.Wcs;
import org.junit.jupiter.api.Test;

import static com.astrofeather.FeatherTestUtils.ARCSEC;
import static com.astrofeather.FeatherTestUtils.celestialWcs;
import static com.astrofeather.FeatherTestUtils.randomMatrix;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

public class OverlapAnalyzerTest {

    private static final int N = 64;

    private final OverlapAnalyzer analyzer = new OverlapAnalyzer();

    private static ImageSource unresolvable() {
        return new ImageSource() {
            @Override public int[] shape() { return new int[]{ N, N }; }
            @Override public FitsImage resolve() { return fail("must not be resolved"); }
            @Override public String describe() { return "unresolvable"; }
        };
    }

    @Test
    public void testLargestScaleMustExceedSmallest() {
        assertThrows(PreconditionException.class, () -> analyzer.compare(unresolvable(), unresolvable(),
                Angle.arcsec(30), Angle.arcsec(10), Angle.arcsec(5), 0.1));
        assertThrows(PreconditionException.class, () -> analyzer.compare(unresolvable(), unresolvable(),
                Angle.arcmin(1), Angle.arcsec(60), Angle.arcsec(5), 0.1));
    }

    @Test
    public void testIdenticalImagesGiveKernelRatio() throws Exception {
        Wcs wcs = celestialWcs(N, N, ARCSEC);
        FitsImage img = FitsImage.ofMatrix(randomMatrix(N, N, 21L), wcs, BrightnessUnit.JY_PER_BEAM);
        double minBeam = 0.1;

        OverlapResult r = analyzer.compare(ImageSource.of(img), ImageSource.of(img),
                Angle.arcsec(3), Angle.arcsec(20), Angle.arcsec(4), minBeam);

        assertTrue(r.selected() > 0);
        assertEquals(r.selected(), r.angularScalesArcsec.length);
        assertEquals(r.selected(), r.highResAmplitude.length);
        assertEquals(r.selected(), r.lowResDeconvolvedAmplitude.length);
        for (double s : r.angularScalesArcsec) assertTrue(s > 3 && s < 20, "scale " + s + " outside the band");

        // hi / (lo / kfft) = kfft when both inputs are the same image
        double[] finite = r.finiteRatios();
        assertTrue(finite.length > 0);
        for (double ratio : finite) assertTrue(ratio >= minBeam - 1e-9 && ratio <= 1 + 1e-9, "ratio " + ratio);
        assertTrue(finite.length < r.selected(), "weak beam response must be masked as NaN");
    }

    @Test
    public void testEmptyBandFails() {
        Wcs wcs = celestialWcs(N, N, ARCSEC);
        FitsImage img = FitsImage.ofMatrix(randomMatrix(N, N, 22L), wcs, BrightnessUnit.JY_PER_BEAM);
        assertThrows(PreconditionException.class, () -> analyzer.compare(ImageSource.of(img), ImageSource.of(img),
                Angle.arcsec(1000), Angle.arcsec(2000), Angle.arcsec(4), 0.1));
    }

    @Test
    public void testScaledLowResShiftsMedian() throws Exception {
        Wcs wcs = celestialWcs(N, N, ARCSEC);
        double[][] data = randomMatrix(N, N, 23L);
        double[][] doubled = new double[N][N];
        for (int y = 0; y < N; y++)
            for (int x = 0; x < N; x++) doubled[y][x] = 2 * data[y][x];
        FitsImage hi = FitsImage.ofMatrix(data, wcs, BrightnessUnit.JY_PER_BEAM);
        FitsImage lo = FitsImage.ofMatrix(doubled, wcs, BrightnessUnit.JY_PER_BEAM);

        OverlapResult same = analyzer.compare(ImageSource.of(hi), ImageSource.of(hi),
                Angle.arcsec(3), Angle.arcsec(20), Angle.arcsec(4), 0.1);
        OverlapResult twice = analyzer.compare(ImageSource.of(hi), ImageSource.of(lo),
                Angle.arcsec(3), Angle.arcsec(20), Angle.arcsec(4), 0.1);
        assertEquals(same.medianRatio() / 2, twice.medianRatio(), 1e-9);
    }
}
