package com.astrofeather;

import com.astrofeather.model.BrightnessUnit;
import com.astrofeather.model.FitsImage;
import com.astrofeather.model.SpectralAxis;
import com.astrofeather.model.Wcs;

import java.util.Random;

/**
 * Utility class for building synthetic images, cubes and coordinate metadata in tests.
 */
public final class FeatherTestUtils {

    /** One arcsecond in degrees. */
    public static final double ARCSEC = 1.0 / 3600.0;

    private FeatherTestUtils() {}

    /** TAN grid centred on (180, 30) with square pixels of {@code pixDeg} degrees. */
    public static Wcs celestialWcs(int rows, int cols, double pixDeg) {
        return Wcs.builder()
                .shape(rows, cols)
                .crpix((cols + 1) / 2.0, (rows + 1) / 2.0)
                .crval(180.0, 30.0)
                .cdelt(-pixDeg, pixDeg)
                .build();
    }

    public static Wcs cubeWcs(int planes, int rows, int cols, double pixDeg) {
        return celestialWcs(rows, cols, pixDeg).toBuilder()
                .shape(planes, rows, cols)
                .spectralAxis(new SpectralAxis(1.0, 1.0e11, 1.0e6, "FREQ", "Hz"))
                .build();
    }

    public static FitsImage constantImage(int rows, int cols, double value, Wcs wcs) {
        double[][] m = new double[rows][cols];
        for (double[] row : m) java.util.Arrays.fill(row, value);
        return FitsImage.ofMatrix(m, wcs, BrightnessUnit.JY_PER_BEAM);
    }

    public static double[][] randomMatrix(int rows, int cols, long seed) {
        Random rnd = new Random(seed);
        double[][] m = new double[rows][cols];
        for (int y = 0; y < rows; y++)
            for (int x = 0; x < cols; x++) m[y][x] = rnd.nextDouble() * 10.0 - 2.0;
        return m;
    }

    public static double[][][] randomCube(int planes, int rows, int cols, long seed) {
        double[][][] c = new double[planes][][];
        for (int k = 0; k < planes; k++) c[k] = randomMatrix(rows, cols, seed + k);
        return c;
    }

    public static double[][] filled(int rows, int cols, double value) {
        double[][] m = new double[rows][cols];
        for (double[] row : m) java.util.Arrays.fill(row, value);
        return m;
    }
}
