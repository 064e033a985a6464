package com.astrofeather.service;

import com.astrofeather.model.Wcs;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WcsReprojector implements Reprojector {

    private static final Logger LOGGER = LoggerFactory.getLogger(WcsReprojector.class);

    public enum Interpolation { NEAREST, BILINEAR }

    private final Interpolation interpolation;

    public WcsReprojector() {
        this(Interpolation.BILINEAR);
    }

    public WcsReprojector(Interpolation interpolation) {
        this.interpolation = interpolation;
    }

    public Interpolation interpolation() { return interpolation; }

    @Override
    public double[][] reproject(double[][] source, Wcs sourceWcs, Wcs targetWcs) {
        return reprojectCube(new double[][][]{ source }, sourceWcs, targetWcs)[0];
    }

    @Override
    public double[][][] reprojectCube(double[][][] source, Wcs sourceWcs, Wcs targetWcs) {
        int rows = targetWcs.rows(), cols = targetWcs.cols();
        double[][][] out = new double[source.length][rows][cols];

        if (sourceWcs.sameCelestialGrid(targetWcs)) {
            LOGGER.debug("Mallas idénticas, se copia sin remuestrear");
            for (int k = 0; k < source.length; k++)
                for (int y = 0; y < rows; y++) out[k][y] = source[k][y].clone();
            return out;
        }

        // El mapa de coordenadas se calcula una vez y vale para todos los planos
        double[][] mapX = new double[rows][cols];
        double[][] mapY = new double[rows][cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                double[] world = targetWcs.pixelToWorld(x + 1, y + 1);
                double[] src = sourceWcs.worldToPixel(world[0], world[1]);
                mapX[y][x] = src[0] - 1;
                mapY[y][x] = src[1] - 1;
            }
        }

        int srcRows = source[0].length, srcCols = source[0][0].length;
        for (int k = 0; k < source.length; k++) {
            FloatProcessor ip = toProcessor(source[k], srcRows, srcCols);
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    out[k][y][x] = sample(ip, mapX[y][x], mapY[y][x], srcCols, srcRows);
                }
            }
        }
        return out;
    }

    private double sample(FloatProcessor ip, double x, double y, int width, int height) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) return Double.NaN;
        if (x < -0.5 || y < -0.5 || x > width - 0.5 || y > height - 0.5) return Double.NaN;
        if (interpolation == Interpolation.NEAREST) {
            int ix = Math.min(width - 1, Math.max(0, (int) Math.round(x)));
            int iy = Math.min(height - 1, Math.max(0, (int) Math.round(y)));
            return ip.getPixelValue(ix, iy);
        }
        return ip.getInterpolatedValue(x, y);
    }

    private static FloatProcessor toProcessor(double[][] plane, int rows, int cols) {
        float[] px = new float[rows * cols];
        for (int y = 0; y < rows; y++)
            for (int x = 0; x < cols; x++)
                px[y * cols + x] = (float) plane[y][x];
        return new FloatProcessor(cols, rows, px);
    }
}
