package com.astrofeather.model;

import java.util.Arrays;

public final class FitsImage {

    private final double[] data;
    private final Wcs wcs;
    private final BrightnessUnit unit;

    public FitsImage(double[] data, Wcs wcs, BrightnessUnit unit) {
        if (data.length != wcs.size()) {
            throw new IllegalArgumentException("Datos (" + data.length + ") no coinciden con la forma " + Arrays.toString(wcs.shape()));
        }
        this.data = data;
        this.wcs = wcs;
        this.unit = unit == null ? BrightnessUnit.UNKNOWN : unit;
    }

    public static FitsImage ofMatrix(double[][] m, Wcs wcs, BrightnessUnit unit) {
        int rows = m.length, cols = m[0].length;
        double[] flat = new double[rows * cols];
        for (int y = 0; y < rows; y++) System.arraycopy(m[y], 0, flat, y * cols, cols);
        return new FitsImage(flat, wcs.withShape(rows, cols), unit);
    }

    public static FitsImage ofCube(double[][][] c, Wcs wcs, BrightnessUnit unit) {
        int planes = c.length, rows = c[0].length, cols = c[0][0].length;
        double[] flat = new double[planes * rows * cols];
        for (int k = 0; k < planes; k++)
            for (int y = 0; y < rows; y++)
                System.arraycopy(c[k][y], 0, flat, (k * rows + y) * cols, cols);
        return new FitsImage(flat, wcs.withShape(planes, rows, cols), unit);
    }

    public Wcs wcs() { return wcs; }
    public BrightnessUnit unit() { return unit; }
    public int rank() { return wcs.naxis(); }
    public int[] shape() { return wcs.shape(); }
    public long size() { return data.length; }
    public int rows() { return wcs.rows(); }
    public int cols() { return wcs.cols(); }

    public int planes() {
        int[] s = wcs.shape();
        int n = 1;
        for (int i = 0; i < s.length - 2; i++) n *= s[i];
        return n;
    }

    public double[][] plane(int k) {
        int rows = rows(), cols = cols();
        if (k < 0 || k >= planes()) throw new IndexOutOfBoundsException("Plano " + k + " fuera de rango");
        double[][] p = new double[rows][cols];
        int base = k * rows * cols;
        for (int y = 0; y < rows; y++) System.arraycopy(data, base + y * cols, p[y], 0, cols);
        return p;
    }

    public double[][] matrix() {
        return plane(0);
    }

    public double[][][] cube() {
        double[][][] c = new double[planes()][][];
        for (int k = 0; k < c.length; k++) c[k] = plane(k);
        return c;
    }

    public double get(int... index) {
        int[] s = wcs.shape();
        int off = 0;
        for (int i = 0; i < s.length; i++) off = off * s[i] + index[i];
        return data[off];
    }

    /** Un cubo de un solo canal como imagen 2-D; cualquier otra cosa, sin cambios. */
    public FitsImage singlePlane() {
        if (rank() == 3 && planes() == 1) return new FitsImage(data, wcs.celestial(), unit);
        return this;
    }

    public FitsImage withUnit(BrightnessUnit u) {
        return new FitsImage(data, wcs, u);
    }
}
