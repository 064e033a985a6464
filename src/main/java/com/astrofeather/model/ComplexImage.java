package com.astrofeather.model;

public final class ComplexImage {

    private final double[][] re;
    private final double[][] im;

    public ComplexImage(double[][] re, double[][] im) {
        if (re.length != im.length || re[0].length != im[0].length) {
            throw new IllegalArgumentException("Partes real e imaginaria con formas distintas");
        }
        this.re = re;
        this.im = im;
    }

    public static ComplexImage zeros(int rows, int cols) {
        return new ComplexImage(new double[rows][cols], new double[rows][cols]);
    }

    public int rows() { return re.length; }
    public int cols() { return re[0].length; }

    public double re(int y, int x) { return re[y][x]; }
    public double im(int y, int x) { return im[y][x]; }

    public void set(int y, int x, double real, double imag) {
        re[y][x] = real;
        im[y][x] = imag;
    }

    public double abs(int y, int x) { return Math.hypot(re[y][x], im[y][x]); }

    public double[][] realPart() { return copy(re); }
    public double[][] imaginaryPart() { return copy(im); }

    public double[][] magnitude() {
        double[][] m = new double[rows()][cols()];
        for (int y = 0; y < rows(); y++)
            for (int x = 0; x < cols(); x++) m[y][x] = abs(y, x);
        return m;
    }

    public double maxAbsReal() { return maxAbs(re); }
    public double maxAbsImaginary() { return maxAbs(im); }

    public ComplexImage copy() {
        return new ComplexImage(copy(re), copy(im));
    }

    public ComplexImage times(double[][] w) {
        ComplexImage out = zeros(rows(), cols());
        for (int y = 0; y < rows(); y++)
            for (int x = 0; x < cols(); x++) out.set(y, x, re[y][x] * w[y][x], im[y][x] * w[y][x]);
        return out;
    }

    private static double maxAbs(double[][] a) {
        double m = 0;
        for (double[] row : a) for (double v : row) m = Math.max(m, Math.abs(v));
        return m;
    }

    private static double[][] copy(double[][] a) {
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = a[i].clone();
        return c;
    }
}
