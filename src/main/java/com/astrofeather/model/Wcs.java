package com.astrofeather.model;

import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;

import java.util.Arrays;
import java.util.Optional;

public final class Wcs {

    public enum Projection {
        TAN, SIN, LINEAR;

        public static Projection fromCtype(String ctype) {
            if (ctype == null) return LINEAR;
            String c = ctype.trim().toUpperCase();
            if (c.endsWith("-TAN")) return TAN;
            if (c.endsWith("-SIN")) return SIN;
            return LINEAR;
        }
    }

    private final int[] shape;
    private final double crpix1, crpix2;
    private final double crval1, crval2;
    private final double[][] cd;
    private final String ctype1, ctype2;
    private final Projection projection;
    private final SpectralAxis spectralAxis;
    private final double bmaj, bmin;
    private final double restFrequency;

    private Wcs(Builder b) {
        this.shape = b.shape.clone();
        this.crpix1 = b.crpix1; this.crpix2 = b.crpix2;
        this.crval1 = b.crval1; this.crval2 = b.crval2;
        this.cd = new double[][]{ b.cd[0].clone(), b.cd[1].clone() };
        this.ctype1 = b.ctype1; this.ctype2 = b.ctype2;
        this.projection = Projection.fromCtype(b.ctype1);
        this.spectralAxis = b.spectralAxis;
        this.bmaj = b.bmaj; this.bmin = b.bmin;
        this.restFrequency = b.restFrequency;
    }

    // --- GEOMETRÍA ---
    public int naxis() { return shape.length; }
    public int[] shape() { return shape.clone(); }
    public int rows() { return shape.length >= 2 ? shape[shape.length - 2] : 1; }
    public int cols() { return shape.length >= 1 ? shape[shape.length - 1] : 1; }
    public long size() {
        long n = 1;
        for (int s : shape) n *= s;
        return n;
    }

    public double crpix1() { return crpix1; }
    public double crpix2() { return crpix2; }
    public double crval1() { return crval1; }
    public double crval2() { return crval2; }
    public String ctype1() { return ctype1; }
    public String ctype2() { return ctype2; }
    public Projection projection() { return projection; }
    public double[][] cd() { return new double[][]{ cd[0].clone(), cd[1].clone() }; }
    public Optional<SpectralAxis> spectralAxis() { return Optional.ofNullable(spectralAxis); }

    /** Ángulo sólido de un píxel en grados², |det(CD)|. */
    public double pixelSolidAngle() {
        return Math.abs(cd[0][0] * cd[1][1] - cd[0][1] * cd[1][0]);
    }

    /** Escala de píxel en grados: raíz del ángulo sólido. */
    public double pixelScale() {
        return Math.sqrt(pixelSolidAngle());
    }

    public Optional<Angle> beamMajor() {
        return (Double.isFinite(bmaj) && bmaj > 0) ? Optional.of(Angle.degrees(bmaj)) : Optional.empty();
    }

    public Optional<Angle> beamMinor() {
        return (Double.isFinite(bmin) && bmin > 0) ? Optional.of(Angle.degrees(bmin)) : Optional.empty();
    }

    // --- TRANSFORMACIONES (píxeles FITS, base 1) ---
    public double[] pixelToWorld(double x, double y) {
        double dx = x - crpix1, dy = y - crpix2;
        double ix = cd[0][0] * dx + cd[0][1] * dy;
        double iy = cd[1][0] * dx + cd[1][1] * dy;

        if (projection == Projection.LINEAR) return new double[]{ crval1 + ix, crval2 + iy };

        double X = Math.toRadians(ix), Y = Math.toRadians(iy);
        double rho = Math.hypot(X, Y);
        if (rho == 0) return new double[]{ crval1, crval2 };
        if (projection == Projection.SIN && rho > 1.0) return new double[]{ Double.NaN, Double.NaN };

        double c = (projection == Projection.TAN) ? Math.atan(rho) : Math.asin(rho);
        double d0 = Math.toRadians(crval2);
        double sinC = Math.sin(c), cosC = Math.cos(c);
        double dec = Math.asin(cosC * Math.sin(d0) + Y * sinC * Math.cos(d0) / rho);
        double ra = Math.toRadians(crval1)
                + Math.atan2(X * sinC, rho * Math.cos(d0) * cosC - Y * Math.sin(d0) * sinC);
        return new double[]{ normalizeLongitude(Math.toDegrees(ra)), Math.toDegrees(dec) };
    }

    public double[] worldToPixel(double lon, double lat) {
        double ix, iy;
        if (projection == Projection.LINEAR) {
            ix = wrap180(lon - crval1);
            iy = lat - crval2;
        } else {
            double da = Math.toRadians(lon - crval1);
            double d = Math.toRadians(lat), d0 = Math.toRadians(crval2);
            double cosC = Math.sin(d0) * Math.sin(d) + Math.cos(d0) * Math.cos(d) * Math.cos(da);
            double X = Math.cos(d) * Math.sin(da);
            double Y = Math.cos(d0) * Math.sin(d) - Math.sin(d0) * Math.cos(d) * Math.cos(da);
            if (projection == Projection.TAN) {
                if (cosC <= 0) return new double[]{ Double.NaN, Double.NaN };
                X /= cosC; Y /= cosC;
            } else if (cosC < 0) {
                return new double[]{ Double.NaN, Double.NaN };
            }
            ix = Math.toDegrees(X);
            iy = Math.toDegrees(Y);
        }
        double det = cd[0][0] * cd[1][1] - cd[0][1] * cd[1][0];
        double dx = (cd[1][1] * ix - cd[0][1] * iy) / det;
        double dy = (-cd[1][0] * ix + cd[0][0] * iy) / det;
        return new double[]{ crpix1 + dx, crpix2 + dy };
    }

    // Ignora el eje espectral
    public boolean sameCelestialGrid(Wcs o) {
        return rows() == o.rows() && cols() == o.cols()
                && crpix1 == o.crpix1 && crpix2 == o.crpix2
                && crval1 == o.crval1 && crval2 == o.crval2
                && Arrays.equals(cd[0], o.cd[0]) && Arrays.equals(cd[1], o.cd[1])
                && projection == o.projection;
    }

    // --- DERIVADOS ---
    public Wcs withShape(int... newShape) {
        return toBuilder().shape(newShape).build();
    }

    public Wcs withSpectralAxis(SpectralAxis axis) {
        return toBuilder().spectralAxis(axis).build();
    }

    public Wcs celestial() {
        return toBuilder().shape(rows(), cols()).spectralAxis(null).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.shape = shape.clone();
        b.crpix1 = crpix1; b.crpix2 = crpix2; b.crval1 = crval1; b.crval2 = crval2;
        b.cd = cd();
        b.ctype1 = ctype1; b.ctype2 = ctype2;
        b.spectralAxis = spectralAxis;
        b.bmaj = bmaj; b.bmin = bmin; b.restFrequency = restFrequency;
        return b;
    }

    public static Builder builder() { return new Builder(); }

    // --- FITS ---
    /**
     * Lee el WCS de una cabecera. {@code fitsAxes} indica qué ejes FITS (base 1)
     * sobreviven tras eliminar los degenerados, en el mismo orden que {@code shape}.
     */
    public static Wcs fromHeader(Header h, int[] shape, int[] fitsAxes) {
        Builder b = builder().shape(shape)
                .crpix(h.getDoubleValue("CRPIX1", 1.0), h.getDoubleValue("CRPIX2", 1.0))
                .crval(h.getDoubleValue("CRVAL1", 0.0), h.getDoubleValue("CRVAL2", 0.0))
                .ctype(h.getStringValue("CTYPE1"), h.getStringValue("CTYPE2"))
                .beam(h.getDoubleValue("BMAJ", Double.NaN), h.getDoubleValue("BMIN", Double.NaN))
                .restFrequency(h.getDoubleValue("RESTFRQ", h.getDoubleValue("RESTFREQ", Double.NaN)));
        b.cd = readLinearMatrix(h);

        if (shape.length >= 3) {
            int n = fitsAxes[0];
            double cdelt = h.containsKey("CD" + n + "_" + n)
                    ? h.getDoubleValue("CD" + n + "_" + n, 1.0)
                    : h.getDoubleValue("CDELT" + n, 1.0) * h.getDoubleValue("PC" + n + "_" + n, 1.0);
            b.spectralAxis(new SpectralAxis(
                    h.getDoubleValue("CRPIX" + n, 1.0),
                    h.getDoubleValue("CRVAL" + n, 0.0),
                    cdelt,
                    h.getStringValue("CTYPE" + n),
                    h.getStringValue("CUNIT" + n)));
        }
        return b.build();
    }

    // PC + CDELT, CD, o CDELT + CROTA2 (en ese orden de preferencia)
    private static double[][] readLinearMatrix(Header h) {
        double cdelt1 = h.getDoubleValue("CDELT1", 1.0);
        double cdelt2 = h.getDoubleValue("CDELT2", 1.0);
        if (h.containsKey("PC1_1") || h.containsKey("PC2_2") || h.containsKey("PC1_2") || h.containsKey("PC2_1")) {
            return new double[][]{
                    { cdelt1 * h.getDoubleValue("PC1_1", 1.0), cdelt1 * h.getDoubleValue("PC1_2", 0.0) },
                    { cdelt2 * h.getDoubleValue("PC2_1", 0.0), cdelt2 * h.getDoubleValue("PC2_2", 1.0) }
            };
        }
        if (h.containsKey("CD1_1") || h.containsKey("CD2_2")) {
            return new double[][]{
                    { h.getDoubleValue("CD1_1", 0.0), h.getDoubleValue("CD1_2", 0.0) },
                    { h.getDoubleValue("CD2_1", 0.0), h.getDoubleValue("CD2_2", 0.0) }
            };
        }
        double rot = Math.toRadians(h.getDoubleValue("CROTA2", 0.0));
        return new double[][]{
                { cdelt1 * Math.cos(rot), -cdelt2 * Math.sin(rot) },
                { cdelt1 * Math.sin(rot), cdelt2 * Math.cos(rot) }
        };
    }

    public void writeTo(Header h) throws HeaderCardException {
        if (ctype1 != null) h.addValue("CTYPE1", ctype1, "");
        if (ctype2 != null) h.addValue("CTYPE2", ctype2, "");
        h.addValue("CRPIX1", crpix1, "");
        h.addValue("CRPIX2", crpix2, "");
        h.addValue("CRVAL1", crval1, "[deg]");
        h.addValue("CRVAL2", crval2, "[deg]");
        h.addValue("CD1_1", cd[0][0], "");
        h.addValue("CD1_2", cd[0][1], "");
        h.addValue("CD2_1", cd[1][0], "");
        h.addValue("CD2_2", cd[1][1], "");
        if (spectralAxis != null && naxis() == 3) {
            h.addValue("CTYPE3", spectralAxis.ctype == null ? "FREQ" : spectralAxis.ctype, "");
            h.addValue("CRPIX3", spectralAxis.crpix, "");
            h.addValue("CRVAL3", spectralAxis.crval, "");
            h.addValue("CDELT3", spectralAxis.cdelt, "");
            if (spectralAxis.cunit != null) h.addValue("CUNIT3", spectralAxis.cunit, "");
        }
        if (Double.isFinite(bmaj)) h.addValue("BMAJ", bmaj, "[deg]");
        if (Double.isFinite(bmin)) h.addValue("BMIN", bmin, "[deg]");
        if (Double.isFinite(restFrequency)) h.addValue("RESTFRQ", restFrequency, "[Hz]");
    }

    private static double normalizeLongitude(double lon) {
        double l = lon % 360.0;
        return l < 0 ? l + 360.0 : l;
    }

    private static double wrap180(double d) {
        return ((d + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
    }

    @Override
    public String toString() {
        return String.format("Wcs[%s %s crval=(%.6f, %.6f) crpix=(%.2f, %.2f) pix=%.3g deg shape=%s]",
                ctype1, ctype2, crval1, crval2, crpix1, crpix2, pixelScale(), Arrays.toString(shape));
    }

    public static final class Builder {
        private int[] shape = new int[0];
        private double crpix1 = 1, crpix2 = 1, crval1, crval2;
        private double[][] cd = { { 1, 0 }, { 0, 1 } };
        private String ctype1 = "RA---TAN", ctype2 = "DEC--TAN";
        private SpectralAxis spectralAxis;
        private double bmaj = Double.NaN, bmin = Double.NaN;
        private double restFrequency = Double.NaN;

        public Builder shape(int... s) { this.shape = s.clone(); return this; }
        public Builder crpix(double c1, double c2) { crpix1 = c1; crpix2 = c2; return this; }
        public Builder crval(double c1, double c2) { crval1 = c1; crval2 = c2; return this; }
        public Builder ctype(String c1, String c2) { ctype1 = c1; ctype2 = c2; return this; }
        public Builder cdelt(double d1, double d2) { cd = new double[][]{ { d1, 0 }, { 0, d2 } }; return this; }
        public Builder cd(double[][] m) { cd = new double[][]{ m[0].clone(), m[1].clone() }; return this; }
        public Builder spectralAxis(SpectralAxis a) { spectralAxis = a; return this; }
        public Builder beam(double majDeg, double minDeg) { bmaj = majDeg; bmin = minDeg; return this; }
        public Builder restFrequency(double hz) { restFrequency = hz; return this; }

        public Wcs build() {
            return new Wcs(this);
        }
    }
}
