package com.astrofeather.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Angle {

    private static final Pattern QUANTITY = Pattern.compile("\\s*([-+0-9.eE]+)\\s*([a-zA-Z°'\"]+)\\s*");

    public final double value;
    public final AngularUnit unit;

    public Angle(double value, AngularUnit unit) {
        this.value = value;
        this.unit = unit;
    }

    public static Angle degrees(double v) { return new Angle(v, AngularUnit.DEGREE); }
    public static Angle arcmin(double v) { return new Angle(v, AngularUnit.ARCMIN); }
    public static Angle arcsec(double v) { return new Angle(v, AngularUnit.ARCSEC); }

    public double toDegrees() { return unit.toDegrees(value); }
    public double toArcsec() { return AngularUnit.ARCSEC.fromDegrees(toDegrees()); }
    public double toRadians() { return Math.toRadians(toDegrees()); }

    public Angle to(AngularUnit target) {
        return new Angle(target.fromDegrees(toDegrees()), target);
    }

    public boolean greaterThan(Angle other) { return toDegrees() > other.toDegrees(); }

    /** Acepta "60 arcsec", "1arcmin", "0.01 deg". */
    public static Angle parse(String text) {
        Matcher m = QUANTITY.matcher(text);
        if (!m.matches()) throw new IllegalArgumentException("Ángulo inválido: '" + text + "'");
        return new Angle(Double.parseDouble(m.group(1)), AngularUnit.parse(m.group(2)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Angle)) return false;
        Angle a = (Angle) o;
        return Double.compare(value, a.value) == 0 && unit == a.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%g %s", value, unit.symbol());
    }
}
