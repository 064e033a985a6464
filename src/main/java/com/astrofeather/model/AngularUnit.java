package com.astrofeather.model;

public enum AngularUnit {
    DEGREE(1.0, "deg"),
    ARCMIN(1.0 / 60.0, "arcmin"),
    ARCSEC(1.0 / 3600.0, "arcsec"),
    RADIAN(180.0 / Math.PI, "rad");

    private final double toDegrees;
    private final String symbol;

    AngularUnit(double toDegrees, String symbol) {
        this.toDegrees = toDegrees;
        this.symbol = symbol;
    }

    public double toDegrees(double value) { return value * toDegrees; }
    public double fromDegrees(double degrees) { return degrees / toDegrees; }
    public String symbol() { return symbol; }

    public static AngularUnit parse(String s) {
        String t = s.trim().toLowerCase();
        switch (t) {
            case "deg": case "degree": case "degrees": case "°": return DEGREE;
            case "arcmin": case "'": case "amin": return ARCMIN;
            case "arcsec": case "\"": case "asec": return ARCSEC;
            case "rad": case "radian": case "radians": return RADIAN;
            default: throw new IllegalArgumentException("Unidad angular desconocida: " + s);
        }
    }
}
