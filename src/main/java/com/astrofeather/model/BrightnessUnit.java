package com.astrofeather.model;

import com.astrofeather.exception.PreconditionException;

import java.util.Locale;

public enum BrightnessUnit {
    JY_PER_BEAM(Family.FLUX_PER_BEAM, 1.0, "Jy/beam"),
    MJY_PER_BEAM(Family.FLUX_PER_BEAM, 1e-3, "mJy/beam"),
    UJY_PER_BEAM(Family.FLUX_PER_BEAM, 1e-6, "uJy/beam"),
    KELVIN(Family.TEMPERATURE, 1.0, "K"),
    MILLIKELVIN(Family.TEMPERATURE, 1e-3, "mK"),
    UNKNOWN(Family.NONE, 1.0, "");

    public enum Family { FLUX_PER_BEAM, TEMPERATURE, NONE }

    private final Family family;
    private final double scale;
    private final String fitsName;

    BrightnessUnit(Family family, double scale, String fitsName) {
        this.family = family;
        this.scale = scale;
        this.fitsName = fitsName;
    }

    public Family family() { return family; }
    public String fitsName() { return fitsName; }

    public boolean isBrightness() { return family != Family.NONE; }

    public boolean isEquivalent(BrightnessUnit other) {
        return isBrightness() && family == other.family;
    }

    /** Factor por el que multiplicar datos en esta unidad para expresarlos en {@code target}. */
    public double conversionTo(BrightnessUnit target) {
        if (!isEquivalent(target)) {
            throw new PreconditionException("unidades no equivalentes: '" + fitsName + "' vs '" + target.fitsName + "'");
        }
        return scale / target.scale;
    }

    private static final String[] FLUX_PER_BEAM_BODIES = { "jy/beam", "jy/bm", "jybeam-1", "jy.beam-1" };

    // El cuerpo de la unidad se compara sin mayúsculas; el prefijo SI no ("M" es mega, no mili)
    public static BrightnessUnit fromFits(String bunit) {
        if (bunit == null) return UNKNOWN;
        String s = bunit.trim().replace(" ", "");
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.equals("beam-1jy")) return JY_PER_BEAM;
        for (String body : FLUX_PER_BEAM_BODIES) {
            if (lower.endsWith(body)) {
                return withPrefix(s.substring(0, s.length() - body.length()), JY_PER_BEAM, MJY_PER_BEAM, UJY_PER_BEAM);
            }
        }
        if (lower.endsWith("k")) return withPrefix(s.substring(0, s.length() - 1), KELVIN, MILLIKELVIN, UNKNOWN);
        return UNKNOWN;
    }

    private static BrightnessUnit withPrefix(String prefix, BrightnessUnit base, BrightnessUnit milli, BrightnessUnit micro) {
        switch (prefix) {
            case "": return base;
            case "m": return milli;
            case "u": case "\u00b5": case "\u03bc": return micro;
            default: return UNKNOWN;
        }
    }
}
