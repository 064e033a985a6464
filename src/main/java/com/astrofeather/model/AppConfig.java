package com.astrofeather.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_MIN_BEAM = "min_beam_fraction";
    private static final String KEY_FWHM = "lowres_fwhm_arcsec";
    private static final String KEY_THREADS = "worker_threads";
    private static final String KEY_INTERP = "interpolation";
    private static final String KEY_LAST_DIR = "last_directory";
    private static final String KEY_WRITE_RG = "write_regridded";

    // --- COMBINACIÓN ---
    public static double getMinBeamFraction() { return prefs.getDouble(KEY_MIN_BEAM, MergeOptions.DEFAULT_MIN_BEAM_FRACTION); }
    public static void setMinBeamFraction(double v) { prefs.putDouble(KEY_MIN_BEAM, v); }

    // 1 arcmin, como la antigua combinación de cubos
    public static double getDefaultFwhmArcsec() { return prefs.getDouble(KEY_FWHM, 60.0); }
    public static void setDefaultFwhmArcsec(double v) { prefs.putDouble(KEY_FWHM, v); }

    public static boolean getWriteRegridded() { return prefs.getBoolean(KEY_WRITE_RG, false); }
    public static void setWriteRegridded(boolean v) { prefs.putBoolean(KEY_WRITE_RG, v); }

    // --- RENDIMIENTO ---
    public static int getWorkerThreads() {
        return prefs.getInt(KEY_THREADS, Runtime.getRuntime().availableProcessors());
    }
    public static void setWorkerThreads(int v) { prefs.putInt(KEY_THREADS, Math.max(1, v)); }

    // --- REPROYECCIÓN ---
    public static String getInterpolation() { return prefs.get(KEY_INTERP, "BILINEAR"); }
    public static void setInterpolation(String v) { prefs.put(KEY_INTERP, v); }

    // --- UI ---
    public static String getLastDirectory() { return prefs.get(KEY_LAST_DIR, System.getProperty("user.home")); }
    public static void setLastDirectory(String v) { prefs.put(KEY_LAST_DIR, v); }
}
