package com.astrofeather.model;

public final class FeatherOptions {

    private Angle lowResFwhm;
    private double highResScale = 1.0;
    private double lowResScale = 1.0;
    private MergeOptions merge = MergeOptions.defaults();
    private boolean keepRegridded = false;
    private int workerThreads = 1;

    public static FeatherOptions defaults() {
        return new FeatherOptions();
    }

    public static FeatherOptions fromConfig() {
        FeatherOptions o = new FeatherOptions();
        o.merge = MergeOptions.defaults().withMinBeamFraction(AppConfig.getMinBeamFraction());
        o.keepRegridded = AppConfig.getWriteRegridded();
        o.workerThreads = AppConfig.getWorkerThreads();
        return o;
    }

    public FeatherOptions lowResFwhm(Angle fwhm) { this.lowResFwhm = fwhm; return this; }
    public FeatherOptions highResScale(double f) { this.highResScale = f; return this; }
    public FeatherOptions lowResScale(double f) { this.lowResScale = f; return this; }
    public FeatherOptions merge(MergeOptions m) { this.merge = m; return this; }
    public FeatherOptions keepRegridded(boolean k) { this.keepRegridded = k; return this; }
    public FeatherOptions workerThreads(int n) { this.workerThreads = Math.max(1, n); return this; }

    /** Puede ser null: entonces se usa BMAJ de la imagen de baja resolución. */
    public Angle lowResFwhm() { return lowResFwhm; }
    public double highResScale() { return highResScale; }
    public double lowResScale() { return lowResScale; }
    public MergeOptions merge() { return merge; }
    public boolean keepRegridded() { return keepRegridded; }
    public int workerThreads() { return workerThreads; }
}
