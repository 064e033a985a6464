package com.astrofeather.model;

public class PowerSpectrumProfile {
    // Un valor por anillo de radio unidad
    public final double[] radius;
    public final double[] angularScaleArcsec;
    public final double[] baselineLambda;
    public final double[] kernel;
    public final double[] inverseKernel;

    // Promedios de |FFT|
    public final double[] lowRes;
    public final double[] highRes;
    public final double[] lowResScaled;
    public final double[] highResScaled;
    public final double[] lowResDeconvolved;

    public PowerSpectrumProfile(double[] radius, double[] angularScaleArcsec, double[] baselineLambda,
                                double[] kernel, double[] inverseKernel, double[] lowRes, double[] highRes,
                                double[] lowResScaled, double[] highResScaled, double[] lowResDeconvolved) {
        this.radius = radius;
        this.angularScaleArcsec = angularScaleArcsec;
        this.baselineLambda = baselineLambda;
        this.kernel = kernel;
        this.inverseKernel = inverseKernel;
        this.lowRes = lowRes;
        this.highRes = highRes;
        this.lowResScaled = lowResScaled;
        this.highResScaled = highResScaled;
        this.lowResDeconvolved = lowResDeconvolved;
    }

    public int bins() { return radius.length; }
}
