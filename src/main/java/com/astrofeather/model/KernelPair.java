package com.astrofeather.model;

public class KernelPair {
    public final double[][] kfft;  // peso de la baja resolución
    public final double[][] ikfft; // 1 - kfft

    public KernelPair(double[][] kfft, double[][] ikfft) {
        this.kfft = kfft;
        this.ikfft = ikfft;
    }

    public int rows() { return kfft.length; }
    public int cols() { return kfft[0].length; }
}
