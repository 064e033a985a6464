package com.astrofeather.model;

public class MergeResult {
    public final ComplexImage fourierSum;
    public final ComplexImage combined; // transformada inversa, compleja

    public MergeResult(ComplexImage fourierSum, ComplexImage combined) {
        this.fourierSum = fourierSum;
        this.combined = combined;
    }
}
