package com.astrofeather.model;

public enum MergePolicy {
    // Sustitución dura por la alta resolución donde ikfft supera el umbral
    REPLACE_HIRES,
    // kfft * fft_lo
    HIGHPASS_SD,
    // fft_lo / kfft, anulando donde kfft < min_beam_fraction
    DECONV_SD,
    DEFAULT
}
