package com.astrofeather.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MergeOptionsTest {

    @Test
    public void testDefaultPolicy() {
        MergeOptions o = MergeOptions.defaults();
        assertEquals(MergePolicy.DEFAULT, o.policy());
        assertTrue(Double.isNaN(o.replaceHiresThreshold()));
        assertEquals(MergeOptions.DEFAULT_MIN_BEAM_FRACTION, o.minBeamFraction());
    }

    @Test
    public void testPolicyPriority() {
        MergeOptions all = MergeOptions.defaults().withDeconvSD(true).withHighpassFilterSD(true).withReplaceHires(0.5);
        assertEquals(MergePolicy.REPLACE_HIRES, all.policy());
        assertEquals(MergePolicy.HIGHPASS_SD, MergeOptions.defaults().withDeconvSD(true).withHighpassFilterSD(true).policy());
        assertEquals(MergePolicy.DECONV_SD, MergeOptions.defaults().withDeconvSD(true).policy());
        assertEquals(MergePolicy.DEFAULT, MergeOptions.defaults().withDeconvSD(true).withDeconvSD(false).policy());
    }

    @Test
    public void testOptionsAreImmutable() {
        MergeOptions base = MergeOptions.defaults();
        MergeOptions tuned = base.withMinBeamFraction(0.3).withReplaceHires(0.2);
        assertEquals(MergePolicy.DEFAULT, base.policy());
        assertEquals(0.1, base.minBeamFraction());
        assertEquals(0.3, tuned.minBeamFraction());
        assertEquals(0.2, tuned.replaceHiresThreshold());
    }
}
