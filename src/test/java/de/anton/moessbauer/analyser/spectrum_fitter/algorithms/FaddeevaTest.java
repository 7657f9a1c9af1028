package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FaddeevaTest {

    @Test
    void originIsOne() {
        Complex w = Faddeeva.w(0.0, 0.0);
        assertThat(w.getReal()).isCloseTo(1.0, within(1e-7));
        assertThat(w.getImaginary()).isCloseTo(0.0, within(1e-7));
    }

    @Test
    void imaginaryAxisMatchesScaledComplementaryErrorFunction() {
        // w(i) = exp(1)·erfc(1)
        assertThat(Faddeeva.real(0.0, 1.0)).isCloseTo(0.4275835761558, within(1e-7));
        assertThat(Faddeeva.w(0.0, 1.0).getImaginary()).isCloseTo(0.0, within(1e-7));
    }

    @Test
    void offAxisReferenceValue() {
        Complex w = Faddeeva.w(2.0, 0.1);
        assertThat(w.getReal()).isCloseTo(0.0402014, within(1e-6));
        assertThat(w.getImaginary()).isCloseTo(0.3315827, within(1e-6));
    }

    @Test
    void realPartIsEvenInX() {
        assertThat(Faddeeva.real(1.3, 0.4)).isCloseTo(Faddeeva.real(-1.3, 0.4), within(1e-12));
    }

    @Test
    void lowerHalfPlaneIsRejected() {
        assertThatThrownBy(() -> Faddeeva.real(0.0, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
