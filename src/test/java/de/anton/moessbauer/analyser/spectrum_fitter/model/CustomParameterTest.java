package de.anton.moessbauer.analyser.spectrum_fitter.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomParameterTest {

    @Test
    void parsesCompactForms() throws InvalidOptionsException {
        assertThat(CustomParameter.parse("0.35")).isEqualTo(CustomParameter.seed(0.35));
        assertThat(CustomParameter.parse("0.3:0.2:0.5")).isEqualTo(CustomParameter.bounded(0.3, 0.2, 0.5));
        assertThat(CustomParameter.parse("0.8:fixed")).isEqualTo(CustomParameter.fixed(0.8));
        assertThat(CustomParameter.parse(":0.1:0.4")).isEqualTo(new CustomParameter(null, 0.1, 0.4, null));
    }

    @Test
    void rejectsMalformedText() {
        assertThatThrownBy(() -> CustomParameter.parse("")).isInstanceOf(InvalidOptionsException.class);
        assertThatThrownBy(() -> CustomParameter.parse("abc")).isInstanceOf(InvalidOptionsException.class);
        assertThatThrownBy(() -> CustomParameter.parse("1:2")).isInstanceOf(InvalidOptionsException.class);
        assertThatThrownBy(() -> CustomParameter.parse(":fixed")).isInstanceOf(InvalidOptionsException.class);
    }

    @Test
    void readsMapWithVaryFlag() throws InvalidOptionsException {
        CustomParameter p = CustomParameter.fromMap("site1_amplitude", Map.of("value", 0.04, "vary", false));
        assertThat(p.value()).isEqualTo(0.04);
        assertThat(p.vary()).isFalse();
        assertThat(p.min()).isNull();
    }

    @Test
    void mapRejectsUnknownAttributesAndBadTypes() {
        assertThatThrownBy(() -> CustomParameter.fromMap("x", Map.of("step", 1)))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("step");
        assertThatThrownBy(() -> CustomParameter.fromMap("x", Map.of("vary", "no")))
            .isInstanceOf(InvalidOptionsException.class);
        assertThatThrownBy(() -> CustomParameter.fromMap("x", Map.of("value", "high")))
            .isInstanceOf(InvalidOptionsException.class);
    }
}
