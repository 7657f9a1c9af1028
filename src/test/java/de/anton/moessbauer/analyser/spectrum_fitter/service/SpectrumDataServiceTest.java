package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpectrumDataServiceTest {

    @TempDir
    Path tempDir;

    private final SpectrumDataService service = new SpectrumDataService();

    @Test
    void loadsTextSpectrum() throws IOException {
        Path file = tempDir.resolve("spectrum.txt");
        Files.writeString(file, "-1.0\t100\n0.0\t95\n1.0\t100\n");

        RawSpectrum spectrum = service.loadSpectrum(file.toFile());

        assertThat(spectrum.size()).isEqualTo(3);
    }

    @Test
    void wrapsReaderFailures() {
        assertThatThrownBy(() -> service.loadSpectrum(tempDir.resolve("missing.csv").toFile()))
            .isInstanceOf(IOException.class)
            .hasMessageStartingWith("Error reading spectrum file:");
    }

    @Test
    void rejectsNullFile() {
        assertThatThrownBy(() -> service.loadSpectrum(null)).isInstanceOf(NullPointerException.class);
    }
}
